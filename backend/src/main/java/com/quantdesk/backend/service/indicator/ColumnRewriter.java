package com.quantdesk.backend.service.indicator;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual rename of a column reference inside indicator source. Covers bracket access and mapping
 * keys in both quote styles, plus {@code 'dataset@column'} literals. Only exact quoted matches are
 * touched, so {@code 'sma_fast'} survives a rename of {@code 'sma'}.
 */
@Component
public class ColumnRewriter {

    public String rewrite(String sourceCode, String oldColumn, String newColumn) {
        if (sourceCode == null || oldColumn == null || newColumn == null || oldColumn.equals(newColumn)) {
            return sourceCode;
        }
        String old = Pattern.quote(oldColumn);
        String replacement = Matcher.quoteReplacement(newColumn);
        String data = DependencyDetector.DATA_VARIABLE;

        String result = sourceCode;
        // data['old'] / data["old"]
        result = result.replaceAll("(" + data + "\\[)(['\"])" + old + "\\2(\\])", "$1$2" + replacement + "$2$3");
        // 'old': / "old":
        result = result.replaceAll("(['\"])" + old + "\\1(\\s*:)", "$1" + replacement + "$1$2");
        // 'dataset@old' / "dataset@old"
        result = result.replaceAll("(['\"])([^'\"@\\s]+)@" + old + "\\1", "$1$2@" + replacement + "$1");
        return result;
    }

    public String rewriteAll(String sourceCode, Map<String, String> renames) {
        String result = sourceCode;
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            result = rewrite(result, rename.getKey(), rename.getValue());
        }
        return result;
    }
}
