package com.quantdesk.backend.service.indicator;

import com.quantdesk.backend.model.Indicator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds which catalog indicators a script reads from by scanning its text for their column names.
 * Matching is lexical only: the script is never parsed or executed.
 */
@Component
public class DependencyDetector {

    static final String DATA_VARIABLE = "data";

    // 'dataset@column' or "dataset@column"
    private static final Pattern QUALIFIED_REFERENCE = Pattern.compile("(['\"])([^'\"@\\s]+)@([^'\"]+)\\1");

    public DetectedDependencies detect(String sourceCode, String selfId, Collection<Indicator> catalog) {
        if (sourceCode == null || sourceCode.isBlank() || catalog == null || catalog.isEmpty()) {
            return DetectedDependencies.none();
        }
        Set<String> qualifiedColumns = qualifiedColumnReferences(sourceCode);

        Set<String> ids = new LinkedHashSet<>();
        Set<String> columns = new LinkedHashSet<>();
        for (Indicator candidate : catalog) {
            if (candidate == null || Objects.equals(candidate.getId(), selfId)) {
                continue;
            }
            List<String> matched = matchColumns(sourceCode, candidate, qualifiedColumns);
            if (!matched.isEmpty()) {
                ids.add(candidate.getId());
                columns.addAll(matched);
            }
        }
        return new DetectedDependencies(List.copyOf(ids), List.copyOf(columns));
    }

    private List<String> matchColumns(String sourceCode, Indicator candidate, Set<String> qualifiedColumns) {
        List<String> matched = new ArrayList<>();
        if (candidate.isGroup()) {
            if (candidate.getGroupName() == null || candidate.getExpectedOutputs() == null) {
                return matched;
            }
            for (String output : candidate.getExpectedOutputs()) {
                String column = ColumnNames.groupColumn(candidate.getGroupName(), output);
                boolean viaQualified = qualifiedColumns.contains(column) || qualifiedColumns.contains(output);
                if (viaQualified || referencesColumn(sourceCode, column)) {
                    matched.add(column);
                }
            }
        } else {
            String column = candidate.getOutputColumn();
            if (column != null && !column.isBlank()
                    && (qualifiedColumns.contains(column) || referencesColumn(sourceCode, column))) {
                matched.add(column);
            }
        }
        return matched;
    }

    /**
     * Column parts of every {@code 'dataset@column'} literal in the script.
     */
    Set<String> qualifiedColumnReferences(String sourceCode) {
        Set<String> columns = new LinkedHashSet<>();
        Matcher matcher = QUALIFIED_REFERENCE.matcher(sourceCode);
        while (matcher.find()) {
            columns.add(matcher.group(3));
        }
        return columns;
    }

    boolean referencesColumn(String sourceCode, String column) {
        for (Pattern pattern : referencePatterns(column)) {
            if (pattern.matcher(sourceCode).find()) {
                return true;
            }
        }
        return false;
    }

    private List<Pattern> referencePatterns(String column) {
        String quoted = Pattern.quote(column);
        return List.of(
                Pattern.compile(DATA_VARIABLE + "\\['" + quoted + "'\\]"),
                Pattern.compile(DATA_VARIABLE + "\\[\"" + quoted + "\"\\]"),
                Pattern.compile("\\b" + DATA_VARIABLE + "\\." + quoted + "(?![A-Za-z0-9_])"),
                Pattern.compile("(['\"])" + quoted + "\\1")
        );
    }
}
