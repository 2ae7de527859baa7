package com.quantdesk.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "indicators")
@Data
@Validated
public class IndicatorProperties {

    @Valid
    private Executor executor = new Executor();

    @Valid
    private Dataset dataset = new Dataset();

    @Valid
    private Validation validation = new Validation();

    @Data
    public static class Executor {
        @NotBlank
        private String executable = "python3";

        @NotBlank
        private String script = "executor/indicator_executor.py";

        @Min(1)
        private long timeoutMillis = 300_000;
    }

    @Data
    public static class Dataset {
        // passed to scripts untouched, every other column is coerced to a number
        @NotBlank
        private String timeField = "date";

        @NotEmpty
        private List<String> priceFields = new ArrayList<>(List.of("open", "high", "low", "close", "volume"));

        public List<String> rawColumns() {
            List<String> columns = new ArrayList<>();
            columns.add(timeField);
            columns.addAll(priceFields);
            return columns;
        }
    }

    @Data
    public static class Validation {
        @NotBlank
        private String entryPoint = "def calculate";

        private List<BlockedPattern> blockedPatterns = new ArrayList<>(List.of(
                new BlockedPattern("import\\s+os\\b", "os module"),
                new BlockedPattern("import\\s+subprocess\\b", "subprocess module"),
                new BlockedPattern("import\\s+sys\\b", "sys module"),
                new BlockedPattern("from\\s+os\\b", "os module"),
                new BlockedPattern("from\\s+subprocess\\b", "subprocess module"),
                new BlockedPattern("__import__", "__import__"),
                new BlockedPattern("\\beval\\s*\\(", "eval()"),
                new BlockedPattern("\\bexec\\s*\\(", "exec()"),
                new BlockedPattern("\\bopen\\s*\\(", "open()"),
                new BlockedPattern("\\b__builtins__\\b", "__builtins__"),
                new BlockedPattern("\\b__globals__\\b", "__globals__")
        ));
    }

    @Data
    public static class BlockedPattern {
        private String regex;
        private String label;

        public BlockedPattern() {
        }

        public BlockedPattern(String regex, String label) {
            this.regex = regex;
            this.label = label;
        }
    }
}
