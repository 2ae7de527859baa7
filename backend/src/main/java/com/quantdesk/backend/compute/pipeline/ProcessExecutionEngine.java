package com.quantdesk.backend.compute.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantdesk.backend.config.IndicatorProperties;
import com.quantdesk.backend.exception.ScriptExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Hands a script to the external executor process: the request goes to stdin as JSON and the
 * answer {@code {success, values, error, type}} is read from stdout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProcessExecutionEngine implements ExecutionEngine {

    private static final int MAX_DIAGNOSTIC_LENGTH = 200;

    private final IndicatorProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public ScriptExecutionResult execute(ScriptExecutionRequest request) {
        IndicatorProperties.Executor executor = properties.getExecutor();
        List<String> command = List.of(executor.getExecutable(), executor.getScript());
        log.debug("Executing indicator script with {} ({} rows)", command, request.data().size());

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ScriptExecutionException("Failed to start script executor " + command, e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                objectMapper.writeValue(stdin, request);
            } catch (IOException e) {
                log.debug("Executor closed stdin early: {}", e.getMessage());
            }

            if (!process.waitFor(executor.getTimeoutMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ScriptExecutionException("Script execution timed out after " + executor.getTimeoutMillis() + " ms");
            }
            int exitCode = process.exitValue();
            String output = stdout.get();
            String errors = stderr.get();
            // 1 is the executor's "script failed" exit and still carries a JSON answer
            if (exitCode != 0 && exitCode != 1) {
                throw new ScriptExecutionException("Script executor exited with code " + exitCode + ": "
                        + abbreviate(errors.isBlank() ? "No error output" : errors));
            }
            return parse(output, errors);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ScriptExecutionException("Interrupted while waiting for script executor", e);
        } catch (ExecutionException e) {
            throw new ScriptExecutionException("Failed to read script executor output", e.getCause());
        }
    }

    ScriptExecutionResult parse(String output, String errors) {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (IOException e) {
            throw new ScriptExecutionException("Failed to parse executor output. stdout: " + abbreviate(output)
                    + ", stderr: " + abbreviate(errors), e);
        }
        if (root == null || !root.isObject()) {
            throw new ScriptExecutionException("Executor returned no result. stderr: " + abbreviate(errors));
        }
        if (!root.path("success").asBoolean(false)) {
            String error = root.hasNonNull("error") ? root.get("error").asText() : "Script execution failed";
            String type = root.hasNonNull("type") ? root.get("type").asText() : null;
            return ScriptExecutionResult.failure(error, type);
        }
        JsonNode values = root.path("values");
        if (values.isArray()) {
            return ScriptExecutionResult.ofValues(toSeries(values));
        }
        if (values.isObject()) {
            Map<String, List<Double>> groupValues = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isArray()) {
                    return ScriptExecutionResult.failure("Output '" + field.getKey() + "' is not an array", "ShapeError");
                }
                groupValues.put(field.getKey(), toSeries(field.getValue()));
            }
            return ScriptExecutionResult.ofGroupValues(groupValues);
        }
        return ScriptExecutionResult.failure("Script returned no values", "ShapeError");
    }

    private List<Double> toSeries(JsonNode array) {
        List<Double> series = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            series.add(element.isNumber() && Double.isFinite(element.asDouble()) ? element.asDouble() : null);
        }
        return series;
    }

    private String readFully(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_DIAGNOSTIC_LENGTH ? text : text.substring(0, MAX_DIAGNOSTIC_LENGTH) + "...";
    }
}
