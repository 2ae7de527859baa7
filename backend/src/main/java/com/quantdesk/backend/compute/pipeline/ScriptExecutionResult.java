package com.quantdesk.backend.compute.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Answer of the execution collaborator. A successful single-mode run carries {@code values}, a
 * successful group-mode run carries {@code groupValues} keyed by output name.
 */
public record ScriptExecutionResult(
        boolean success,
        List<Double> values,
        Map<String, List<Double>> groupValues,
        String error,
        String errorType
) {

    public static ScriptExecutionResult ofValues(List<Double> values) {
        return new ScriptExecutionResult(true, values, null, null, null);
    }

    public static ScriptExecutionResult ofGroupValues(Map<String, List<Double>> groupValues) {
        return new ScriptExecutionResult(true, null, groupValues, null, null);
    }

    public static ScriptExecutionResult failure(String error, String errorType) {
        return new ScriptExecutionResult(false, null, null, error, errorType);
    }
}
