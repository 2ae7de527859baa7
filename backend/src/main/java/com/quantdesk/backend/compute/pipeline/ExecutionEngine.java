package com.quantdesk.backend.compute.pipeline;

/**
 * Runs one indicator script against projected rows. Blocking; script errors come back as an
 * unsuccessful {@link ScriptExecutionResult}, infrastructure errors as exceptions.
 */
public interface ExecutionEngine {
    ScriptExecutionResult execute(ScriptExecutionRequest request);
}
