package com.quantdesk.backend.exception;

/**
 * The script execution collaborator could not produce an answer (spawn failure, timeout, crash,
 * unreadable output). Script-level errors reported by the executor itself are not exceptions.
 */
public class ScriptExecutionException extends RuntimeException {
    public ScriptExecutionException(String message) {
        super(message);
    }

    public ScriptExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
