package com.movi.agent.exception;

/**
 * Base type for failures that abort a turn. Nothing from an aborted turn is checkpointed.
 */
public class OrchestrationException extends RuntimeException {

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
