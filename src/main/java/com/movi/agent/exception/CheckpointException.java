package com.movi.agent.exception;

/**
 * Checkpoint store unavailable or returned unreadable state. Callers retry the whole turn.
 */
public class CheckpointException extends OrchestrationException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
