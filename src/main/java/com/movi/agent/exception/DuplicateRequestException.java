package com.movi.agent.exception;

/**
 * A request with the same Idempotency-Key is still being processed.
 */
public class DuplicateRequestException extends OrchestrationException {

    public DuplicateRequestException(String idempotencyKey) {
        super("A request with Idempotency-Key " + idempotencyKey + " is already in progress");
    }
}
