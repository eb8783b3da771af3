package com.movi.agent.exception;

/**
 * The reasoning service was unreachable, timed out, or returned output that could not be parsed
 * (including malformed capability arguments).
 */
public class GatewayException extends OrchestrationException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
