package com.movi.agent.exception;

public class ThreadBusyException extends OrchestrationException {

    public ThreadBusyException(String threadId) {
        super("Another turn is still running for thread " + threadId);
    }
}
