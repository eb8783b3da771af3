package com.movi.agent.exception;

import lombok.Getter;

@Getter
public class LoopCeilingExceededException extends OrchestrationException {

    private final int ceiling;

    public LoopCeilingExceededException(String threadId, int ceiling) {
        super("Tool loop exceeded " + ceiling + " dispatch rounds [thread=" + threadId + "]");
        this.ceiling = ceiling;
    }
}
