package com.movi.agent.core;

import com.movi.agent.model.SessionState;
import com.movi.agent.model.TurnStatus;
import com.movi.agent.observability.RunContext;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable bookkeeping for a single turn, passed between nodes.
 * Conversation state lives in {@link SessionState}; this only tracks what happened this turn.
 */
@Data
public class TurnContext {

    private final SessionState state;
    private final RunContext runContext;

    private int dispatchRounds;
    private int reasoningSteps;
    private TurnStatus status = TurnStatus.COMPLETED;
    private final List<String> executedCapabilities = new ArrayList<>();

    /**
     * Entities the dangerous capability may be dispatched against in the next dispatch round:
     * either assessed LOW this turn or confirmed by the user this turn. Consumed on dispatch.
     */
    private final List<String> clearedEntities = new ArrayList<>();

    public TurnContext(SessionState state, RunContext runContext) {
        this.state = state;
        this.runContext = runContext;
    }

    public String getThreadId() {
        return state.getThreadId();
    }
}
