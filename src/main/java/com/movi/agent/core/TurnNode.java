package com.movi.agent.core;

/**
 * Nodes of the per-turn graph. START and END bracket every turn; the machine is
 * re-entered fresh each turn and reads the checkpointed state.
 */
public enum TurnNode {
    START,
    REASONING,
    EVALUATING_CONSEQUENCE,
    CONFIRMING,
    DISPATCHING_TOOLS,
    END
}
