package com.movi.agent.capability;

import java.util.Map;

/**
 * Contract every capability the reasoning service may request must implement.
 *
 * The {@link #getInputSchema()} return value is serialized as JSON Schema
 * and sent to the reasoning service so it knows how to invoke the capability.
 *
 * Implementations may throw; {@link ToolDispatcher} turns any failure into an
 * "ERROR: ..." tool result so the next reasoning step can react to it.
 */
public interface Capability {

    /** Unique snake_case name the reasoning service uses to invoke this capability */
    String getName();

    /**
     * Human-readable description. This is the primary signal the reasoning service uses
     * to decide when to call this capability.
     */
    String getDescription();

    /** JSON Schema (as a Map) describing the input parameters. */
    Map<String, Object> getInputSchema();

    /** Execute and return the text observation fed back to the reasoning service. */
    String execute(Map<String, Object> arguments);
}
