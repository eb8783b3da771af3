package com.movi.agent.checkpoint;

import com.movi.agent.model.SessionState;

import java.util.Optional;

/**
 * Durable, thread-keyed persistence of {@link SessionState} between turns.
 *
 * Contract:
 * - a {@link #save} that returns normally is durable; a later {@link #load} for the same
 *   thread observes that state or a later one
 * - a save replaces the whole checkpoint in one write, so a reader never sees half a turn
 * - failures surface as {@link com.movi.agent.exception.CheckpointException}
 *
 * Callers serialize turns per thread; the store itself only guarantees atomic writes.
 */
public interface CheckpointStore {

    /** Empty when the thread has no checkpoint yet. */
    Optional<SessionState> load(String threadId);

    void save(SessionState state);
}
