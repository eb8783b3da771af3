package com.movi.agent.checkpoint;

import com.movi.agent.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local checkpoints for local runs and tests (movi.checkpoint.store=memory).
 * Not durable across restarts.
 *
 * States are copied on the way in and out, so callers can never mutate a stored checkpoint.
 */
@Component
@ConditionalOnProperty(name = "movi.checkpoint.store", havingValue = "memory")
@Slf4j
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, SessionState> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionState> load(String threadId) {
        SessionState stored = checkpoints.get(threadId);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public void save(SessionState state) {
        checkpoints.put(state.getThreadId(), state.copy());
        log.debug("Saved in-memory checkpoint for thread: {}", state.getThreadId());
    }

    public int size() {
        return checkpoints.size();
    }
}
