package com.movi.agent.core;

import com.movi.agent.config.OrchestratorProperties;
import com.movi.agent.exception.ThreadBusyException;
import com.movi.agent.resilience.RedisTurnLease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per thread id, held for a whole turn (load → run → save).
 *
 * Different threads never contend. Entries are reference-counted and dropped when the
 * last waiter leaves, so idle threads cost nothing.
 *
 * With Redis checkpoints, the local lock is followed by a {@link RedisTurnLease} so that
 * instances sharing the store also serialize a thread's turns. Both are taken within the
 * same lock timeout.
 */
@Component
@Slf4j
public class ThreadLockRegistry {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final OrchestratorProperties properties;
    private final RedisTurnLease lease;

    public ThreadLockRegistry(OrchestratorProperties properties, Optional<RedisTurnLease> lease) {
        this.properties = properties;
        this.lease = lease.orElse(null);
    }

    /**
     * Runs {@code action} while holding the thread's lock.
     *
     * @throws ThreadBusyException when the lock is not acquired within the configured timeout
     */
    public <T> T withLock(String threadId, Supplier<T> action) {
        LockEntry entry = locks.compute(threadId, (id, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.users++;
            return e;
        });

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getLockTimeoutSeconds());
        boolean acquired = false;
        String leaseToken = null;
        try {
            acquired = entry.lock.tryLock(properties.getLockTimeoutSeconds(), TimeUnit.SECONDS);
            if (!acquired) {
                log.warn("Timed out waiting for turn lock [thread={}]", threadId);
                throw new ThreadBusyException(threadId);
            }
            if (lease != null) {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                leaseToken = lease.acquire(threadId, remaining).orElse(null);
                if (leaseToken == null) {
                    log.warn("Turn lease held by another instance [thread={}]", threadId);
                    throw new ThreadBusyException(threadId);
                }
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ThreadBusyException(threadId);
        } finally {
            if (leaseToken != null) {
                lease.release(threadId, leaseToken);
            }
            if (acquired) {
                entry.lock.unlock();
            }
            locks.computeIfPresent(threadId, (id, e) -> --e.users == 0 ? null : e);
        }
    }

    int activeEntries() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
