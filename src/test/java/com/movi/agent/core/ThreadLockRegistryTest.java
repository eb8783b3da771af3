package com.movi.agent.core;

import com.movi.agent.config.OrchestratorProperties;
import com.movi.agent.exception.ThreadBusyException;
import com.movi.agent.resilience.RedisTurnLease;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ThreadLockRegistryTest {

    private OrchestratorProperties props;
    private ThreadLockRegistry registry;

    @BeforeEach
    void setUp() {
        props = new OrchestratorProperties();
        props.setLockTimeoutSeconds(5);
        registry = new ThreadLockRegistry(props, Optional.empty());
    }

    @Test
    void withLock_returnsActionResultAndReleasesEntry() {
        String result = registry.withLock("t1", () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(registry.activeEntries()).isZero();
    }

    @Test
    void withLock_releasesEntryWhenActionThrows() {
        assertThatThrownBy(() -> registry.withLock("t1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.activeEntries()).isZero();
    }

    @Test
    void sameThread_turnsNeverOverlap() throws Exception {
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 20; i++) {
                pool.submit(() -> registry.withLock("shared", () -> {
                    int now = concurrent.incrementAndGet();
                    maxConcurrent.accumulateAndGet(now, Math::max);
                    sleep(5);
                    return concurrent.decrementAndGet();
                }));
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(registry.activeEntries()).isZero();
    }

    @Test
    void differentThreads_runConcurrently() throws Exception {
        CountDownLatch bothInside = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> a = pool.submit(() -> registry.withLock("a", () -> awaitLatch(bothInside)));
            Future<Boolean> b = pool.submit(() -> registry.withLock("b", () -> awaitLatch(bothInside)));

            assertThat(a.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(b.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void busyThread_timesOut() throws Exception {
        props.setLockTimeoutSeconds(0);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.submit(() -> registry.withLock("busy", () -> {
                holding.countDown();
                return awaitRelease(release);
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

            assertThatThrownBy(() -> registry.withLock("busy", () -> "second"))
                    .isInstanceOf(ThreadBusyException.class)
                    .hasMessageContaining("busy");
        } finally {
            release.countDown();
            pool.shutdown();
        }
    }

    @Test
    void sharedLease_runsActionInsideLeaseAndReleasesIt() throws Exception {
        RedisTurnLease lease = mock(RedisTurnLease.class);
        when(lease.acquire(eq("t1"), any(Duration.class))).thenReturn(Optional.of("token-1"));
        ThreadLockRegistry shared = new ThreadLockRegistry(props, Optional.of(lease));

        String result = shared.withLock("t1", () -> "done");

        assertThat(result).isEqualTo("done");
        InOrder order = inOrder(lease);
        order.verify(lease).acquire(eq("t1"), any(Duration.class));
        order.verify(lease).release("t1", "token-1");
        assertThat(shared.activeEntries()).isZero();
    }

    @Test
    void sharedLease_heldElsewhere_isBusyAndSkipsAction() throws Exception {
        RedisTurnLease lease = mock(RedisTurnLease.class);
        when(lease.acquire(eq("t1"), any(Duration.class))).thenReturn(Optional.empty());
        ThreadLockRegistry shared = new ThreadLockRegistry(props, Optional.of(lease));
        AtomicInteger runs = new AtomicInteger();

        assertThatThrownBy(() -> shared.withLock("t1", runs::incrementAndGet))
                .isInstanceOf(ThreadBusyException.class);

        assertThat(runs.get()).isZero();
        verify(lease, never()).release(anyString(), anyString());
        assertThat(shared.activeEntries()).isZero();
    }

    @Test
    void sharedLease_releasedWhenActionThrows() throws Exception {
        RedisTurnLease lease = mock(RedisTurnLease.class);
        when(lease.acquire(eq("t1"), any(Duration.class))).thenReturn(Optional.of("token-1"));
        ThreadLockRegistry shared = new ThreadLockRegistry(props, Optional.of(lease));

        assertThatThrownBy(() -> shared.withLock("t1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        verify(lease).release("t1", "token-1");
    }

    private static boolean awaitLatch(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean awaitRelease(CountDownLatch release) {
        try {
            return release.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
