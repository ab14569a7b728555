package com.studentscheduler.backend.global.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.ConnectException;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.studentscheduler.backend.global.error.DatabaseUnavailableException;
import com.studentscheduler.backend.global.error.PersistenceFailureException;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionSupervisorTest {

    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());
    private final ErrorClassifier classifier = new ErrorClassifier();
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void connectsOnceAndSharesTheHandle() {
        HikariDataSource pool = mock(HikariDataSource.class);
        AtomicInteger opens = new AtomicInteger();
        ConnectionSupervisor supervisor = supervisor(() -> {
            opens.incrementAndGet();
            return pool;
        });

        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.IDLE);
        assertThat(supervisor.acquire()).isSameAs(pool);
        assertThat(supervisor.acquire()).isSameAs(pool);
        assertThat(opens).hasValue(1);
        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.CONNECTED);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void retriesTransientConnectFailuresWithBackoff() {
        HikariDataSource pool = mock(HikariDataSource.class);
        AtomicInteger opens = new AtomicInteger();
        ConnectionSupervisor supervisor = supervisor(() -> {
            if (opens.incrementAndGet() <= 2) {
                throw refused();
            }
            return pool;
        });

        assertThat(supervisor.acquire()).isSameAs(pool);
        assertThat(opens).hasValue(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void givesUpAfterMaxAttemptsWithDatabaseUnavailable() {
        AtomicInteger opens = new AtomicInteger();
        ConnectionSupervisor supervisor = supervisor(() -> {
            opens.incrementAndGet();
            throw refused();
        });

        assertThatThrownBy(supervisor::acquire)
                .isInstanceOf(DatabaseUnavailableException.class)
                .hasRootCauseInstanceOf(ConnectException.class);
        assertThat(opens).hasValue(5);
        assertThat(sleeps).containsExactly(
                Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8), Duration.ofSeconds(16));
        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.IDLE);
    }

    @Test
    void permanentConnectFailureIsNotRetried() {
        AtomicInteger opens = new AtomicInteger();
        ConnectionSupervisor supervisor = supervisor(() -> {
            opens.incrementAndGet();
            throw new HikariPool.PoolInitializationException(
                    new SQLException("FATAL: password authentication failed for user \"scheduler\"", "28P01"));
        });

        assertThatThrownBy(supervisor::acquire)
                .isInstanceOf(PersistenceFailureException.class)
                .satisfies(ex -> assertThat(((PersistenceFailureException) ex).getCode())
                        .isEqualTo("DATABASE_CONNECTION_FAILED"));
        assertThat(opens).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void invalidateDropsCurrentHandleSoNextAcquireReconnects() {
        HikariDataSource first = mock(HikariDataSource.class);
        HikariDataSource second = mock(HikariDataSource.class);
        List<HikariDataSource> pools = new ArrayList<>(List.of(first, second));
        ConnectionSupervisor supervisor = supervisor(() -> pools.remove(0));

        HikariDataSource acquired = supervisor.acquire();
        supervisor.invalidate(acquired);

        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.IDLE);
        verify(first).close();
        assertThat(supervisor.acquire()).isSameAs(second);
    }

    @Test
    void staleInvalidateLeavesFreshHandleAlone() {
        HikariDataSource first = mock(HikariDataSource.class);
        HikariDataSource second = mock(HikariDataSource.class);
        List<HikariDataSource> pools = new ArrayList<>(List.of(first, second));
        ConnectionSupervisor supervisor = supervisor(() -> pools.remove(0));

        HikariDataSource stale = supervisor.acquire();
        supervisor.invalidate(stale);
        HikariDataSource fresh = supervisor.acquire();

        supervisor.invalidate(stale);

        assertThat(supervisor.acquire()).isSameAs(fresh);
        verify(second, never()).close();
    }

    @Test
    void closedHandleIsReplaced() {
        HikariDataSource first = mock(HikariDataSource.class);
        HikariDataSource second = mock(HikariDataSource.class);
        List<HikariDataSource> pools = new ArrayList<>(List.of(first, second));
        ConnectionSupervisor supervisor = supervisor(() -> pools.remove(0));

        assertThat(supervisor.acquire()).isSameAs(first);
        when(first.isClosed()).thenReturn(true);

        assertThat(supervisor.acquire()).isSameAs(second);
    }

    @Test
    void concurrentCallersShareOneConnectAttempt() throws Exception {
        HikariDataSource pool = mock(HikariDataSource.class);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger opens = new AtomicInteger();
        ConnectionSupervisor supervisor = supervisor(() -> {
            opens.incrementAndGet();
            awaitLatch(release);
            return pool;
        });

        Future<HikariDataSource> connector = executor.submit(supervisor::acquire);
        waitUntil(() -> supervisor.state() == ConnectionSupervisor.State.CONNECTING);
        Future<HikariDataSource> waiterA = executor.submit(supervisor::acquire);
        Future<HikariDataSource> waiterB = executor.submit(supervisor::acquire);
        release.countDown();

        assertThat(connector.get(5, TimeUnit.SECONDS)).isSameAs(pool);
        assertThat(waiterA.get(5, TimeUnit.SECONDS)).isSameAs(pool);
        assertThat(waiterB.get(5, TimeUnit.SECONDS)).isSameAs(pool);
        assertThat(opens).hasValue(1);
    }

    @Test
    void waitersOfAFailedAttemptReceiveTheFailureWithoutReconnecting() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger opens = new AtomicInteger();
        ConnectionSupervisor supervisor = supervisor(() -> {
            opens.incrementAndGet();
            awaitLatch(release);
            throw new HikariPool.PoolInitializationException(new SQLException("permission denied", "42501"));
        });

        Future<HikariDataSource> connector = executor.submit(supervisor::acquire);
        waitUntil(() -> supervisor.state() == ConnectionSupervisor.State.CONNECTING);
        CountDownLatch waiterStarted = new CountDownLatch(1);
        Thread[] waiterThread = new Thread[1];
        Future<HikariDataSource> waiter = executor.submit(() -> {
            waiterThread[0] = Thread.currentThread();
            waiterStarted.countDown();
            return supervisor.acquire();
        });
        waiterStarted.await(5, TimeUnit.SECONDS);
        waitUntil(() -> waiterThread[0].getState() == Thread.State.WAITING);
        release.countDown();

        assertThatThrownBy(() -> connector.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(PersistenceFailureException.class);
        assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(PersistenceFailureException.class);
        assertThat(opens).hasValue(1);
    }

    @Test
    void interruptedConnectorFailsAloneAndAWaiterTakesOver() throws Exception {
        HikariDataSource pool = mock(HikariDataSource.class);
        AtomicInteger opens = new AtomicInteger();
        CountDownLatch backingOff = new CountDownLatch(1);
        ConnectionSupervisor supervisor = new ConnectionSupervisor(
                () -> {
                    if (opens.incrementAndGet() == 1) {
                        throw refused();
                    }
                    return pool;
                },
                classifier,
                RetryPolicy.defaults(),
                duration -> {
                    backingOff.countDown();
                    Thread.sleep(TimeUnit.SECONDS.toMillis(30));
                }
        );

        Future<HikariDataSource> connector = executor.submit(supervisor::acquire);
        assertThat(backingOff.await(5, TimeUnit.SECONDS)).isTrue();
        Thread[] waiterThread = new Thread[1];
        CountDownLatch waiterStarted = new CountDownLatch(1);
        Future<HikariDataSource> waiter = executor.submit(() -> {
            waiterThread[0] = Thread.currentThread();
            waiterStarted.countDown();
            return supervisor.acquire();
        });
        waiterStarted.await(5, TimeUnit.SECONDS);
        waitUntil(() -> waiterThread[0].getState() == Thread.State.WAITING);

        connector.cancel(true);

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isSameAs(pool);
        assertThat(opens).hasValue(2);
        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.CONNECTED);
    }

    @Test
    void poolOpenedWhileShuttingDownIsClosedNotInstalled() throws Exception {
        HikariDataSource pool = mock(HikariDataSource.class);
        CountDownLatch release = new CountDownLatch(1);
        ConnectionSupervisor supervisor = supervisor(() -> {
            awaitLatch(release);
            return pool;
        });

        Future<HikariDataSource> connector = executor.submit(supervisor::acquire);
        waitUntil(() -> supervisor.state() == ConnectionSupervisor.State.CONNECTING);
        supervisor.close();
        release.countDown();

        assertThatThrownBy(() -> connector.get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(DatabaseUnavailableException.class);
        verify(pool).close();
        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.IDLE);
    }

    @Test
    void interruptDuringBackoffAbortsAndResetsState() {
        ConnectionSupervisor supervisor = new ConnectionSupervisor(
                () -> {
                    throw refused();
                },
                classifier,
                RetryPolicy.defaults(),
                duration -> {
                    throw new InterruptedException("shutdown");
                }
        );

        try {
            assertThatThrownBy(supervisor::acquire).isInstanceOf(DatabaseUnavailableException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(supervisor.state()).isEqualTo(ConnectionSupervisor.State.IDLE);
    }

    @Test
    void closeShutsDownPoolAndRejectsFurtherCallers() {
        HikariDataSource pool = mock(HikariDataSource.class);
        ConnectionSupervisor supervisor = supervisor(() -> pool);
        supervisor.acquire();

        supervisor.close();

        verify(pool).close();
        assertThatThrownBy(supervisor::acquire).isInstanceOf(DatabaseUnavailableException.class);
    }

    private ConnectionSupervisor supervisor(PoolFactory factory) {
        return new ConnectionSupervisor(factory, classifier, RetryPolicy.defaults(), sleeps::add);
    }

    private static RuntimeException refused() {
        return new HikariPool.PoolInitializationException(
                new SQLException("Connection to localhost:5432 refused.", "08001", new ConnectException("Connection refused")));
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch was never released");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    private static void waitUntil(Supplier<Boolean> condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.get()) {
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
