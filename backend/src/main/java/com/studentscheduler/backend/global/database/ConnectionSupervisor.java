package com.studentscheduler.backend.global.database;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import com.studentscheduler.backend.global.error.DatabaseUnavailableException;
import com.studentscheduler.backend.global.error.PersistenceFailureException;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single shared connection pool and re-establishes it when it goes away.
 *
 * <p>At most one connect attempt runs at a time. Callers that arrive while a connect is in
 * flight wait for it and then share its outcome; a failed attempt is reported to every waiter
 * of that attempt instead of each of them starting a new one. A connector that is interrupted
 * fails alone: its waiters wake up and one of them starts a fresh attempt.
 */
public class ConnectionSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    public enum State {
        IDLE,
        CONNECTING,
        CONNECTED
    }

    private final PoolFactory poolFactory;
    private final ErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition connectCompleted = lock.newCondition();

    private HikariDataSource handle;
    private boolean connecting;
    private long connectGeneration;
    private RuntimeException lastConnectFailure;
    private boolean closed;

    public ConnectionSupervisor(
            PoolFactory poolFactory,
            ErrorClassifier errorClassifier,
            RetryPolicy retryPolicy,
            Sleeper sleeper
    ) {
        this.poolFactory = poolFactory;
        this.errorClassifier = errorClassifier;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Returns the live pool, connecting first if there is none.
     *
     * @throws DatabaseUnavailableException when the server stayed unreachable for the whole retry budget
     * @throws PersistenceFailureException when connecting failed for a non-transient reason
     */
    public HikariDataSource acquire() {
        lock.lock();
        try {
            while (true) {
                if (closed) {
                    throw new DatabaseUnavailableException("Connection supervisor is shut down", 0, null);
                }
                if (handle != null && !handle.isClosed()) {
                    return handle;
                }
                if (handle != null) {
                    log.warn("Shared pool was closed underneath the supervisor; reconnecting");
                    handle = null;
                }
                if (!connecting) {
                    break;
                }
                long awaited = connectGeneration;
                awaitConnect(awaited);
                if (connectGeneration == awaited && !connecting && lastConnectFailure != null
                        && (handle == null || handle.isClosed())) {
                    throw sharedFailure(lastConnectFailure);
                }
            }
            connecting = true;
            connectGeneration++;
            lastConnectFailure = null;
        } finally {
            lock.unlock();
        }

        HikariDataSource opened = null;
        RuntimeException failure = null;
        boolean installed = false;
        try {
            opened = connectWithRetry();
        } catch (RuntimeException ex) {
            failure = ex;
            throw ex;
        } finally {
            installed = completeConnect(opened, failure);
        }
        if (!installed) {
            log.info("Supervisor shut down while connecting; closing the new pool");
            closeQuietly(opened);
            throw new DatabaseUnavailableException("Connection supervisor is shut down", 0, null);
        }
        return opened;
    }

    /**
     * Drops the given pool if it is still the shared one. A pool that has already been replaced
     * is left alone so a late failure report cannot tear down a fresh connection.
     */
    public void invalidate(HikariDataSource stale) {
        if (stale == null) {
            return;
        }
        boolean dropped = false;
        lock.lock();
        try {
            if (handle == stale) {
                handle = null;
                dropped = true;
            }
        } finally {
            lock.unlock();
        }
        if (dropped) {
            log.warn("Invalidated shared pool {}; the next caller reconnects", stale.getPoolName());
            closeQuietly(stale);
        }
    }

    public State state() {
        lock.lock();
        try {
            if (connecting) {
                return State.CONNECTING;
            }
            if (handle != null && !handle.isClosed()) {
                return State.CONNECTED;
            }
            return State.IDLE;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        HikariDataSource current;
        lock.lock();
        try {
            closed = true;
            current = handle;
            handle = null;
            connectCompleted.signalAll();
        } finally {
            lock.unlock();
        }
        if (current != null) {
            closeQuietly(current);
        }
    }

    private HikariDataSource connectWithRetry() {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                HikariDataSource opened = poolFactory.open();
                if (attempt > 1) {
                    log.info("Database connection established after {} attempts", attempt);
                } else {
                    log.info("Database connection established");
                }
                return opened;
            } catch (RuntimeException ex) {
                if (!errorClassifier.isTransient(ex)) {
                    log.error("Database connection failed with a non-retryable error: {}", ex.getMessage());
                    throw new PersistenceFailureException(
                            "DATABASE_CONNECTION_FAILED",
                            "Could not connect to the database",
                            ex
                    );
                }
                if (!retryPolicy.canRetry(attempt)) {
                    log.error("Database still unreachable after {} attempts: {}", attempt, ex.getMessage());
                    throw new DatabaseUnavailableException(
                            "Database is unavailable after " + attempt + " connection attempts",
                            retryAfterSeconds(),
                            ex
                    );
                }
                Duration delay = retryPolicy.delayBeforeRetry(attempt);
                log.warn("Database connection attempt {}/{} failed ({}); retrying in {} ms",
                        attempt, retryPolicy.getMaxAttempts(), ex.getMessage(), delay.toMillis());
                pause(delay);
            }
        }
    }

    /**
     * Publishes the outcome of the connect this thread ran and wakes its waiters.
     *
     * @return whether {@code opened} became the shared handle
     */
    private boolean completeConnect(HikariDataSource opened, RuntimeException failure) {
        lock.lock();
        try {
            connecting = false;
            // an interrupted connector abandons only its own call; a waiter takes over the connect
            lastConnectFailure = Thread.currentThread().isInterrupted() ? null : failure;
            connectCompleted.signalAll();
            if (opened == null || closed) {
                return false;
            }
            handle = opened;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private RuntimeException sharedFailure(RuntimeException failure) {
        if (failure instanceof PersistenceFailureException) {
            return new PersistenceFailureException(
                    "DATABASE_CONNECTION_FAILED",
                    "Could not connect to the database",
                    failure
            );
        }
        return new DatabaseUnavailableException(
                "Database connect attempt failed while waiting for it",
                retryAfterSeconds(),
                failure
        );
    }

    private void awaitConnect(long generation) {
        while (connecting && connectGeneration == generation && !closed) {
            try {
                connectCompleted.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new DatabaseUnavailableException("Interrupted while waiting for the database connection", 0, ex);
            }
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DatabaseUnavailableException("Interrupted while waiting to reconnect", 0, ex);
        }
    }

    private int retryAfterSeconds() {
        return (int) Math.max(1, retryPolicy.getInitialDelay().toSeconds());
    }

    private static void closeQuietly(HikariDataSource dataSource) {
        try {
            dataSource.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close pool {}: {}", dataSource.getPoolName(), ex.getMessage());
        }
    }
}
