package com.studentscheduler.backend.global.database;

import java.time.Duration;
import java.util.function.Supplier;

import com.studentscheduler.backend.global.error.DatabaseUnavailableException;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs a unit of persistence work against the shared pool and repeats it when it fails for a
 * transient reason.
 *
 * <p>Before every attempt the pool is acquired from the {@link ConnectionSupervisor}; if that
 * fails the failure propagates as is, since the supervisor already spent its own retry budget.
 * A transient failure of the work itself invalidates the pool it ran on, waits according to the
 * {@link RetryPolicy} and tries again. Permanent failures are rethrown untouched on the first
 * occurrence. The work must be safe to repeat: when wrapped in a transaction, a failed attempt
 * has been rolled back before the next one starts.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ConnectionSupervisor supervisor;
    private final ErrorClassifier errorClassifier;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final TransactionTemplate readWriteTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public RetryExecutor(
            ConnectionSupervisor supervisor,
            ErrorClassifier errorClassifier,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            PlatformTransactionManager transactionManager
    ) {
        this.supervisor = supervisor;
        this.errorClassifier = errorClassifier;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.readWriteTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    /**
     * Runs {@code work} in its own read-write transaction, retrying the whole transaction.
     */
    public <T> T inTransaction(String operation, TransactionCallback<T> work) {
        return execute(operation, () -> readWriteTemplate.execute(work));
    }

    public <T> T inReadOnlyTransaction(String operation, TransactionCallback<T> work) {
        return execute(operation, () -> readOnlyTemplate.execute(work));
    }

    /**
     * Runs {@code work} with retry on transient failures.
     *
     * @param operation short name used in log lines
     * @throws DatabaseUnavailableException when every attempt failed transiently
     */
    public <T> T execute(String operation, Supplier<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            HikariDataSource pool = supervisor.acquire();
            try {
                T result = work.get();
                if (attempt > 1) {
                    log.info("{} succeeded on attempt {}", operation, attempt);
                }
                return result;
            } catch (RuntimeException ex) {
                DatabaseUnavailableException unavailable = findUnavailable(ex);
                if (unavailable != null) {
                    // the supervisor gave up reconnecting inside the work; do not stack another budget on top
                    throw unavailable;
                }
                if (!errorClassifier.isTransient(ex)) {
                    throw ex;
                }
                supervisor.invalidate(pool);
                if (!retryPolicy.canRetry(attempt)) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, ex.getMessage());
                    throw new DatabaseUnavailableException(
                            operation + " failed after " + attempt + " attempts",
                            (int) Math.max(1, retryPolicy.getInitialDelay().toSeconds()),
                            ex
                    );
                }
                Duration delay = retryPolicy.delayBeforeRetry(attempt);
                log.warn("{} attempt {}/{} failed transiently ({}); retrying in {} ms",
                        operation, attempt, retryPolicy.getMaxAttempts(), ex.getMessage(), delay.toMillis());
                pause(operation, delay);
            }
        }
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DatabaseUnavailableException("Interrupted while retrying " + operation, 0, ex);
        }
    }

    private static DatabaseUnavailableException findUnavailable(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth++ < 32) {
            if (current instanceof DatabaseUnavailableException unavailable) {
                return unavailable;
            }
            current = current.getCause();
        }
        return null;
    }
}
