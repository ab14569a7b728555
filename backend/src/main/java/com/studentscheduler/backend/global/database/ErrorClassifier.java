package com.studentscheduler.backend.global.database;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import com.studentscheduler.backend.global.error.DatabaseUnavailableException;
import com.studentscheduler.backend.global.error.ProblemException;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

/**
 * Decides whether a failure coming out of the persistence stack is worth retrying.
 *
 * <p>The whole cause chain is inspected because Spring, Hibernate and Hikari each wrap the
 * driver exception at least once. Classification runs in two passes:
 * <ol>
 *   <li>anything in the chain that marks a logic failure (integrity violation, SQLState class 23,
 *       one of our own problem exceptions) makes the failure {@link ErrorCategory#PERMANENT};</li>
 *   <li>otherwise any connectivity marker (exception type, SQLState, vendor code or message
 *       pattern) makes it {@link ErrorCategory#TRANSIENT}.</li>
 * </ol>
 * Anything left unclassified is permanent, including deadlocks, serialization failures and other
 * lock conflicts: they are not connectivity problems.
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public class ErrorClassifier {

    private static final String INTEGRITY_SQL_STATE_CLASS = "23";
    private static final String CONNECTION_SQL_STATE_CLASS = "08";

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
            "53300",  // too_many_connections
            "57P01",  // admin_shutdown
            "57P02",  // crash_shutdown
            "57P03",  // cannot_connect_now (starting up / resuming)
            "57014"   // query_canceled (statement timeout)
    );

    // Azure SQL serverless reports a paused or resuming database with these error numbers
    private static final Set<Integer> TRANSIENT_VENDOR_CODES = Set.of(
            40613,  // database not currently available
            40197,  // service error processing request
            40501,  // service is currently busy
            49918,  // not enough resources to process request
            49919,  // too many create/update operations
            49920,  // too many operations in progress
            4060    // cannot open database requested by the login
    );

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
            "connection refused",
            "connection reset",
            "connection timed out",
            "connect timed out",
            "read timed out",
            "socket timeout",
            "socket hang up",
            "connection lost",
            "connection closed",
            "connection is not available",
            "connection attempt failed",
            "broken pipe",
            "network is unreachable",
            "no route to host",
            "terminating connection",
            "server closed the connection",
            "could not connect to server",
            "not currently available",
            "is resuming",
            "database is paused",
            "server is in paused",
            "the database system is starting up",
            "the database system is shutting down"
    };

    /**
     * Classifies a failure.
     *
     * @param throwable the failure, may be {@code null}
     * @return the category; {@code null} input is permanent
     */
    public ErrorCategory classify(Throwable throwable) {
        if (throwable == null) {
            return ErrorCategory.PERMANENT;
        }
        List<Throwable> chain = causeChain(throwable);
        for (Throwable candidate : chain) {
            if (isPermanentMarker(candidate)) {
                return ErrorCategory.PERMANENT;
            }
        }
        for (Throwable candidate : chain) {
            if (isTransientMarker(candidate)) {
                return ErrorCategory.TRANSIENT;
            }
        }
        return ErrorCategory.PERMANENT;
    }

    public boolean isTransient(Throwable throwable) {
        return classify(throwable) == ErrorCategory.TRANSIENT;
    }

    /**
     * Returns the first SQLState found in the cause chain, or {@code null}.
     */
    public String sqlState(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        for (Throwable candidate : causeChain(throwable)) {
            if (candidate instanceof SQLException sqlException && sqlException.getSQLState() != null) {
                return sqlException.getSQLState();
            }
        }
        return null;
    }

    private boolean isPermanentMarker(Throwable t) {
        if (t instanceof DatabaseUnavailableException) {
            return false;
        }
        if (t instanceof ProblemException) {
            return true;
        }
        if (t instanceof DataIntegrityViolationException) {
            return true;
        }
        if (t instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        if (t instanceof SQLException sqlException) {
            String state = sqlException.getSQLState();
            return state != null && state.startsWith(INTEGRITY_SQL_STATE_CLASS);
        }
        return false;
    }

    private boolean isTransientMarker(Throwable t) {
        if (t instanceof DatabaseUnavailableException) {
            return true;
        }

        // Spring data-access hierarchy; subclasses before their parents.
        // Lock conflicts (deadlock, serialization, lock timeout) are not connectivity failures.
        if (t instanceof ConcurrencyFailureException) {
            return false;
        }
        if (t instanceof CannotGetJdbcConnectionException) {
            return true;
        }
        if (t instanceof TransientDataAccessException) {
            return true;
        }
        if (t instanceof RecoverableDataAccessException) {
            return true;
        }
        if (t instanceof DataAccessResourceFailureException) {
            return true;
        }

        // JDBC hierarchy; SQLTimeoutException and SQLTransientConnectionException are SQLTransientException
        if (t instanceof SQLTransientException) {
            return true;
        }
        if (t instanceof SQLRecoverableException) {
            return true;
        }
        if (t instanceof SQLNonTransientConnectionException) {
            // the connection is gone, a fresh one may work
            return true;
        }
        if (t instanceof SQLException sqlException && isTransientSqlException(sqlException)) {
            return true;
        }

        // Socket level
        if (t instanceof ConnectException
                || t instanceof SocketTimeoutException
                || t instanceof SocketException
                || t instanceof NoRouteToHostException
                || t instanceof UnknownHostException
                || t instanceof TimeoutException) {
            return true;
        }

        return matchesTransientMessage(t.getMessage());
    }

    private boolean isTransientSqlException(SQLException ex) {
        String state = ex.getSQLState();
        if (state != null) {
            if (state.startsWith(CONNECTION_SQL_STATE_CLASS) || TRANSIENT_SQL_STATES.contains(state)) {
                return true;
            }
        }
        return TRANSIENT_VENDOR_CODES.contains(ex.getErrorCode());
    }

    private boolean matchesTransientMessage(String message) {
        if (message == null || message.isEmpty()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable throwable) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        while (current != null && seen.add(current)) {
            chain.add(current);
            if (current instanceof SQLException sqlException && sqlException.getNextException() != null
                    && current.getCause() == null) {
                current = sqlException.getNextException();
            } else {
                current = current.getCause();
            }
        }
        return chain;
    }
}
