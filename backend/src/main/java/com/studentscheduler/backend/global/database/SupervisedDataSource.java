package com.studentscheduler.backend.global.database;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import com.studentscheduler.backend.global.error.DatabaseUnavailableException;
import com.zaxxer.hikari.HikariDataSource;

import org.springframework.jdbc.datasource.AbstractDataSource;

/**
 * The application's only {@link javax.sql.DataSource}. Every connection is borrowed from the pool
 * currently held by the {@link ConnectionSupervisor}, so JPA, Flyway and the transaction manager
 * keep working after the pool has been replaced.
 */
public class SupervisedDataSource extends AbstractDataSource {

    private final ConnectionSupervisor supervisor;
    private final ErrorClassifier errorClassifier;

    public SupervisedDataSource(ConnectionSupervisor supervisor, ErrorClassifier errorClassifier) {
        this.supervisor = supervisor;
        this.errorClassifier = errorClassifier;
    }

    @Override
    public Connection getConnection() throws SQLException {
        HikariDataSource pool = acquirePool();
        try {
            return pool.getConnection();
        } catch (SQLException ex) {
            if (errorClassifier.isTransient(ex)) {
                supervisor.invalidate(pool);
            }
            throw ex;
        }
    }

    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        throw new SQLException("Per-call credentials are not supported; configure spring.datasource instead");
    }

    private HikariDataSource acquirePool() throws SQLException {
        try {
            return supervisor.acquire();
        } catch (DatabaseUnavailableException ex) {
            throw new SQLTransientConnectionException(ex.getDetailMessage(), "08001", ex);
        }
    }
}
