package com.studentscheduler.backend.global.database;

import java.time.Duration;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;

public class HikariPoolFactory implements PoolFactory {

    private final DataSourceProperties dataSourceProperties;
    private final int maximumPoolSize;
    private final int minimumIdle;
    private final Duration connectionTimeout;
    private final Duration validationTimeout;
    private final Duration idleTimeout;
    private final int queryTimeoutSeconds;

    public HikariPoolFactory(
            DataSourceProperties dataSourceProperties,
            int maximumPoolSize,
            int minimumIdle,
            Duration connectionTimeout,
            Duration validationTimeout,
            Duration idleTimeout,
            int queryTimeoutSeconds
    ) {
        this.dataSourceProperties = dataSourceProperties;
        this.maximumPoolSize = maximumPoolSize;
        this.minimumIdle = minimumIdle;
        this.connectionTimeout = connectionTimeout;
        this.validationTimeout = validationTimeout;
        this.idleTimeout = idleTimeout;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public HikariDataSource open() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("scheduler-pool");
        config.setJdbcUrl(dataSourceProperties.determineUrl());
        config.setUsername(dataSourceProperties.determineUsername());
        config.setPassword(dataSourceProperties.determinePassword());
        String driverClassName = dataSourceProperties.determineDriverClassName();
        if (driverClassName != null) {
            config.setDriverClassName(driverClassName);
        }
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(Math.min(minimumIdle, maximumPoolSize));
        config.setConnectionTimeout(connectionTimeout.toMillis());
        config.setValidationTimeout(validationTimeout.toMillis());
        config.setIdleTimeout(idleTimeout.toMillis());
        // fail inside the constructor when the server is unreachable
        config.setInitializationFailTimeout(1);
        if (queryTimeoutSeconds > 0) {
            config.addDataSourceProperty("options", "-c statement_timeout=" + (queryTimeoutSeconds * 1000L));
        }
        return new HikariDataSource(config);
    }
}
