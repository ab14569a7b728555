package com.studentscheduler.backend.global.database;

import java.time.Duration;

import javax.sql.DataSource;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Wires the resilient persistence layer. The supervised data source replaces Spring Boot's
 * auto-configured pool so that the pool can be thrown away and rebuilt at runtime.
 */
@Configuration
public class DatabaseConfig {

    @Value("${app.database.retry.max-attempts:5}")
    private int maxAttempts;

    @Value("${app.database.retry.initial-delay:PT2S}")
    private Duration initialDelay;

    @Value("${app.database.retry.multiplier:2.0}")
    private double multiplier;

    @Value("${app.database.retry.max-delay:PT30S}")
    private Duration maxDelay;

    @Value("${app.database.pool.maximum-size:10}")
    private int maximumPoolSize;

    @Value("${app.database.pool.minimum-idle:0}")
    private int minimumIdle;

    @Value("${app.database.pool.connection-timeout:PT60S}")
    private Duration connectionTimeout;

    @Value("${app.database.pool.validation-timeout:PT5S}")
    private Duration validationTimeout;

    @Value("${app.database.pool.idle-timeout:PT30S}")
    private Duration idleTimeout;

    @Value("${app.database.query-timeout:60}")
    private int queryTimeoutSeconds;

    @Bean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public RetryPolicy databaseRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .multiplier(multiplier)
                .maxDelay(maxDelay)
                .build();
    }

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public PoolFactory poolFactory(DataSourceProperties dataSourceProperties) {
        return new HikariPoolFactory(
                dataSourceProperties,
                maximumPoolSize,
                minimumIdle,
                connectionTimeout,
                validationTimeout,
                idleTimeout,
                queryTimeoutSeconds
        );
    }

    @Bean(destroyMethod = "close")
    public ConnectionSupervisor connectionSupervisor(
            PoolFactory poolFactory,
            ErrorClassifier errorClassifier,
            RetryPolicy databaseRetryPolicy,
            Sleeper retrySleeper
    ) {
        return new ConnectionSupervisor(poolFactory, errorClassifier, databaseRetryPolicy, retrySleeper);
    }

    @Bean
    @Primary
    public DataSource dataSource(ConnectionSupervisor connectionSupervisor, ErrorClassifier errorClassifier) {
        return new SupervisedDataSource(connectionSupervisor, errorClassifier);
    }

    @Bean
    public RetryExecutor retryExecutor(
            ConnectionSupervisor connectionSupervisor,
            ErrorClassifier errorClassifier,
            RetryPolicy databaseRetryPolicy,
            Sleeper retrySleeper,
            PlatformTransactionManager transactionManager
    ) {
        return new RetryExecutor(connectionSupervisor, errorClassifier, databaseRetryPolicy, retrySleeper, transactionManager);
    }
}
