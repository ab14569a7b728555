package com.studentscheduler.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.DockerClientFactory;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. The schema comes from the
 * application's own Flyway migrations; every test starts from empty tables.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("student_scheduler_test")
            .withUsername("scheduler")
            .withPassword("scheduler_password");

    static {
        String dockerHost = System.getProperty("docker.host");
        if (dockerHost == null || dockerHost.isBlank()) {
            dockerHost = System.getenv("DOCKER_HOST");
        }
        if (dockerHost != null && !dockerHost.isBlank()) {
            System.setProperty("docker.host", dockerHost);
        }
        logDockerDiagnostics();
        POSTGRES.start();
    }

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("app.database.retry.initial-delay", () -> "PT0.05S");
        registry.add("app.database.retry.max-delay", () -> "PT0.2S");
    }

    private static void logDockerDiagnostics() {
        try {
            DockerClientFactory factory = DockerClientFactory.instance();
            System.out.println("[testcontainers] dockerHost=" + factory.getTransportConfig().getDockerHost());
        } catch (Exception ex) {
            System.out.println("[testcontainers] diagnostics failed: " + ex.getMessage());
        }
    }

    protected static Connection openConnection() throws SQLException {
        return DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    }

    protected static long countRows(String sql) {
        try (Connection connection = openConnection();
             Statement stmt = connection.createStatement();
             var rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to run count query: " + sql, ex);
        }
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = openConnection();
             Statement stmt = connection.createStatement()) {
            stmt.execute("TRUNCATE TABLE schedule_entry, schedule, course, app_user CASCADE");
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to truncate tables after test", ex);
        }
    }
}
