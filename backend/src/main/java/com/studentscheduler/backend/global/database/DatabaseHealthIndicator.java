package com.studentscheduler.backend.global.database;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the supervisor's view of the database without opening a connection, so probing health
 * never wakes a paused server.
 */
@Component("database")
public class DatabaseHealthIndicator implements HealthIndicator {

    private final ConnectionSupervisor supervisor;

    public DatabaseHealthIndicator(ConnectionSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public Health health() {
        ConnectionSupervisor.State state = supervisor.state();
        Health.Builder builder = state == ConnectionSupervisor.State.CONNECTED ? Health.up() : Health.outOfService();
        return builder.withDetail("state", state.name()).build();
    }
}
