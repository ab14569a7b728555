package com.studentscheduler.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness and readiness probes. Neither of them opens a database connection: readiness reports
 * what the connection supervisor already knows.
 */
@RestController
public class HealthController {

    private final HealthIndicator databaseHealthIndicator;
    private final Clock clock;

    public HealthController(@Qualifier("database") HealthIndicator databaseHealthIndicator, Clock clock) {
        this.databaseHealthIndicator = databaseHealthIndicator;
        this.clock = clock;
    }

    /**
     * The process is up.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", null, Instant.now(clock).toString());
    }

    /**
     * Ready once the shared pool is connected. A paused database answers 503 with state IDLE
     * until the next real request wakes it.
     */
    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        var health = databaseHealthIndicator.health();
        Object state = health.getDetails().get("state");
        boolean up = Status.UP.equals(health.getStatus());
        HealthResponse body = new HealthResponse(
                up ? "UP" : "DOWN",
                state != null ? state.toString() : null,
                Instant.now(clock).toString()
        );
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    /**
     * Always 200; carries the database state for dashboards.
     */
    @GetMapping("/health")
    public HealthResponse health() {
        Object state = databaseHealthIndicator.health().getDetails().get("state");
        return new HealthResponse("UP", state != null ? state.toString() : null, Instant.now(clock).toString());
    }

    public record HealthResponse(
        String status,
        String database,
        String timestamp
    ) {}
}
