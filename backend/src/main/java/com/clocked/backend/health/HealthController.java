package com.clocked.backend.health;

import java.time.Clock;
import java.time.Instant;

import com.clocked.backend.modules.realtime.application.BroadcastHub;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness with the live connection count, and readiness backed by the database health indicator.
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthEndpoint healthEndpoint;
    private final BroadcastHub broadcastHub;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, BroadcastHub broadcastHub, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.broadcastHub = broadcastHub;
        this.clock = clock;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("UP", Instant.now(clock).toString(), broadcastHub.connectedCount());
    }

    @GetMapping("/readyz")
    public HealthResponse readyz() {
        String status;
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            status = healthComponent.getStatus().getCode();
            if (healthComponent instanceof CompositeHealth composite
                    && composite.getComponents().get("db") instanceof Health dbHealth) {
                status = dbHealth.getStatus().getCode();
            }
        } catch (RuntimeException ex) {
            log.warn("Readiness check failed: {}", ex.getMessage());
            status = "DOWN";
        }
        return new HealthResponse(status, Instant.now(clock).toString(), broadcastHub.connectedCount());
    }

    public record HealthResponse(String status, String timestamp, int connections) {
    }
}
