package com.clocked.backend.modules.realtime.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.clocked.backend.modules.realtime.domain.CloseCodes;
import com.clocked.backend.modules.realtime.domain.LiveConnection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IdleConnectionReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleConnectionReaper.class);

    private final ConnectionRegistry registry;
    private final BroadcastHub hub;
    private final Clock clock;
    private final Duration idleTimeout;

    public IdleConnectionReaper(
            ConnectionRegistry registry,
            BroadcastHub hub,
            Clock clock,
            @Value("${clocked.realtime.idle-timeout:PT2M}") Duration idleTimeout
    ) {
        this.registry = registry;
        this.hub = hub;
        this.clock = clock;
        this.idleTimeout = idleTimeout;
    }

    @Scheduled(fixedDelayString = "${clocked.realtime.idle-check-interval:PT30S}")
    public int reapIdleConnections() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int reaped = 0;
        for (LiveConnection connection : registry.snapshot()) {
            if (connection.isIdleSince(cutoff)) {
                hub.disconnect(connection, CloseCodes.GOING_AWAY, "Idle timeout");
                reaped++;
            }
        }
        if (reaped > 0) {
            log.info("Closed {} idle realtime connections", reaped);
        }
        return reaped;
    }
}
