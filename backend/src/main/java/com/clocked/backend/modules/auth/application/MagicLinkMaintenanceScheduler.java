package com.clocked.backend.modules.auth.application;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class MagicLinkMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MagicLinkMaintenanceScheduler.class);

    private final MagicLinkIssuer magicLinkIssuer;
    private final Duration retention;

    public MagicLinkMaintenanceScheduler(
            MagicLinkIssuer magicLinkIssuer,
            @Value("${clocked.auth.magic-link.retention:P1D}") Duration retention
    ) {
        this.magicLinkIssuer = magicLinkIssuer;
        this.retention = retention;
    }

    @Scheduled(fixedDelayString = "${clocked.auth.magic-link.purge-interval:PT1H}")
    public void purgeExpiredLinks() {
        int purged = magicLinkIssuer.purgeExpired(retention);
        if (purged > 0) {
            log.info("Purged {} expired magic links", purged);
        }
    }
}
