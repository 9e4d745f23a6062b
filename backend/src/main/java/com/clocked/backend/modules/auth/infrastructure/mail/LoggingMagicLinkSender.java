package com.clocked.backend.modules.auth.infrastructure.mail;

import com.clocked.backend.modules.auth.application.MagicLinkSender;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default sender until an email provider is wired in. Prints the link only when
 * {@code clocked.auth.magic-link.log-links} is enabled (local development).
 */
@Component
public class LoggingMagicLinkSender implements MagicLinkSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingMagicLinkSender.class);

    private final boolean logLinks;

    public LoggingMagicLinkSender(@Value("${clocked.auth.magic-link.log-links:false}") boolean logLinks) {
        this.logLinks = logLinks;
    }

    @Override
    public void send(String email, String link) {
        if (logLinks) {
            log.info("Magic link for {}: {}", email, link);
        } else {
            log.info("Magic link issued for {}", email);
        }
    }
}
