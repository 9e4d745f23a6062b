package com.clocked.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or still carry development defaults.
 * Skipped for the {@code test} and {@code local} profiles.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-clocked-jwt-secret-change-in-production-0000";
    private static final int MIN_SECRET_LENGTH = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        if (Arrays.stream(environment.getActiveProfiles()).anyMatch(p -> p.equals("test") || p.equals("local"))) {
            return;
        }
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : new String[] {"spring.datasource.url", "clocked.jwt.secret", "app.cors.allowed-origins"}) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add("missing " + key);
            }
        }
        Optional<String> secret = Optional.ofNullable(environment.getProperty("clocked.jwt.secret"));
        if (secret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("clocked.jwt.secret still uses the development default");
        }
        if (secret.filter(value -> !value.isBlank() && value.length() < MIN_SECRET_LENGTH).isPresent()) {
            problems.add("clocked.jwt.secret must be at least " + MIN_SECRET_LENGTH + " characters");
        }
        return problems;
    }
}
