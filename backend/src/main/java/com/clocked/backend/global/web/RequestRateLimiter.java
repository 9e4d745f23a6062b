package com.clocked.backend.global.web;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import com.clocked.backend.global.error.RetryableProblemException;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-key rate limit (client address, email...) backed by one resilience4j limiter per key.
 * Each key gets {@code maxRequests} permits per refresh period and never waits for one.
 */
public class RequestRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RequestRateLimiter.class);

    public static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";

    private final String name;
    private final RateLimiterRegistry registry;
    private final Duration window;

    public RequestRateLimiter(String name, int maxRequests, Duration window) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.name = name;
        this.window = window;
        this.registry = RateLimiterRegistry.of(RateLimiterConfig.custom()
                .limitForPeriod(maxRequests)
                .limitRefreshPeriod(window)
                .timeoutDuration(Duration.ZERO)
                .build());
    }

    /**
     * Takes a permit for {@code key} or throws a 429 problem carrying the seconds until the key's
     * permits refresh.
     */
    public void acquire(String key) {
        RateLimiter limiter = registry.rateLimiter(name + ":" + key);
        try {
            RateLimiter.waitForPermission(limiter);
        } catch (RequestNotPermitted ex) {
            int retryAfter = retryAfterSeconds(limiter);
            log.info("Rate limit {} exceeded for {}, retry in {}s", name, key, retryAfter);
            throw RetryableProblemException.tooManyRequests(RATE_LIMIT_EXCEEDED, "Too many requests", retryAfter);
        }
    }

    int trackedKeys() {
        return registry.getAllRateLimiters().size();
    }

    private int retryAfterSeconds(RateLimiter limiter) {
        long nanosToWait = limiter instanceof AtomicRateLimiter
                ? ((AtomicRateLimiter) limiter).getDetailedMetrics().getNanosToWait()
                : window.toNanos();
        long seconds = TimeUnit.NANOSECONDS.toSeconds(nanosToWait + TimeUnit.SECONDS.toNanos(1) - 1);
        return (int) Math.max(1L, Math.min(seconds, window.toSeconds()));
    }
}
