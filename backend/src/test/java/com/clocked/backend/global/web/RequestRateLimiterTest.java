package com.clocked.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.clocked.backend.global.error.RetryableProblemException;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class RequestRateLimiterTest {

    private final RequestRateLimiter limiter = new RequestRateLimiter("magic-link", 5, Duration.ofMinutes(15));

    @Test
    void sixthRequestInWindowIsRejectedWithRetryAfter() {
        for (int i = 0; i < 5; i++) {
            limiter.acquire("10.0.0.1");
        }

        assertThatThrownBy(() -> limiter.acquire("10.0.0.1"))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getCode()).isEqualTo(RequestRateLimiter.RATE_LIMIT_EXCEEDED);
                    assertThat(ex.getRetryAfterSeconds()).isBetween(1, 900);
                });
    }

    @Test
    void keysAreCountedSeparately() {
        for (int i = 0; i < 5; i++) {
            limiter.acquire("10.0.0.1");
        }

        assertThatCode(() -> limiter.acquire("10.0.0.2")).doesNotThrowAnyException();
        assertThat(limiter.trackedKeys()).isEqualTo(2);
    }

    @Test
    void permitsComeBackAfterTheWindow() throws InterruptedException {
        RequestRateLimiter shortWindow = new RequestRateLimiter("short", 1, Duration.ofMillis(200));
        shortWindow.acquire("10.0.0.1");
        assertThatThrownBy(() -> shortWindow.acquire("10.0.0.1")).isInstanceOf(RetryableProblemException.class);

        Thread.sleep(450);

        assertThatCode(() -> shortWindow.acquire("10.0.0.1")).doesNotThrowAnyException();
    }

    @Test
    void concurrentRequestsForNewKeyAreAllCounted() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        limiter.acquire("10.0.0.9");
                        return true;
                    } catch (RetryableProblemException ex) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }
            assertThat(accepted).isEqualTo(5);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsNonsenseConfiguration() {
        assertThatThrownBy(() -> new RequestRateLimiter("bad", 0, Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RequestRateLimiter("bad", 1, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
