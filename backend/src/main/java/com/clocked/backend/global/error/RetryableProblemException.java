package com.clocked.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Problem the client may retry later; rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RetryableProblemException tooManyRequests(String code, String detail, int retryAfterSeconds) {
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, code, detail, retryAfterSeconds);
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
