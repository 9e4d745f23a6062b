package com.clocked.backend.modules.auth.application;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of verifying a token: either the decoded claims or the failure kind.
 * For {@link TokenFailure#RECORD_REVOKED} the claims are kept so callers can act on the
 * owner of a replayed refresh token.
 */
public record TokenVerification<T>(T claims, TokenFailure failure) {

    public static <T> TokenVerification<T> valid(T claims) {
        return new TokenVerification<>(claims, null);
    }

    public static <T> TokenVerification<T> rejected(TokenFailure failure) {
        return new TokenVerification<>(null, failure);
    }

    public static <T> TokenVerification<T> rejected(TokenFailure failure, T claims) {
        return new TokenVerification<>(claims, failure);
    }

    public boolean isValid() {
        return failure == null;
    }

    public Optional<T> validClaims() {
        return isValid() ? Optional.of(claims) : Optional.empty();
    }

    public <X extends RuntimeException> T orElseThrow(Function<TokenFailure, X> exceptionFactory) {
        if (!isValid()) {
            throw exceptionFactory.apply(failure);
        }
        return claims;
    }
}
