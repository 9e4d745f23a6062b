package com.clocked.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.clocked.backend.modules.auth.application.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair pair) {
        return new TokenPairResponse(
                pair.accessToken(),
                DEFAULT_TOKEN_TYPE,
                Duration.between(pair.issuedAt(), pair.accessTokenExpiresAt()).toSeconds(),
                pair.refreshToken(),
                Duration.between(pair.issuedAt(), pair.refreshTokenExpiresAt()).toSeconds(),
                OffsetDateTime.ofInstant(pair.issuedAt(), ZoneOffset.UTC)
        );
    }
}
