package com.clocked.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record TokenPair(
        UUID userId,
        String accessToken,
        Instant accessTokenExpiresAt,
        String refreshToken,
        Instant refreshTokenExpiresAt,
        Instant issuedAt
) {
}
