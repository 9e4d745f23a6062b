package com.clocked.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record RefreshTokenClaims(UUID userId, UUID tokenId, Instant issuedAt, Instant expiresAt) {
}
