package com.clocked.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record AccessTokenClaims(UUID userId, String email, String handle, Instant issuedAt, Instant expiresAt) {
}
