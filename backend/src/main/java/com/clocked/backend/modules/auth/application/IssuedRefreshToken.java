package com.clocked.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

public record IssuedRefreshToken(String token, UUID tokenId, Instant expiresAt) {
}
