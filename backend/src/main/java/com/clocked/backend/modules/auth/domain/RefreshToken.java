package com.clocked.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Persisted half of a refresh token. Rows are revoked, never deleted, so a presented token
 * can always be told apart from one that never existed.
 */
@Entity
@Table(name = "refresh_token")
public class RefreshToken {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "secret", nullable = false, updatable = false, length = 128)
    private String secret;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "revoked", nullable = false)
    private boolean revoked;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_reason", length = 32)
    private String revokedReason;

    protected RefreshToken() {
    }

    public RefreshToken(UUID id, UUID userId, String secret, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
        this.id = id;
        this.userId = userId;
        this.secret = secret;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getSecret() {
        return secret;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public String getRevokedReason() {
        return revokedReason;
    }

    public void revoke(OffsetDateTime at, RevocationReason reason) {
        if (revoked) {
            return;
        }
        this.revoked = true;
        this.revokedAt = at;
        this.revokedReason = reason.name();
    }

    public boolean isUsableAt(OffsetDateTime now) {
        return !revoked && expiresAt.isAfter(now);
    }
}
