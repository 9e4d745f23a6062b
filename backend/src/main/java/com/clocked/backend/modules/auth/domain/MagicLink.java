package com.clocked.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Single-use passwordless login token. {@code used} only ever flips from false to true.
 */
@Entity
@Table(name = "magic_link")
public class MagicLink {

    @Id
    @Column(name = "token", nullable = false, updatable = false, length = 64)
    private String token;

    @Column(name = "email", nullable = false, updatable = false, length = 320)
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private OffsetDateTime usedAt;

    protected MagicLink() {
    }

    public MagicLink(String token, String email, OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.token = token;
        this.email = email;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getToken() {
        return token;
    }

    public String getEmail() {
        return email;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isUsed() {
        return used;
    }

    public OffsetDateTime getUsedAt() {
        return usedAt;
    }

    public void markUsed(OffsetDateTime at) {
        this.used = true;
        this.usedAt = at;
    }

    public boolean isUsableAt(OffsetDateTime now) {
        return !used && expiresAt.isAfter(now);
    }
}
