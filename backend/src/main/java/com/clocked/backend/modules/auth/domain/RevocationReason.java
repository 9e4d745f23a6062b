package com.clocked.backend.modules.auth.domain;

public enum RevocationReason {
    ROTATED,
    LOGOUT,
    LOGOUT_ALL,
    REUSE_DETECTED
}
