package com.clocked.backend.modules.auth.application;

/**
 * Why a presented token was rejected. Every kind is terminal for the call that saw it.
 */
public enum TokenFailure {
    MISSING,
    MALFORMED,
    BAD_SIGNATURE,
    EXPIRED,
    CLAIM_MISMATCH,
    RECORD_NOT_FOUND,
    RECORD_REVOKED,
    RECORD_EXPIRED
}
