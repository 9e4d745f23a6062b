package com.clocked.backend.modules.auth.application;

public enum MagicLinkFailure {
    NOT_FOUND,
    ALREADY_USED,
    EXPIRED
}
