package com.clocked.backend.modules.auth.application;

/**
 * Out-of-band delivery of a magic link (email in production).
 */
public interface MagicLinkSender {

    void send(String email, String link);
}
