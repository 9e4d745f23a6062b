package com.clocked.backend.modules.auth.application;

public record MagicLinkVerification(String email, MagicLinkFailure failure) {

    public static MagicLinkVerification verified(String email) {
        return new MagicLinkVerification(email, null);
    }

    public static MagicLinkVerification rejected(MagicLinkFailure failure) {
        return new MagicLinkVerification(null, failure);
    }

    public boolean isVerified() {
        return failure == null;
    }
}
