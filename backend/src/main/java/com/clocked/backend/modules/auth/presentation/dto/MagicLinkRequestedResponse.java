package com.clocked.backend.modules.auth.presentation.dto;

public record MagicLinkRequestedResponse(String message, long expiresIn) {
}
