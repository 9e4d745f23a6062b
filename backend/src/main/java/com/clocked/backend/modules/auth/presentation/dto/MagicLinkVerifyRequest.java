package com.clocked.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record MagicLinkVerifyRequest(
        @NotBlank(message = "token is required") String token
) {
}
