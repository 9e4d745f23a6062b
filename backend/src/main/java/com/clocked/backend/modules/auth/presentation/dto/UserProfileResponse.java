package com.clocked.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clocked.backend.modules.auth.domain.UserAccount;

public record UserProfileResponse(
        UUID id,
        String handle,
        String email,
        String photoUrl,
        boolean privacyMode,
        OffsetDateTime createdAt
) {
    public static UserProfileResponse from(UserAccount user) {
        return new UserProfileResponse(
                user.getId(),
                user.getHandle(),
                user.getEmail(),
                user.getPhotoUrl(),
                user.isPrivacyMode(),
                user.getCreatedAt()
        );
    }
}
