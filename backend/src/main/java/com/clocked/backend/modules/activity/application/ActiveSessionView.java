package com.clocked.backend.modules.activity.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.clocked.backend.modules.activity.domain.SessionCategory;
import com.clocked.backend.modules.activity.domain.SessionVisibility;

public record ActiveSessionView(
        UUID id,
        UUID userId,
        String handle,
        String photoUrl,
        boolean privacyMode,
        SessionCategory category,
        OffsetDateTime startTs,
        int targetMin,
        String locationCoarse,
        String note,
        SessionVisibility visibility
) {
}
