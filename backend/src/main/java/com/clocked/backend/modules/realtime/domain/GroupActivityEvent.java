package com.clocked.backend.modules.realtime.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Something that happened inside a group and should reach its live members.
 * Publish it through Spring's {@code ApplicationEventPublisher}; delivery happens after commit.
 */
public record GroupActivityEvent(
        GroupEventType type,
        UUID groupId,
        UUID actorUserId,
        Map<String, Object> payload,
        boolean excludeActor
) {

    public GroupActivityEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(groupId, "groupId");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static GroupActivityEvent of(GroupEventType type, UUID groupId, UUID actorUserId, Map<String, Object> payload) {
        return new GroupActivityEvent(type, groupId, actorUserId, payload, false);
    }

    public GroupActivityEvent excludingActor() {
        return new GroupActivityEvent(type, groupId, actorUserId, payload, true);
    }
}
