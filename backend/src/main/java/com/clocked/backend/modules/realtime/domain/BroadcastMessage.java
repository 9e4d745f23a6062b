package com.clocked.backend.modules.realtime.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record BroadcastMessage(MessageType type, UUID groupId, Map<String, Object> payload, Instant timestamp) {

    public BroadcastMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(groupId, "groupId");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
