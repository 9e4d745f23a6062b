package com.clocked.backend.modules.realtime.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Server to client message types, serialized by their wire name.
 */
public enum MessageType {
    CONNECTED("connected"),
    ERROR("error"),
    PONG("pong"),
    GROUP_JOINED("group_joined"),
    GROUP_LEFT("group_left"),
    SESSION_STARTED("session_started"),
    SESSION_ENDED("session_ended"),
    REACTION_ADDED("reaction_added"),
    MEMBER_JOINED("member_joined");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
