package com.clocked.backend.modules.realtime.domain;

public enum ClientMessageType {
    PING("ping"),
    JOIN_GROUP("join_group"),
    LEAVE_GROUP("leave_group"),
    UNKNOWN(null);

    private final String wireName;

    ClientMessageType(String wireName) {
        this.wireName = wireName;
    }

    public static ClientMessageType fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (ClientMessageType type : values()) {
            if (value.equals(type.wireName)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
