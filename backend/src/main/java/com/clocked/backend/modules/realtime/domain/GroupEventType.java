package com.clocked.backend.modules.realtime.domain;

public enum GroupEventType {
    SESSION_STARTED(MessageType.SESSION_STARTED),
    SESSION_ENDED(MessageType.SESSION_ENDED),
    REACTION_ADDED(MessageType.REACTION_ADDED),
    MEMBER_JOINED(MessageType.MEMBER_JOINED);

    private final MessageType messageType;

    GroupEventType(MessageType messageType) {
        this.messageType = messageType;
    }

    public MessageType messageType() {
        return messageType;
    }
}
