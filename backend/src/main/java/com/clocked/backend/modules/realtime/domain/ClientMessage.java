package com.clocked.backend.modules.realtime.domain;

import java.util.UUID;

/**
 * Decoded inbound frame. {@code groupId} is null when absent or not a valid id.
 */
public record ClientMessage(ClientMessageType type, UUID groupId) {
}
