package com.clocked.backend.modules.realtime.application;

import java.time.Instant;
import java.util.UUID;

import com.clocked.backend.modules.realtime.domain.ClientMessage;
import com.clocked.backend.modules.realtime.domain.ClientMessageType;
import com.clocked.backend.modules.realtime.domain.MessageType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.stereotype.Component;

/**
 * JSON framing for the realtime channel: {@code {type, data?, timestamp}} out, {@code {type, data?}} in.
 */
@Component
public class RealtimeMessageCodec {

    private final ObjectMapper objectMapper;

    public RealtimeMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(MessageType type, Object data, Instant timestamp) {
        try {
            return objectMapper.writeValueAsString(new ServerEnvelope(type, data, timestamp.toString()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode " + type.wireName() + " message", ex);
        }
    }

    public ClientMessage decode(String text) throws InvalidClientMessageException {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException ex) {
            throw new InvalidClientMessageException("Unparseable frame", ex);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidClientMessageException("Frame is not a JSON object");
        }
        JsonNode typeNode = root.get("type");
        String rawType = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
        return new ClientMessage(ClientMessageType.fromWire(rawType), parseGroupId(root.path("data").path("groupId")));
    }

    private static UUID parseGroupId(JsonNode node) {
        if (!node.isTextual()) {
            return null;
        }
        try {
            return UUID.fromString(node.asText());
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
