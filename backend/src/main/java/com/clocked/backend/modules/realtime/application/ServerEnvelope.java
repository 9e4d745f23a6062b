package com.clocked.backend.modules.realtime.application;

import com.clocked.backend.modules.realtime.domain.MessageType;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerEnvelope(MessageType type, Object data, String timestamp) {
}
