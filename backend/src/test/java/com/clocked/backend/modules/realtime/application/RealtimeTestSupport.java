package com.clocked.backend.modules.realtime.application;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

final class RealtimeTestSupport {

    static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private RealtimeTestSupport() {
    }

    static JsonNode json(String frame) {
        try {
            return OBJECT_MAPPER.readTree(frame);
        } catch (Exception ex) {
            throw new IllegalStateException(ex);
        }
    }
}
