package com.movi.agent.capability.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.capability.Capability;
import com.movi.agent.transport.TransportRepository;

import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for capabilities backed by the transport tables:
 * argument extraction and JSON rendering of result rows.
 */
abstract class TransportCapability implements Capability {

    protected final TransportRepository repository;
    private final ObjectMapper objectMapper;

    protected TransportCapability(TransportRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    protected String toJson(Object rows) {
        try {
            return objectMapper.writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize result rows", e);
        }
    }

    /** Trimmed string argument, or null when absent or blank. */
    protected static String stringArg(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value == null) return null;
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    protected static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of(
                "type", "object",
                "properties", properties,
                "required", required
        );
    }

    protected static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }
}
