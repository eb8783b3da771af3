package com.movi.agent.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One capability invocation requested by the reasoning service.
 * The id is assigned by the provider and must be echoed back on the matching tool result.
 */
@Value
@Builder
@Jacksonized
public class CapabilityCall {

    String id;

    String name;

    @Builder.Default
    Map<String, Object> arguments = Map.of();

    /**
     * Returns the argument as a trimmed string, or null when it is absent or blank.
     */
    public String stringArgument(String key) {
        Object value = arguments == null ? null : arguments.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
