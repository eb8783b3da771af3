package com.movi.agent.capability;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a capability's schema sent to the reasoning service.
 * Decouples the wire format from the Capability implementation.
 */
@Data
@Builder
public class CapabilityDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static CapabilityDefinition from(Capability capability) {
        return CapabilityDefinition.builder()
                .name(capability.getName())
                .description(capability.getDescription())
                .inputSchema(capability.getInputSchema())
                .build();
    }

    /**
     * OpenAI-compatible function format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
