package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Returns every row of the vehicles table; the assistant explains the limitation when asked
 * specifically about unassigned ones.
 */
@Component
public class ListUnassignedVehiclesCapability extends TransportCapability {

    public ListUnassignedVehiclesCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "list_unassigned_vehicles";
    }

    @Override
    public String getDescription() {
        return """
                List all vehicles (buses/cabs) with their details.
                Use this when the user asks for "all available buses", "all vehicles",
                or "how many vehicles are not assigned?".
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(), List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return toJson(repository.listVehicles());
    }
}
