package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class ListAllRoutesCapability extends TransportCapability {

    public ListAllRoutesCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "list_all_routes";
    }

    @Override
    public String getDescription() {
        return "Call this to view all available transport routes.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(), List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return toJson(repository.listRoutes());
    }
}
