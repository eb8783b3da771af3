package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class ListStopsForPathCapability extends TransportCapability {

    public ListStopsForPathCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "list_stops_for_path";
    }

    @Override
    public String getDescription() {
        return "Get the ordered list of stops for a specific path ID.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of("path_id", stringProperty("The path_id whose stops should be listed")),
                List.of("path_id"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String pathId = stringArg(arguments, "path_id");
        if (pathId == null) {
            return "ERROR: 'path_id' is required";
        }
        return toJson(repository.listPath(pathId));
    }
}
