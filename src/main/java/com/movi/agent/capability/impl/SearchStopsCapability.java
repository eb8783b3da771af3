package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class SearchStopsCapability extends TransportCapability {

    public SearchStopsCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "search_stops";
    }

    @Override
    public String getDescription() {
        return "Search for stops by name. Use this to find a stop_id from a stop name.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of("query", stringProperty("Part of the stop name, e.g. 'Gavipuram'")),
                List.of("query"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String query = stringArg(arguments, "query");
        if (query == null) {
            return "ERROR: 'query' is required";
        }
        List<Map<String, Object>> stops = repository.searchStops(query);
        if (stops.isEmpty()) {
            return "No stops found matching '" + query + "'.";
        }
        return toJson(stops);
    }
}
