package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class CreateNewStopCapability extends TransportCapability {

    public CreateNewStopCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "create_new_stop";
    }

    @Override
    public String getDescription() {
        return "Create a new stop location with a name and coordinates.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of(
                        "name", stringProperty("Display name of the stop"),
                        "lat", Map.of("type", "number", "description", "Latitude in decimal degrees"),
                        "lon", Map.of("type", "number", "description", "Longitude in decimal degrees")
                ),
                List.of("name", "lat", "lon"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String name = stringArg(arguments, "name");
        Double lat = numberArg(arguments, "lat");
        Double lon = numberArg(arguments, "lon");
        if (name == null || lat == null || lon == null) {
            return "ERROR: 'name', 'lat' and 'lon' are required";
        }
        if (lat < -90 || lat > 90 || lon < -180 || lon > 180) {
            return "ERROR: coordinates out of range (lat " + lat + ", lon " + lon + ")";
        }
        String stopId = repository.createStop(name, lat, lon);
        return "Stop created successfully with ID: " + stopId;
    }

    private static Double numberArg(Map<String, Object> arguments, String key) {
        Object value = arguments.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
