package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class GetTripDetailsCapability extends TransportCapability {

    public GetTripDetailsCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "get_trip_details";
    }

    @Override
    public String getDescription() {
        return """
                Get details of a specific trip, including booking status.
                Useful for checking if a trip is active or booked.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of("trip_id", stringProperty("The trip_id, e.g. trip_005. Never a display name.")),
                List.of("trip_id"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String tripId = stringArg(arguments, "trip_id");
        if (tripId == null) {
            return "ERROR: 'trip_id' is required";
        }
        return toJson(repository.findTrip(tripId));
    }
}
