package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class ListTodaysTripsCapability extends TransportCapability {

    public ListTodaysTripsCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "list_todays_trips";
    }

    @Override
    public String getDescription() {
        return """
                Fetch all active trips for the day.
                Returns a list containing 'trip_id', 'display_name', 'live_status' and 'booking_status_percentage'.
                ALWAYS call this if you have a Name (e.g. 'Bulk - 00:01') but need the 'trip_id'.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(Map.of(), List.of());
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        return toJson(repository.listTodaysTrips());
    }
}
