package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Removes the deployed vehicle from a trip, cancelling its trip-sheet.
 *
 * This is the designated dangerous capability: the orchestrator never dispatches it
 * without a consequence check or an explicit user confirmation.
 */
@Component
public class RemoveVehicleFromTripCapability extends TransportCapability {

    public static final String NAME = "remove_vehicle_from_trip_action";

    public RemoveVehicleFromTripCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                ACTUALLY removes the vehicle from a trip.
                Call it with the trip_id once you have it; the system checks bookings before executing.
                Do not check bookings yourself.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of("trip_id", stringProperty("The trip_id, e.g. trip_005. Look it up with list_todays_trips first.")),
                List.of("trip_id"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String tripId = stringArg(arguments, "trip_id");
        if (tripId == null) {
            return "ERROR: 'trip_id' is required";
        }
        int removed = repository.removeVehicle(tripId);
        if (removed == 0) {
            return "No vehicle was deployed on trip " + tripId + ". Nothing removed.";
        }
        return "Vehicle removed from trip " + tripId + ". Trip-sheet cancelled.";
    }
}
