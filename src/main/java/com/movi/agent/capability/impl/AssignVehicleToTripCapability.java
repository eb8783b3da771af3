package com.movi.agent.capability.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.movi.agent.transport.TransportRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Deploys a vehicle and driver onto a trip and marks the trip Scheduled.
 */
@Component
@Slf4j
public class AssignVehicleToTripCapability extends TransportCapability {

    public AssignVehicleToTripCapability(TransportRepository repository, ObjectMapper objectMapper) {
        super(repository, objectMapper);
    }

    @Override
    public String getName() {
        return "assign_vehicle_to_trip";
    }

    @Override
    public String getDescription() {
        return "Assign a vehicle and driver to a trip (Deploy).";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return objectSchema(
                Map.of(
                        "trip_id", stringProperty("The trip_id to deploy onto"),
                        "vehicle_id", stringProperty("The vehicle_id to assign"),
                        "driver_id", stringProperty("The driver_id to assign")
                ),
                List.of("trip_id", "vehicle_id", "driver_id"));
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        String tripId = stringArg(arguments, "trip_id");
        String vehicleId = stringArg(arguments, "vehicle_id");
        String driverId = stringArg(arguments, "driver_id");
        if (tripId == null || vehicleId == null || driverId == null) {
            return "ERROR: 'trip_id', 'vehicle_id' and 'driver_id' are required";
        }
        try {
            repository.assignVehicle(tripId, vehicleId, driverId);
            return "Vehicle assigned successfully.";
        } catch (DataAccessException e) {
            log.warn("Vehicle assignment failed [tripId={}, vehicleId={}]: {}", tripId, vehicleId, e.getMessage());
            return "ERROR: Error assigning vehicle: " + e.getMostSpecificCause().getMessage();
        }
    }
}
