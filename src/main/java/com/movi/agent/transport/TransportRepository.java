package com.movi.agent.transport;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Plain JdbcTemplate access to the transport tables (routes, paths, stops, daily_trips,
 * vehicles, deployments, documents). All queries are parameterized.
 */
@Repository
@Slf4j
public class TransportRepository {

    private final JdbcTemplate jdbcTemplate;

    public TransportRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Map<String, Object>> listRoutes() {
        return jdbcTemplate.queryForList("SELECT * FROM routes");
    }

    public List<Map<String, Object>> listPath(String pathId) {
        return jdbcTemplate.queryForList("SELECT * FROM paths WHERE path_id = ?", pathId);
    }

    public List<Map<String, Object>> findTrip(String tripId) {
        return jdbcTemplate.queryForList("SELECT * FROM daily_trips WHERE trip_id = ?", tripId);
    }

    /** Minimal fields so a display name can be mapped to its trip_id. */
    public List<Map<String, Object>> listTodaysTrips() {
        return jdbcTemplate.queryForList(
                "SELECT trip_id, display_name, live_status, booking_status_percentage FROM daily_trips");
    }

    public List<Map<String, Object>> listVehicles() {
        return jdbcTemplate.queryForList("SELECT * FROM vehicles");
    }

    public List<Map<String, Object>> searchStops(String query) {
        return jdbcTemplate.queryForList(
                "SELECT * FROM stops WHERE name ILIKE ? ORDER BY name", "%" + query + "%");
    }

    public String createStop(String name, double latitude, double longitude) {
        String stopId = "stop_" + UUID.randomUUID().toString().substring(0, 4);
        jdbcTemplate.update(
                "INSERT INTO stops (stop_id, name, latitude, longitude) VALUES (?, ?, ?, ?)",
                stopId, name, latitude, longitude);
        log.info("Created stop [stopId={}, name={}]", stopId, name);
        return stopId;
    }

    @Transactional
    public String assignVehicle(String tripId, String vehicleId, String driverId) {
        String deploymentId = "dep_" + UUID.randomUUID().toString().substring(0, 4);
        jdbcTemplate.update(
                "INSERT INTO deployments (deployment_id, trip_id, vehicle_id, driver_id) VALUES (?, ?, ?, ?)",
                deploymentId, tripId, vehicleId, driverId);
        jdbcTemplate.update("UPDATE daily_trips SET live_status = 'Scheduled' WHERE trip_id = ?", tripId);
        log.info("Assigned vehicle [deploymentId={}, tripId={}, vehicleId={}]", deploymentId, tripId, vehicleId);
        return deploymentId;
    }

    /** Deletes the trip's deployments; returns the number of rows removed. */
    public int removeVehicle(String tripId) {
        int removed = jdbcTemplate.update("DELETE FROM deployments WHERE trip_id = ?", tripId);
        log.info("Removed {} deployment(s) from trip [tripId={}]", removed, tripId);
        return removed;
    }

    /**
     * Booking percentage of a trip, empty when the trip has no row or the column is null.
     */
    public Optional<Double> findBookingPercentage(String tripId) {
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT booking_status_percentage FROM daily_trips WHERE trip_id = ?", tripId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        Object value = rows.get(0).get("booking_status_percentage");
        return value instanceof Number number
                ? Optional.of(number.doubleValue())
                : Optional.empty();
    }

    public List<String> searchDocuments(String query, int limit) {
        return jdbcTemplate.queryForList(
                "SELECT content FROM documents WHERE content ILIKE ? LIMIT ?",
                String.class, "%" + query + "%", limit);
    }
}
