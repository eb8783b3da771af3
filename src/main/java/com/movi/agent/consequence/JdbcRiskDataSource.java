package com.movi.agent.consequence;

import com.movi.agent.transport.TransportRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Risk metric = booking percentage of the trip in daily_trips.
 */
@Component
public class JdbcRiskDataSource implements RiskDataSource {

    private final TransportRepository repository;

    public JdbcRiskDataSource(TransportRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<Double> findRiskMetric(String entityId) {
        return repository.findBookingPercentage(entityId);
    }
}
