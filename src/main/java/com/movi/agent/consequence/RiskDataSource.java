package com.movi.agent.consequence;

import java.util.Optional;

/**
 * Read-only source of the risk metric used by the consequence check.
 */
public interface RiskDataSource {

    /**
     * @return the metric for the entity, or empty when nothing is recorded for it
     */
    Optional<Double> findRiskMetric(String entityId);
}
