package com.movi.agent.consequence;

import com.movi.agent.model.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Classifies the risk of removing the vehicle from a trip.
 *
 * Policy:
 * - metric > 0            → HIGH, with a warning quoting the booking percentage
 * - metric 0 or absent    → LOW
 * - no row for the entity → LOW (fail open: trips not yet tracked must stay operable)
 * - lookup failure        → LOW, logged at WARN
 *
 * Evaluation has no side effects, so the same entity with unchanged data always
 * yields the same result.
 */
@Component
@Slf4j
public class ConsequenceEvaluator {

    private final RiskDataSource riskDataSource;

    public ConsequenceEvaluator(RiskDataSource riskDataSource) {
        this.riskDataSource = riskDataSource;
    }

    public ConsequenceAssessment evaluate(String entityId) {
        Optional<Double> metric;
        try {
            metric = riskDataSource.findRiskMetric(entityId);
        } catch (RuntimeException e) {
            log.warn("Risk lookup failed for entity={}, defaulting to LOW: {}", entityId, e.getMessage());
            return ConsequenceAssessment.low(null);
        }

        if (metric.isEmpty()) {
            log.info("No risk data for entity={}, treating as LOW", entityId);
            return ConsequenceAssessment.low(null);
        }

        double value = metric.get();
        if (value <= 0) {
            log.info("Risk metric for entity={} is {}, LOW", entityId, formatPercent(value));
            return ConsequenceAssessment.low(value);
        }

        log.info("Risk metric for entity={} is {}, HIGH", entityId, formatPercent(value));
        return new ConsequenceAssessment(
                RiskLevel.HIGH, buildWarning(value), value);
    }

    /** Tool-result text recorded against the paused call. */
    public static String interlockNotice(double metric) {
        return "SAFETY INTERLOCK: Trip is " + formatPercent(metric)
                + "% booked. Action paused pending user confirmation.";
    }

    static String buildWarning(double metric) {
        return "⚠️ **WAIT!** This trip is **" + formatPercent(metric) + "% booked**. "
                + "Removing the vehicle will cancel these bookings.\n\nDo you want to proceed?";
    }

    /** 60.0 → "60", 12.5 → "12.5" */
    static String formatPercent(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
