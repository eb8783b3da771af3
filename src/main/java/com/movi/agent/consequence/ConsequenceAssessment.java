package com.movi.agent.consequence;

import com.movi.agent.model.RiskLevel;

/**
 * @param warning user-facing warning, present only for HIGH
 * @param metric  the metric the decision was based on, null when none was found
 */
public record ConsequenceAssessment(RiskLevel risk, String warning, Double metric) {

    public static ConsequenceAssessment low(Double metric) {
        return new ConsequenceAssessment(RiskLevel.LOW, null, metric);
    }

    public boolean isHigh() {
        return risk == RiskLevel.HIGH;
    }
}
