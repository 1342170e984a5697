package com.fusiongate.backend.trading.pipeline;

/**
 * Inputs to the entry score. Everything except {@code opportunityScore} (0-100) and
 * {@code dailyPerformance} (signed) is a 0-1 ratio.
 */
public record DecisionContext(
        double opportunityScore,
        double trendAlignment,
        double riskLevel,
        double shieldThreat,
        double marketStability,
        double dailyPerformance
) {}
