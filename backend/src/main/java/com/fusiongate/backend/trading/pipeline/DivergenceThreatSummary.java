package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

/**
 * Latest threat reading together with aggregates over the bounded history.
 */
public record DivergenceThreatSummary(
        double strength,
        double confidence,
        double volatility,
        DivergenceReading.DivergenceDirection direction,
        double currentThreat,
        DivergenceThreatScore.ThreatLevel level,
        double averageThreat,
        double peakThreat,
        double trend,
        int sampleCount,
        Instant timestamp
) {}
