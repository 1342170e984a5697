package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

public record DivergenceThreatScore(
        double strength,
        double confidence,
        double volatility,
        DivergenceReading.DivergenceDirection direction,
        double threatScore,
        ThreatLevel level,
        Instant timestamp
) {
    public enum ThreatLevel {
        NONE,
        LOW,
        ELEVATED,
        HIGH,
        SEVERE
    }
}
