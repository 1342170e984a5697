package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

/**
 * Raw divergence measurement. Absent strength, confidence or volatility read as 0,
 * an absent direction as NEUTRAL and an absent timestamp as the time of construction.
 */
public record DivergenceReading(
        Double strength,
        Double confidence,
        Double volatility,
        DivergenceDirection direction,
        Instant timestamp
) {
    public DivergenceReading {
        strength = strength != null ? strength : 0.0;
        confidence = confidence != null ? confidence : 0.0;
        volatility = volatility != null ? volatility : 0.0;
        direction = direction != null ? direction : DivergenceDirection.NEUTRAL;
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public enum DivergenceDirection {
        BULLISH,
        BEARISH,
        NEUTRAL
    }
}
