package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.trading.pipeline.DivergenceReading.DivergenceDirection;
import com.fusiongate.backend.trading.pipeline.DivergenceThreatScore.ThreatLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.fusiongate.backend.util.SignalFilters.clamp;

/**
 * Scores a single divergence reading. The threat rises with strength and confidence and is zero
 * whenever strength or volatility is zero.
 */
@Component
@RequiredArgsConstructor
public class DivergenceClassifier {

    private final FusionProperties fusionProperties;

    public DivergenceThreatScore classify(DivergenceReading reading) {
        double strength = clamp(reading.strength(), 0.0, 100.0);
        double confidence = clamp(reading.confidence(), 0.0, 100.0);
        double volatility = clamp(reading.volatility(), 0.0, 100.0);
        double threat = threatScore(strength, confidence, volatility, reading.direction());
        return new DivergenceThreatScore(
                strength,
                confidence,
                volatility,
                reading.direction(),
                threat,
                level(threat),
                reading.timestamp()
        );
    }

    double threatScore(DivergenceReading reading) {
        return threatScore(
                clamp(reading.strength(), 0.0, 100.0),
                clamp(reading.confidence(), 0.0, 100.0),
                clamp(reading.volatility(), 0.0, 100.0),
                reading.direction());
    }

    private double threatScore(double strength, double confidence, double volatility, DivergenceDirection direction) {
        double volatilityFactor = clamp(volatility / fusionProperties.getDivergence().getVolatilityReference(), 0.0, 1.0);
        return clamp(strength * (confidence / 100.0) * volatilityFactor * directionFactor(direction), 0.0, 100.0);
    }

    ThreatLevel level(double threat) {
        FusionProperties.Divergence cfg = fusionProperties.getDivergence();
        if (threat >= cfg.getSevereThreshold()) {
            return ThreatLevel.SEVERE;
        }
        if (threat >= cfg.getHighThreshold()) {
            return ThreatLevel.HIGH;
        }
        if (threat >= cfg.getElevatedThreshold()) {
            return ThreatLevel.ELEVATED;
        }
        if (threat > 0.0) {
            return ThreatLevel.LOW;
        }
        return ThreatLevel.NONE;
    }

    private double directionFactor(DivergenceDirection direction) {
        FusionProperties.Divergence cfg = fusionProperties.getDivergence();
        return switch (direction) {
            case BEARISH -> cfg.getBearishFactor();
            case BULLISH -> cfg.getBullishFactor();
            case NEUTRAL -> cfg.getNeutralFactor();
        };
    }
}
