package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

public record FusionOutput(
        double fusionScore,
        FusionSignal signal,
        RiskClass riskClass,
        double volatility,
        double intelligenceScore,
        double technicalScore,
        double stabilityPenalty,
        double correlationPenalty,
        double trend,
        double confidenceReduction,
        WeightedContribution weighted,
        Instant timestamp
) {
    public enum FusionSignal {
        BUY,
        SELL,
        HOLD,
        WAIT
    }

    public enum RiskClass {
        LOW,
        MEDIUM,
        HIGH
    }

    public record WeightedContribution(double core, double divergence, double stabilizer) {}
}
