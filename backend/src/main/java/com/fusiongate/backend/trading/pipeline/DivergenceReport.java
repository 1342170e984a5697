package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

public record DivergenceReport(
        double slippageDeviation,
        double spreadDeviation,
        double volatilityMismatch,
        double liquidityMismatch,
        double fillQualityRating,
        double executionRiskScore,
        double truthGap,
        double backtestGap,
        AlignmentStatus status,
        PerformanceSnapshot liveAverage,
        int sampleCount,
        Instant timestamp
) {
    public enum AlignmentStatus {
        ALIGNED,
        DRIFTING,
        CRITICAL
    }

    /**
     * Neutral report used while baseline, model or live data is missing.
     */
    public static DivergenceReport empty() {
        return new DivergenceReport(0.0, 0.0, 0.0, 0.0, 100.0, 0.0, 0.0, 0.0,
                AlignmentStatus.ALIGNED, null, 0, Instant.now());
    }
}
