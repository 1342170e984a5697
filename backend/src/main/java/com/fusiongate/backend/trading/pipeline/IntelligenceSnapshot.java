package com.fusiongate.backend.trading.pipeline;

/**
 * @param intelligenceScore 0-100
 * @param riskLevel         0-100
 * @param cascadeRisk       0-1
 */
public record IntelligenceSnapshot(
        double intelligenceScore,
        double riskLevel,
        double cascadeRisk
) {}
