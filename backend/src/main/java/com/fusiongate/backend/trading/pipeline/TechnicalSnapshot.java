package com.fusiongate.backend.trading.pipeline;

/**
 * Momentum and volatility indicators for one cycle.
 *
 * @param rsi           relative strength index, 0-100
 * @param macdHistogram normalized MACD histogram, typically within [-1, 1]
 * @param adx           average directional index, 0-100
 * @param momentumPct   rate of change in percent
 * @param atrPercent    average true range as a percentage of price
 */
public record TechnicalSnapshot(
        double rsi,
        double macdHistogram,
        double adx,
        double momentumPct,
        double atrPercent
) {}
