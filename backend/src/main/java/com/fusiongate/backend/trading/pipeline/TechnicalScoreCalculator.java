package com.fusiongate.backend.trading.pipeline;

public interface TechnicalScoreCalculator {

    /**
     * Momentum strength, 0-100.
     */
    double strength(TechnicalSnapshot snapshot);

    /**
     * Volatility, 0-100.
     */
    double volatility(TechnicalSnapshot snapshot);
}
