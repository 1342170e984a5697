package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

public record PerformanceSnapshot(
        double winRate,
        double avgSlippage,
        double avgSpread,
        double volatility,
        double liquidity,
        double fillQuality,
        Instant timestamp
) {}
