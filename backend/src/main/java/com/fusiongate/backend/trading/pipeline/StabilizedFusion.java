package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

public record StabilizedFusion(
        double score,
        double confidence,
        FusionOutput.FusionSignal signal,
        Instant timestamp
) {}
