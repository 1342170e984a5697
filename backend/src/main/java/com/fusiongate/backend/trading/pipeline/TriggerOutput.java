package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;

public record TriggerOutput(
        boolean approved,
        TradeDecision.TradeAction action,
        double confidence,
        String reason,
        Instant timestamp,
        double cooldownMinutes
) {}
