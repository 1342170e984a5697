package com.fusiongate.backend.trading.pipeline;

import java.time.Instant;
import java.util.List;

public record TradeDecision(
        double score,
        TradeAction action,
        String reason,
        List<String> reasons,
        Instant timestamp
) {
    public enum TradeAction {
        ENTER,
        SKIP
    }
}
