package com.fusiongate.backend.trading.pipeline;

public record PipelineCycleResult(
        FusionOutput fusion,
        StabilizedFusion stabilized,
        DivergenceThreatSummary threatSummary,
        DivergenceReport divergenceReport,
        DecisionContext decisionContext,
        TradeDecision decision,
        TriggerOutput trigger
) {}
