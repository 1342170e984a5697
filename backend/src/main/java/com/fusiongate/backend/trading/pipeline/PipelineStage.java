package com.fusiongate.backend.trading.pipeline;

public enum PipelineStage {
    FUSION,
    STABILIZER,
    DIVERGENCE,
    REALITY,
    DECISION,
    TRIGGER
}
