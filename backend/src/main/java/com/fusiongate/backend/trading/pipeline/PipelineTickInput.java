package com.fusiongate.backend.trading.pipeline;

import java.util.List;

/**
 * Everything the external metrics layer supplies for one cycle.
 *
 * @param divergenceReading may be null when no new divergence measurement arrived this cycle
 * @param liveResults       live performance snapshots to register before scanning, possibly empty
 */
public record PipelineTickInput(
        IntelligenceSnapshot intelligence,
        TechnicalSnapshot technical,
        DivergenceReading divergenceReading,
        List<PerformanceSnapshot> liveResults,
        double dailyPerformance
) {
    public PipelineTickInput {
        liveResults = liveResults != null ? List.copyOf(liveResults) : List.of();
    }
}
