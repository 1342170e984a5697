package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import static com.fusiongate.backend.util.SignalFilters.clamp;

/**
 * Maps the published outputs of the upstream stages onto the decision scorer's inputs.
 */
@Component
@RequiredArgsConstructor
public class DecisionContextAssembler {

    private final FusionProperties fusionProperties;

    public DecisionContext assemble(IntelligenceSnapshot intel,
                                    FusionOutput fusion,
                                    StabilizedFusion stabilized,
                                    DivergenceThreatSummary threatSummary,
                                    DivergenceReport report,
                                    double dailyPerformance) {
        double trendAlignment = fusion.signal() == FusionOutput.FusionSignal.SELL
                ? 0.0
                : clamp((fusion.trend() + 1.0) / 2.0, 0.0, 1.0);
        double shieldThreat = threatSummary == null ? 0.0 : clamp(threatSummary.currentThreat() / 100.0, 0.0, 1.0);
        double marketStability = clamp((100.0 - fusion.volatility()) / 100.0 * stabilityFactor(report), 0.0, 1.0);
        return new DecisionContext(
                stabilized.score(),
                trendAlignment,
                clamp(intel.riskLevel() / 100.0, 0.0, 1.0),
                shieldThreat,
                marketStability,
                dailyPerformance
        );
    }

    private double stabilityFactor(DivergenceReport report) {
        FusionProperties.Decision cfg = fusionProperties.getDecision();
        if (report == null) {
            return cfg.getAlignedStabilityFactor();
        }
        return switch (report.status()) {
            case ALIGNED -> cfg.getAlignedStabilityFactor();
            case DRIFTING -> cfg.getDriftingStabilityFactor();
            case CRITICAL -> cfg.getCriticalStabilityFactor();
        };
    }
}
