package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class DecisionContextAssemblerTest {

    private final DecisionContextAssembler assembler = new DecisionContextAssembler(new FusionProperties());
    private final IntelligenceSnapshot intel = new IntelligenceSnapshot(70.0, 30.0, 0.2);
    private final StabilizedFusion stabilized = new StabilizedFusion(64.0, 40.0, FusionOutput.FusionSignal.BUY, Instant.now());

    @Test
    void mapsStageOutputsOntoContext() {
        DivergenceThreatSummary threat = new DivergenceThreatSummary(60.0, 80.0, 50.0,
                DivergenceReading.DivergenceDirection.BEARISH, 48.0, DivergenceThreatScore.ThreatLevel.ELEVATED,
                48.0, 48.0, 0.0, 1, Instant.now());
        DivergenceReport report = new DivergenceReport(0.2, 0.1, 0.1, 0.2, 97.5, 0.15, 0.15, 0.0,
                DivergenceReport.AlignmentStatus.DRIFTING, null, 2, Instant.now());

        DecisionContext context = assembler.assemble(intel, fusion(FusionOutput.FusionSignal.BUY, 0.5, 20.0),
                stabilized, threat, report, 2.5);

        assertThat(context.opportunityScore()).isEqualTo(64.0);
        assertThat(context.trendAlignment()).isCloseTo(0.75, offset(1e-9));
        assertThat(context.riskLevel()).isCloseTo(0.3, offset(1e-9));
        assertThat(context.shieldThreat()).isCloseTo(0.48, offset(1e-9));
        assertThat(context.marketStability()).isCloseTo(0.8 * 0.8, offset(1e-9));
        assertThat(context.dailyPerformance()).isEqualTo(2.5);
    }

    @Test
    void sellSignalRemovesTrendAlignmentAndMissingThreatIsZero() {
        DecisionContext context = assembler.assemble(intel, fusion(FusionOutput.FusionSignal.SELL, -0.5, 20.0),
                stabilized, null, DivergenceReport.empty(), 0.0);

        assertThat(context.trendAlignment()).isZero();
        assertThat(context.shieldThreat()).isZero();
        assertThat(context.marketStability()).isCloseTo(0.8, offset(1e-9));
    }

    private FusionOutput fusion(FusionOutput.FusionSignal signal, double trend, double volatility) {
        return new FusionOutput(64.0, signal, FusionOutput.RiskClass.MEDIUM, volatility, 70.0, 60.0, 0.075, 0.06,
                trend, 0.0, new FusionOutput.WeightedContribution(0.0, 0.0, 0.0), Instant.now());
    }
}
