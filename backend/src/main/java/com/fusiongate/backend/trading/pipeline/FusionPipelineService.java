package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.exception.PipelineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Runs one evaluation cycle: fusion, stabilization, divergence classification, reality scan,
 * decision scoring and the trade trigger. A failing cycle leaves every stage's state as it was
 * before the cycle started.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FusionPipelineService {

    private final FusionEngine fusionEngine;
    private final FusionStabilizer fusionStabilizer;
    private final DivergenceController divergenceController;
    private final RealityDivergenceScanner realityDivergenceScanner;
    private final DecisionContextAssembler decisionContextAssembler;
    private final DecisionScorer decisionScorer;
    private final TradeTrigger tradeTrigger;

    public PipelineCycleResult evaluate(PipelineTickInput input) {
        Objects.requireNonNull(input, "tick input");
        Checkpoint checkpoint = checkpoint();
        PipelineStage stage = PipelineStage.FUSION;
        try {
            FusionOutput fusion = fusionEngine.computeFusion(input.intelligence(), input.technical());

            stage = PipelineStage.STABILIZER;
            StabilizedFusion stabilized = fusionStabilizer.stabilize(fusion);

            stage = PipelineStage.DIVERGENCE;
            DivergenceThreatSummary threatSummary = input.divergenceReading() != null
                    ? divergenceController.update(input.divergenceReading())
                    : divergenceController.getSummary();

            stage = PipelineStage.REALITY;
            for (PerformanceSnapshot live : input.liveResults()) {
                realityDivergenceScanner.registerLiveResult(live);
            }
            DivergenceReport report = realityDivergenceScanner.scan();

            stage = PipelineStage.DECISION;
            DecisionContext context = decisionContextAssembler.assemble(
                    input.intelligence(), fusion, stabilized, threatSummary, report, input.dailyPerformance());
            TradeDecision decision = decisionScorer.score(context);

            stage = PipelineStage.TRIGGER;
            TriggerOutput trigger = tradeTrigger.fire(decision);

            log.debug("Cycle complete fusion={} stabilized={} truthGap={} decision={} approved={}",
                    fusion.fusionScore(), stabilized.score(), report.truthGap(), decision.action(), trigger.approved());
            return new PipelineCycleResult(fusion, stabilized, threatSummary, report, context, decision, trigger);
        } catch (RuntimeException e) {
            restore(checkpoint);
            throw new PipelineException(stage, "Pipeline stage " + stage + " failed: " + e.getMessage(), e);
        }
    }

    private Checkpoint checkpoint() {
        return new Checkpoint(
                fusionEngine.checkpoint(),
                fusionStabilizer.checkpoint(),
                divergenceController.checkpoint(),
                realityDivergenceScanner.checkpoint(),
                tradeTrigger.getLastTradeTime().orElse(null)
        );
    }

    private void restore(Checkpoint checkpoint) {
        fusionEngine.restore(checkpoint.fusion());
        fusionStabilizer.restore(checkpoint.stabilizer());
        divergenceController.restore(checkpoint.divergence());
        realityDivergenceScanner.restore(checkpoint.liveHistory());
        tradeTrigger.restore(checkpoint.lastTradeTime());
    }

    private record Checkpoint(
            FusionEngine.Checkpoint fusion,
            FusionStabilizer.Checkpoint stabilizer,
            DivergenceController.Checkpoint divergence,
            List<PerformanceSnapshot> liveHistory,
            Instant lastTradeTime
    ) {}
}
