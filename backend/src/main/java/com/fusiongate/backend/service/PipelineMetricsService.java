package com.fusiongate.backend.service;

import com.fusiongate.backend.trading.pipeline.PipelineCycleResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Service
@RequiredArgsConstructor
public class PipelineMetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong ticksCompleted = new AtomicLong();
    private final AtomicLong ticksFailed = new AtomicLong();
    private final AtomicLong ticksSkipped = new AtomicLong();
    private final AtomicReference<Double> lastFusionScore = new AtomicReference<>(0.0);
    private final AtomicReference<Double> lastConfidence = new AtomicReference<>(0.0);
    private final AtomicReference<Double> lastTruthGap = new AtomicReference<>(0.0);

    private Counter ticksCounter;
    private Counter tickFailuresCounter;
    private Counter ticksSkippedCounter;
    private Counter triggersApprovedCounter;
    private Counter triggersRejectedCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        ticksCounter = Counter.builder("fusion_ticks_total").register(meterRegistry);
        tickFailuresCounter = Counter.builder("fusion_tick_failures_total").register(meterRegistry);
        ticksSkippedCounter = Counter.builder("fusion_ticks_skipped_total").register(meterRegistry);
        triggersApprovedCounter = Counter.builder("fusion_triggers_approved_total").register(meterRegistry);
        triggersRejectedCounter = Counter.builder("fusion_triggers_rejected_total").register(meterRegistry);
        Gauge.builder("fusion_score_last", lastFusionScore, value -> value.get()).register(meterRegistry);
        Gauge.builder("fusion_confidence_last", lastConfidence, value -> value.get()).register(meterRegistry);
        Gauge.builder("fusion_truth_gap_last", lastTruthGap, value -> value.get()).register(meterRegistry);
    }

    public void recordCycle(PipelineCycleResult result) {
        ticksCompleted.incrementAndGet();
        if (ticksCounter != null) {
            ticksCounter.increment();
        }
        lastFusionScore.set(result.fusion().fusionScore());
        lastConfidence.set(result.stabilized().confidence());
        lastTruthGap.set(result.divergenceReport().truthGap());
        Counter triggerCounter = result.trigger().approved() ? triggersApprovedCounter : triggersRejectedCounter;
        if (triggerCounter != null) {
            triggerCounter.increment();
        }
    }

    public void recordTickFailure() {
        ticksFailed.incrementAndGet();
        if (tickFailuresCounter != null) {
            tickFailuresCounter.increment();
        }
    }

    public void recordTickSkipped() {
        ticksSkipped.incrementAndGet();
        if (ticksSkippedCounter != null) {
            ticksSkippedCounter.increment();
        }
    }

    public long getTicksCompleted() {
        return ticksCompleted.get();
    }

    public long getTicksFailed() {
        return ticksFailed.get();
    }

    public long getTicksSkipped() {
        return ticksSkipped.get();
    }
}
