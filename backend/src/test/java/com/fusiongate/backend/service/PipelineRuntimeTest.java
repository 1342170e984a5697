package com.fusiongate.backend.service;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.exception.PipelineException;
import com.fusiongate.backend.trading.pipeline.DecisionContext;
import com.fusiongate.backend.trading.pipeline.DivergenceReport;
import com.fusiongate.backend.trading.pipeline.FusionOutput;
import com.fusiongate.backend.trading.pipeline.FusionPipelineService;
import com.fusiongate.backend.trading.pipeline.IntelligenceSnapshot;
import com.fusiongate.backend.trading.pipeline.PipelineCycleResult;
import com.fusiongate.backend.trading.pipeline.PipelineInputProvider;
import com.fusiongate.backend.trading.pipeline.PipelineStage;
import com.fusiongate.backend.trading.pipeline.PipelineTickInput;
import com.fusiongate.backend.trading.pipeline.StabilizedFusion;
import com.fusiongate.backend.trading.pipeline.TechnicalSnapshot;
import com.fusiongate.backend.trading.pipeline.TradeDecision;
import com.fusiongate.backend.trading.pipeline.TriggerOutput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineRuntimeTest {

    private FusionPipelineService pipelineService;
    private PipelineInputProvider inputProvider;
    private PipelineMetricsService metricsService;
    private SimpleMeterRegistry meterRegistry;
    private TaskScheduler scheduler;
    private PipelineRuntime runtime;

    @BeforeEach
    void setUp() {
        pipelineService = mock(FusionPipelineService.class);
        inputProvider = mock(PipelineInputProvider.class);
        meterRegistry = new SimpleMeterRegistry();
        metricsService = new PipelineMetricsService(meterRegistry);
        metricsService.init();
        scheduler = mock(TaskScheduler.class);
        runtime = new PipelineRuntime(pipelineService, inputProvider, metricsService, scheduler, new FusionProperties());
    }

    @Test
    void idleTickDoesNotEvaluate() {
        when(inputProvider.nextInput()).thenReturn(Optional.empty());

        assertThat(runtime.runTick()).isEmpty();
        verify(pipelineService, never()).evaluate(any());
    }

    @Test
    void successfulTickPublishesResultAndMetrics() {
        PipelineTickInput input = input();
        PipelineCycleResult result = result(true);
        when(inputProvider.nextInput()).thenReturn(Optional.of(input));
        when(pipelineService.evaluate(input)).thenReturn(result);

        assertThat(runtime.runTick()).contains(result);
        assertThat(runtime.getLastResult()).contains(result);
        assertThat(metricsService.getTicksCompleted()).isEqualTo(1);
        assertThat(meterRegistry.get("fusion_triggers_approved_total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("fusion_score_last").gauge().value()).isEqualTo(72.0);
    }

    @Test
    void failedTickIsContainedAndNextTickRuns() {
        PipelineTickInput input = input();
        PipelineCycleResult result = result(false);
        when(inputProvider.nextInput()).thenReturn(Optional.of(input));
        when(pipelineService.evaluate(input))
                .thenThrow(new PipelineException(PipelineStage.REALITY, "boom"))
                .thenReturn(result);

        assertThat(runtime.runTick()).isEmpty();
        assertThat(metricsService.getTicksFailed()).isEqualTo(1);

        assertThat(runtime.runTick()).contains(result);
        assertThat(metricsService.getTicksCompleted()).isEqualTo(1);
        assertThat(meterRegistry.get("fusion_triggers_rejected_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void overlappingTickIsSkipped() {
        AtomicReference<Optional<PipelineCycleResult>> nested = new AtomicReference<>();
        when(inputProvider.nextInput()).thenAnswer(invocation -> {
            nested.set(runtime.runTick());
            return Optional.empty();
        });

        runtime.runTick();

        assertThat(nested.get()).isEmpty();
        assertThat(metricsService.getTicksSkipped()).isEqualTo(1);
        assertThat(meterRegistry.get("fusion_ticks_skipped_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void startSchedulesFixedDelayAndStopCancels() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(250)));

        runtime.start(250);

        assertThat(runtime.isRunning()).isTrue();
        assertThat(runtime.getIntervalMs()).isEqualTo(250);

        runtime.stop();

        verify(future).cancel(false);
        assertThat(runtime.isRunning()).isFalse();
    }

    @Test
    void startUsesConfiguredIntervalByDefault() {
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(1000)));

        runtime.start();

        assertThat(runtime.getIntervalMs()).isEqualTo(1000);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> runtime.start(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(runtime.isRunning()).isFalse();
    }

    private PipelineTickInput input() {
        return new PipelineTickInput(
                new IntelligenceSnapshot(70.0, 20.0, 0.1),
                new TechnicalSnapshot(55.0, 0.2, 30.0, 1.0, 1.5),
                null,
                List.of(),
                0.0
        );
    }

    private PipelineCycleResult result(boolean approved) {
        Instant now = Instant.now();
        FusionOutput fusion = new FusionOutput(72.0, FusionOutput.FusionSignal.BUY, FusionOutput.RiskClass.MEDIUM,
                30.0, 70.0, 60.0, 0.05, 0.03, 0.3, 0.0,
                new FusionOutput.WeightedContribution(39.0, 2.5, 10.5), now);
        StabilizedFusion stabilized = new StabilizedFusion(68.0, 30.0, FusionOutput.FusionSignal.BUY, now);
        TradeDecision decision = new TradeDecision(80.0, TradeDecision.TradeAction.ENTER, "Low risk",
                List.of("Low risk"), now);
        TriggerOutput trigger = approved
                ? new TriggerOutput(true, TradeDecision.TradeAction.ENTER, 80.0, "Low risk", now, 3.0)
                : new TriggerOutput(false, TradeDecision.TradeAction.SKIP, 0.0, "Cooldown active", now, 1.5);
        return new PipelineCycleResult(fusion, stabilized, null, DivergenceReport.empty(),
                new DecisionContext(68.0, 0.65, 0.2, 0.0, 0.7, 0.0), decision, trigger);
    }
}
