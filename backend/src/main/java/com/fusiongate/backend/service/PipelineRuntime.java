package com.fusiongate.backend.service;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.trading.pipeline.FusionPipelineService;
import com.fusiongate.backend.trading.pipeline.PipelineCycleResult;
import com.fusiongate.backend.trading.pipeline.PipelineInputProvider;
import com.fusiongate.backend.trading.pipeline.PipelineTickInput;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives the pipeline on a fixed delay. Ticks never overlap: a tick requested while another is
 * still running is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineRuntime {

    private final FusionPipelineService pipelineService;
    private final PipelineInputProvider inputProvider;
    private final PipelineMetricsService metricsService;
    private final TaskScheduler pipelineTaskScheduler;
    private final FusionProperties fusionProperties;

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final AtomicLong tickSequence = new AtomicLong();
    private final AtomicReference<PipelineCycleResult> lastResult = new AtomicReference<>();

    private ScheduledFuture<?> scheduledTick;
    private long intervalMs;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (fusionProperties.getRuntime().isAutoStart()) {
            start();
        }
    }

    public synchronized void start() {
        start(fusionProperties.getRuntime().getIntervalMs());
    }

    public synchronized void start(long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Tick interval must be positive: " + intervalMs);
        }
        if (isRunning()) {
            log.info("Restarting pipeline runtime with interval {} ms", intervalMs);
            scheduledTick.cancel(false);
        }
        this.intervalMs = intervalMs;
        scheduledTick = pipelineTaskScheduler.scheduleWithFixedDelay(this::runTick, Duration.ofMillis(intervalMs));
        log.info("Pipeline runtime started interval={} ms", intervalMs);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduledTick == null) {
            return;
        }
        scheduledTick.cancel(false);
        scheduledTick = null;
        log.info("Pipeline runtime stopped");
    }

    public synchronized boolean isRunning() {
        return scheduledTick != null && !scheduledTick.isCancelled();
    }

    public synchronized long getIntervalMs() {
        return intervalMs;
    }

    public Optional<PipelineCycleResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    /**
     * Runs a single cycle if none is in progress. Failures are logged and counted, never rethrown.
     */
    public Optional<PipelineCycleResult> runTick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            log.warn("Previous tick still running - skipping");
            metricsService.recordTickSkipped();
            return Optional.empty();
        }
        MDC.put("tickId", String.valueOf(tickSequence.incrementAndGet()));
        try {
            Optional<PipelineTickInput> input = inputProvider.nextInput();
            if (input.isEmpty()) {
                log.debug("No fresh input - tick idle");
                return Optional.empty();
            }
            PipelineCycleResult result = pipelineService.evaluate(input.get());
            lastResult.set(result);
            metricsService.recordCycle(result);
            return Optional.of(result);
        } catch (Exception e) {
            log.error("Pipeline tick failed", e);
            metricsService.recordTickFailure();
            return Optional.empty();
        } finally {
            MDC.remove("tickId");
            tickInProgress.set(false);
        }
    }
}
