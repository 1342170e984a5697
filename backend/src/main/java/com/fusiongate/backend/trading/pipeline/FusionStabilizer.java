package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.util.RollingWindow;
import com.fusiongate.backend.util.SignalFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.fusiongate.backend.util.SignalFilters.clamp;

/**
 * Post-processes raw fusion scores: noise gating, drift control, volatility and shield penalties,
 * then smoothing against its own bounded history.
 */
@Service
@Slf4j
public class FusionStabilizer {

    private final FusionProperties fusionProperties;
    private final RollingWindow<Double> history;
    private volatile double lastConfidence;

    public FusionStabilizer(FusionProperties fusionProperties) {
        this.fusionProperties = fusionProperties;
        this.history = new RollingWindow<>(fusionProperties.getStabilizer().getHistorySize());
    }

    public StabilizedFusion stabilize(FusionOutput raw) {
        Objects.requireNonNull(raw, "fusion output");
        FusionProperties.Stabilizer cfg = fusionProperties.getStabilizer();
        List<Double> past = history.values();

        double score = raw.fusionScore();
        double z = SignalFilters.zscore(score, past);
        if (Math.abs(z) > cfg.getNoiseGate()) {
            score = SignalFilters.ema(raw.fusionScore(), cfg.getNoiseAlpha(), past);
        }

        if (past.size() >= 2 && Math.abs(score - past.get(past.size() - 1)) > cfg.getDriftThreshold()) {
            score = SignalFilters.ema(score, cfg.getDriftAlpha(), past);
        }
        double driftCorrected = score;

        score -= raw.volatility() * cfg.getVolatilityDampening();
        score -= raw.stabilityPenalty() * cfg.getShieldPenalty();
        score -= raw.correlationPenalty() * cfg.getCorrelationScale();

        double smoothed = SignalFilters.smooth(clamp(score, 0.0, 100.0), past);

        double base = clamp(100.0 - raw.volatility() - driftCorrected, 0.0, 100.0);
        base *= (1.0 - cfg.getConfidenceWeight());
        double confidence = SignalFilters.smooth(base, List.of(lastConfidence));

        history.push(smoothed);
        lastConfidence = confidence;

        double published = clamp(confidence * (1.0 - raw.confidenceReduction() / 100.0), 0.0, 100.0);
        log.debug("Stabilized score raw={} driftCorrected={} smoothed={} confidence={}",
                raw.fusionScore(), driftCorrected, smoothed, published);
        return new StabilizedFusion(smoothed, published, raw.signal(), Instant.now());
    }

    public List<Double> getHistory() {
        return history.values();
    }

    public double getLastConfidence() {
        return lastConfidence;
    }

    public void reset() {
        history.clear();
        lastConfidence = 0.0;
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(history.values(), lastConfidence);
    }

    public void restore(Checkpoint checkpoint) {
        history.replaceWith(checkpoint.history());
        lastConfidence = checkpoint.lastConfidence();
    }

    public record Checkpoint(List<Double> history, double lastConfidence) {}
}
