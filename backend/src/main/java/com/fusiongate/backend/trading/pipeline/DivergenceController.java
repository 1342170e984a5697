package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.util.RollingWindow;
import com.fusiongate.backend.util.SignalFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Owns the bounded threat history and the current threat summary.
 */
@Service
@Slf4j
public class DivergenceController {

    private final DivergenceClassifier classifier;
    private final RollingWindow<DivergenceThreatScore> history;
    private volatile DivergenceThreatSummary summary;

    public DivergenceController(DivergenceClassifier classifier, FusionProperties fusionProperties) {
        this.classifier = classifier;
        this.history = new RollingWindow<>(fusionProperties.getDivergence().getHistorySize());
    }

    public DivergenceThreatSummary update(DivergenceReading reading) {
        Objects.requireNonNull(reading, "divergence reading");
        DivergenceThreatScore score = classifier.classify(reading);

        List<DivergenceThreatScore> window = history.values();
        window.add(score);
        if (window.size() > history.capacity()) {
            window.remove(0);
        }
        DivergenceThreatSummary next = summarize(score, window);

        history.push(score);
        summary = next;
        log.debug("Divergence threat={} level={} direction={}", score.threatScore(), score.level(), score.direction());
        return next;
    }

    /**
     * @return the latest summary, or null if no reading has been processed
     */
    public DivergenceThreatSummary getSummary() {
        return summary;
    }

    public List<DivergenceThreatScore> getHistory() {
        return history.values();
    }

    public void reset() {
        history.clear();
        summary = null;
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(history.values(), summary);
    }

    public void restore(Checkpoint checkpoint) {
        history.replaceWith(checkpoint.history());
        summary = checkpoint.summary();
    }

    private DivergenceThreatSummary summarize(DivergenceThreatScore current, List<DivergenceThreatScore> window) {
        List<Double> threats = new ArrayList<>(window.size());
        double peak = 0.0;
        for (DivergenceThreatScore entry : window) {
            threats.add(entry.threatScore());
            peak = Math.max(peak, entry.threatScore());
        }
        return new DivergenceThreatSummary(
                current.strength(),
                current.confidence(),
                current.volatility(),
                current.direction(),
                current.threatScore(),
                current.level(),
                SignalFilters.mean(threats),
                peak,
                SignalFilters.trend(threats),
                window.size(),
                current.timestamp()
        );
    }

    public record Checkpoint(List<DivergenceThreatScore> history, DivergenceThreatSummary summary) {}
}
