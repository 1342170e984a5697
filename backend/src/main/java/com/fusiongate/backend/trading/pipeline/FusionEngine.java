package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.trading.pipeline.FusionOutput.FusionSignal;
import com.fusiongate.backend.trading.pipeline.FusionOutput.RiskClass;
import com.fusiongate.backend.util.RollingWindow;
import com.fusiongate.backend.util.SignalFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.fusiongate.backend.util.SignalFilters.clamp;

/**
 * Blends the intelligence score with technical momentum into a single 0-100 fusion score and
 * classifies it into a trading signal and a risk class.
 */
@Service
@Slf4j
public class FusionEngine {

    private final FusionProperties fusionProperties;
    private final TechnicalScoreCalculator technicalScoreCalculator;
    private final RollingWindow<Double> history;

    private volatile FusionWeights weights;
    private volatile double threatModifier = 1.0;
    private volatile double confidenceReduction = 0.0;
    private volatile FusionSignal lastSignal = FusionSignal.WAIT;

    public FusionEngine(FusionProperties fusionProperties, TechnicalScoreCalculator technicalScoreCalculator) {
        this.fusionProperties = fusionProperties;
        this.technicalScoreCalculator = technicalScoreCalculator;
        this.history = new RollingWindow<>(fusionProperties.getEngine().getHistorySize());
        this.weights = FusionWeights.from(fusionProperties.getWeights());
    }

    public FusionOutput computeFusion(IntelligenceSnapshot intel, TechnicalSnapshot tech) {
        Objects.requireNonNull(intel, "intelligence snapshot");
        Objects.requireNonNull(tech, "technical snapshot");
        FusionWeights w = weights;
        FusionProperties.Penalties penalties = fusionProperties.getPenalties();

        double technicalScore = technicalScoreCalculator.strength(tech);
        double volatility = technicalScoreCalculator.volatility(tech);
        double stabilityPenalty = penalties.getStabilityPenalty() * (intel.riskLevel() / 100.0);
        double correlationPenalty = penalties.getCorrelationPenalty() * intel.cascadeRisk();

        double coreScore = (intel.intelligenceScore() + technicalScore) / 2.0;
        double divergenceScore = Math.abs(intel.intelligenceScore() - technicalScore);
        double stabilizerScore = 100.0 - volatility;

        FusionOutput.WeightedContribution weighted = new FusionOutput.WeightedContribution(
                coreScore * w.fusionCore(),
                divergenceScore * w.divergence(),
                stabilizerScore * w.stabilizer()
        );
        double fusion = weighted.core() + weighted.divergence() + weighted.stabilizer();
        fusion -= stabilityPenalty * penalties.getStabilityScale();
        fusion -= correlationPenalty * penalties.getCorrelationScale();
        fusion *= threatModifier;

        fusion = clamp(fusion, 0.0, 100.0);
        fusion = SignalFilters.smooth(fusion, history.values());
        history.push(fusion);

        double trend = SignalFilters.trend(history.values());
        FusionSignal signal = classifySignal(fusion, trend);
        RiskClass riskClass = classifyRisk(fusion, volatility);
        lastSignal = signal;

        log.debug("Fusion score={} signal={} risk={} trend={} technical={} volatility={}",
                fusion, signal, riskClass, trend, technicalScore, volatility);
        return new FusionOutput(
                fusion,
                signal,
                riskClass,
                volatility,
                clamp(intel.intelligenceScore(), 0.0, 100.0),
                technicalScore,
                stabilityPenalty,
                correlationPenalty,
                trend,
                confidenceReduction,
                weighted,
                Instant.now()
        );
    }

    FusionSignal classifySignal(double fusion, double trend) {
        FusionProperties.Engine cfg = fusionProperties.getEngine();
        if (fusion <= cfg.getSellThreshold() && trend < cfg.getSellTrend()) {
            return FusionSignal.SELL;
        }
        if (fusion > cfg.getBuyThreshold() && trend > cfg.getBuyTrend()) {
            return FusionSignal.BUY;
        }
        if (fusion > cfg.getHoldLower() && fusion < cfg.getHoldUpper()) {
            return FusionSignal.HOLD;
        }
        return FusionSignal.WAIT;
    }

    RiskClass classifyRisk(double fusion, double volatility) {
        FusionProperties.Engine cfg = fusionProperties.getEngine();
        if (fusion >= cfg.getLowRiskScore() && volatility <= cfg.getLowRiskVolatility()) {
            return RiskClass.LOW;
        }
        if (fusion >= cfg.getMediumRiskScore() && volatility <= cfg.getMediumRiskVolatility()) {
            return RiskClass.MEDIUM;
        }
        if (fusion < cfg.getHighRiskScore() && volatility >= cfg.getHighRiskVolatility()) {
            return RiskClass.HIGH;
        }
        return RiskClass.MEDIUM;
    }

    public void updateWeights(FusionWeightsUpdate update) {
        weights = weights.merge(update);
        log.info("Fusion weights updated to {}", weights);
    }

    public void setThreatModifier(double threatModifier) {
        this.threatModifier = threatModifier;
    }

    /**
     * Percentage taken off the published confidence downstream. Not bounded.
     */
    public void reduceConfidence(double pct) {
        this.confidenceReduction = pct;
    }

    public FusionWeights getWeights() {
        return weights;
    }

    public double getThreatModifier() {
        return threatModifier;
    }

    public double getConfidenceReduction() {
        return confidenceReduction;
    }

    public FusionSignal getLastSignal() {
        return lastSignal;
    }

    public List<Double> getHistory() {
        return history.values();
    }

    public double currentTrend() {
        return SignalFilters.trend(history.values());
    }

    public Checkpoint checkpoint() {
        return new Checkpoint(history.values(), lastSignal);
    }

    public void restore(Checkpoint checkpoint) {
        history.replaceWith(checkpoint.history());
        lastSignal = checkpoint.lastSignal();
    }

    public record Checkpoint(List<Double> history, FusionSignal lastSignal) {}
}
