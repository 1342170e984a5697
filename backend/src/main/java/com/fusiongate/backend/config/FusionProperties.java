package com.fusiongate.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "fusion")
@Data
@Validated
public class FusionProperties {

    private Weights weights = new Weights();
    private Penalties penalties = new Penalties();
    private Engine engine = new Engine();
    private Stabilizer stabilizer = new Stabilizer();
    private Technical technical = new Technical();
    private Divergence divergence = new Divergence();
    private Reality reality = new Reality();
    private Decision decision = new Decision();
    private Trigger trigger = new Trigger();
    private Runtime runtime = new Runtime();

    // Initial blend weights; live re-tuning goes through FusionEngine.updateWeights and is not validated.
    @Data
    public static class Weights {
        private double fusionCore = 0.60;
        private double divergence = 0.25;
        private double stabilizer = 0.15;
    }

    @Data
    public static class Penalties {
        private double stabilityPenalty = 0.25;
        private double correlationPenalty = 0.30;
        private double stabilityScale = 20.0;
        private double correlationScale = 15.0;
    }

    @Data
    public static class Engine {
        @Min(1)
        private int historySize = 20;
        private double sellThreshold = 35.0;
        private double sellTrend = -0.2;
        private double buyThreshold = 60.0;
        private double buyTrend = 0.25;
        private double holdLower = 40.0;
        private double holdUpper = 70.0;
        private double lowRiskScore = 80.0;
        private double lowRiskVolatility = 40.0;
        private double mediumRiskScore = 55.0;
        private double mediumRiskVolatility = 55.0;
        private double highRiskScore = 40.0;
        private double highRiskVolatility = 60.0;
    }

    @Data
    public static class Stabilizer {
        private double confidenceWeight = 0.25;
        private double noiseGate = 0.7;
        private double driftThreshold = 12.0;
        private double volatilityDampening = 0.15;
        private double shieldPenalty = 0.22;
        private double correlationScale = 10.0;
        private double noiseAlpha = 0.3;
        private double driftAlpha = 0.25;
        @Min(1)
        private int historySize = 25;
    }

    @Data
    public static class Technical {
        private double rsiWeight = 0.30;
        private double adxWeight = 0.25;
        private double macdWeight = 0.25;
        private double momentumWeight = 0.20;
        @Positive
        private double adxCeiling = 50.0;
        @Positive
        private double momentumRangePct = 5.0;
        @Positive
        private double atrPercentCeiling = 5.0;
    }

    @Data
    public static class Divergence {
        @Min(1)
        private int historySize = 200;
        @Positive
        private double volatilityReference = 50.0;
        private double bearishFactor = 1.0;
        private double bullishFactor = 0.8;
        private double neutralFactor = 0.5;
        private double elevatedThreshold = 25.0;
        private double highThreshold = 50.0;
        private double severeThreshold = 75.0;
    }

    @Data
    public static class Reality {
        @Min(1)
        private int liveHistorySize = 100;
        private double alignedBelow = 0.1;
        private double driftingBelow = 0.3;
    }

    @Data
    public static class Decision {
        private double opportunityWeight = 0.4;
        private double enterThreshold = 60.0;
        private double trendAlignmentMin = 0.5;
        private double trendAlignmentBonus = 20.0;
        private double marketStabilityMin = 0.6;
        private double marketStabilityBonus = 15.0;
        private double riskLevelMax = 0.4;
        private double riskLevelBonus = 15.0;
        private double shieldThreatMax = 0.5;
        private double shieldThreatBonus = 15.0;
        private double dailyPerformanceMin = 0.0;
        private double dailyPerformanceBonus = 10.0;
        private double alignedStabilityFactor = 1.0;
        private double driftingStabilityFactor = 0.8;
        private double criticalStabilityFactor = 0.5;
    }

    @Data
    public static class Trigger {
        @Positive
        private double cooldownMinutes = 3.0;
    }

    @Data
    public static class Runtime {
        @Positive
        private long intervalMs = 1000;
        private boolean autoStart = false;
    }
}
