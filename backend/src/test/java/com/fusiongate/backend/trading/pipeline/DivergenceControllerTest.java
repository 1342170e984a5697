package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.trading.pipeline.DivergenceReading.DivergenceDirection;
import com.fusiongate.backend.trading.pipeline.DivergenceThreatScore.ThreatLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class DivergenceControllerTest {

    private DivergenceClassifier classifier;
    private DivergenceController controller;

    @BeforeEach
    void setUp() {
        FusionProperties properties = new FusionProperties();
        classifier = new DivergenceClassifier(properties);
        controller = new DivergenceController(classifier, properties);
    }

    @Test
    void strongConfidentBearishDivergenceIsSevere() {
        DivergenceThreatScore score = classifier.classify(reading(80.0, 100.0, 50.0, DivergenceDirection.BEARISH, 0));

        assertThat(score.threatScore()).isCloseTo(80.0, offset(1e-9));
        assertThat(score.level()).isEqualTo(ThreatLevel.SEVERE);
    }

    @Test
    void missingStrengthOrVolatilityIsNeutral() {
        DivergenceThreatScore noStrength = classifier.classify(
                new DivergenceReading(null, 90.0, 60.0, DivergenceDirection.BEARISH, null));
        DivergenceThreatScore noVolatility = classifier.classify(
                new DivergenceReading(90.0, 90.0, null, null, null));

        assertThat(noStrength.threatScore()).isZero();
        assertThat(noStrength.level()).isEqualTo(ThreatLevel.NONE);
        assertThat(noVolatility.threatScore()).isZero();
        assertThat(noVolatility.direction()).isEqualTo(DivergenceDirection.NEUTRAL);
    }

    @Test
    void threatIsMonotonicInStrengthAndConfidence() {
        double low = classifier.threatScore(reading(40.0, 50.0, 30.0, DivergenceDirection.BULLISH, 0));
        double stronger = classifier.threatScore(reading(60.0, 50.0, 30.0, DivergenceDirection.BULLISH, 0));
        double moreConfident = classifier.threatScore(reading(60.0, 80.0, 30.0, DivergenceDirection.BULLISH, 0));

        assertThat(stronger).isGreaterThanOrEqualTo(low);
        assertThat(moreConfident).isGreaterThanOrEqualTo(stronger);
    }

    @Test
    void summaryIsNullUntilFirstUpdate() {
        assertThat(controller.getSummary()).isNull();
        assertThat(controller.getHistory()).isEmpty();
    }

    @Test
    void summaryAggregatesHistory() {
        controller.update(reading(80.0, 100.0, 50.0, DivergenceDirection.BEARISH, 1));
        DivergenceThreatSummary summary = controller.update(reading(40.0, 50.0, 100.0, DivergenceDirection.BEARISH, 2));

        assertThat(summary.currentThreat()).isCloseTo(20.0, offset(1e-9));
        assertThat(summary.level()).isEqualTo(ThreatLevel.LOW);
        assertThat(summary.averageThreat()).isCloseTo(50.0, offset(1e-9));
        assertThat(summary.peakThreat()).isCloseTo(80.0, offset(1e-9));
        assertThat(summary.sampleCount()).isEqualTo(2);
        assertThat(controller.getSummary()).isEqualTo(summary);
    }

    @Test
    void historyKeepsMostRecentTwoHundred() {
        for (int i = 0; i < 205; i++) {
            controller.update(reading(50.0, 50.0, 50.0, DivergenceDirection.NEUTRAL, i));
        }

        List<DivergenceThreatScore> history = controller.getHistory();
        assertThat(history).hasSize(200);
        assertThat(history.get(0).timestamp()).isEqualTo(Instant.ofEpochSecond(5));
        assertThat(controller.getSummary().sampleCount()).isEqualTo(200);
    }

    @Test
    void outOfRangeReadingIsClampedBeforeStorage() {
        DivergenceThreatSummary summary = controller.update(
                new DivergenceReading(150.0, -20.0, 300.0, DivergenceDirection.BEARISH, null));

        DivergenceThreatScore stored = controller.getHistory().get(0);
        assertThat(stored.strength()).isEqualTo(100.0);
        assertThat(stored.confidence()).isZero();
        assertThat(stored.volatility()).isEqualTo(100.0);
        assertThat(stored.threatScore()).isZero();
        assertThat(summary.strength()).isEqualTo(100.0);
        assertThat(summary.confidence()).isZero();
        assertThat(summary.volatility()).isEqualTo(100.0);
    }

    private DivergenceReading reading(double strength, double confidence, double volatility,
                                      DivergenceDirection direction, long epochSecond) {
        return new DivergenceReading(strength, confidence, volatility, direction, Instant.ofEpochSecond(epochSecond));
    }
}
