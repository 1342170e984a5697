package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.fusiongate.backend.util.SignalFilters.clamp;

@Service
@RequiredArgsConstructor
public class DecisionScorer {

    static final String INSUFFICIENT_CONDITIONS = "Insufficient conditions";

    private final FusionProperties fusionProperties;

    public TradeDecision score(DecisionContext context) {
        Objects.requireNonNull(context, "decision context");
        FusionProperties.Decision cfg = fusionProperties.getDecision();
        List<String> reasons = new ArrayList<>();
        double total = context.opportunityScore() * cfg.getOpportunityWeight();

        if (context.trendAlignment() > cfg.getTrendAlignmentMin()) {
            total += cfg.getTrendAlignmentBonus();
            reasons.add("Strong trend alignment");
        }
        if (context.marketStability() > cfg.getMarketStabilityMin()) {
            total += cfg.getMarketStabilityBonus();
            reasons.add("Stable market");
        }
        if (context.riskLevel() < cfg.getRiskLevelMax()) {
            total += cfg.getRiskLevelBonus();
            reasons.add("Low risk");
        }
        if (context.shieldThreat() < cfg.getShieldThreatMax()) {
            total += cfg.getShieldThreatBonus();
            reasons.add("Shield threat contained");
        }
        if (context.dailyPerformance() > cfg.getDailyPerformanceMin()) {
            total += cfg.getDailyPerformanceBonus();
            reasons.add("Positive daily performance");
        }

        double score = clamp(total, 0.0, 100.0);
        TradeDecision.TradeAction action = score > cfg.getEnterThreshold()
                ? TradeDecision.TradeAction.ENTER
                : TradeDecision.TradeAction.SKIP;
        String reason = reasons.isEmpty() ? INSUFFICIENT_CONDITIONS : String.join(", ", reasons);
        return new TradeDecision(score, action, reason, List.copyOf(reasons), Instant.now());
    }
}
