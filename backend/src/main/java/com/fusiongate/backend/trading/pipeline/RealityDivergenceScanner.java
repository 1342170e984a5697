package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import com.fusiongate.backend.trading.pipeline.DivergenceReport.AlignmentStatus;
import com.fusiongate.backend.util.RollingWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares live execution quality against the expected model and flags drift via the truth gap.
 */
@Service
@Slf4j
public class RealityDivergenceScanner {

    private final FusionProperties fusionProperties;
    private final RollingWindow<PerformanceSnapshot> liveHistory;
    private volatile PerformanceSnapshot backtestBaseline;
    private volatile PerformanceSnapshot expectedModel;

    public RealityDivergenceScanner(FusionProperties fusionProperties) {
        this.fusionProperties = fusionProperties;
        this.liveHistory = new RollingWindow<>(fusionProperties.getReality().getLiveHistorySize());
    }

    public void setBacktestBaseline(PerformanceSnapshot baseline) {
        this.backtestBaseline = baseline;
    }

    public void setExpectedModel(PerformanceSnapshot model) {
        this.expectedModel = model;
    }

    public void registerLiveResult(PerformanceSnapshot snapshot) {
        liveHistory.push(Objects.requireNonNull(snapshot, "live performance snapshot"));
    }

    public DivergenceReport scan() {
        PerformanceSnapshot baseline = backtestBaseline;
        PerformanceSnapshot expected = expectedModel;
        List<PerformanceSnapshot> live = liveHistory.values();
        if (baseline == null || expected == null || live.isEmpty()) {
            return DivergenceReport.empty();
        }

        PerformanceSnapshot liveAvg = average(live);
        double slippageDeviation = Math.abs(liveAvg.avgSlippage() - expected.avgSlippage());
        double spreadDeviation = Math.abs(liveAvg.avgSpread() - expected.avgSpread());
        double volatilityMismatch = Math.abs(liveAvg.volatility() - expected.volatility());
        double liquidityMismatch = Math.abs(liveAvg.liquidity() - expected.liquidity());

        double fillQualityRating = Math.max(0.0, 100.0 - (slippageDeviation * 10.0 + spreadDeviation * 5.0));
        double executionRiskScore = 0.4 * slippageDeviation
                + 0.3 * spreadDeviation
                + 0.2 * volatilityMismatch
                + 0.1 * liquidityMismatch;
        double truthGap = (slippageDeviation + spreadDeviation + volatilityMismatch + liquidityMismatch) / 4.0;
        double backtestGap = (Math.abs(liveAvg.avgSlippage() - baseline.avgSlippage())
                + Math.abs(liveAvg.avgSpread() - baseline.avgSpread())
                + Math.abs(liveAvg.volatility() - baseline.volatility())
                + Math.abs(liveAvg.liquidity() - baseline.liquidity())) / 4.0;

        AlignmentStatus status = classify(truthGap);
        if (status == AlignmentStatus.CRITICAL) {
            log.warn("Live execution diverged from expected model truthGap={} samples={}", truthGap, live.size());
        }
        return new DivergenceReport(
                slippageDeviation,
                spreadDeviation,
                volatilityMismatch,
                liquidityMismatch,
                fillQualityRating,
                executionRiskScore,
                truthGap,
                backtestGap,
                status,
                liveAvg,
                live.size(),
                Instant.now()
        );
    }

    AlignmentStatus classify(double truthGap) {
        FusionProperties.Reality cfg = fusionProperties.getReality();
        if (truthGap < cfg.getAlignedBelow()) {
            return AlignmentStatus.ALIGNED;
        }
        if (truthGap < cfg.getDriftingBelow()) {
            return AlignmentStatus.DRIFTING;
        }
        return AlignmentStatus.CRITICAL;
    }

    public Optional<PerformanceSnapshot> getBacktestBaseline() {
        return Optional.ofNullable(backtestBaseline);
    }

    public Optional<PerformanceSnapshot> getExpectedModel() {
        return Optional.ofNullable(expectedModel);
    }

    public List<PerformanceSnapshot> getLiveHistory() {
        return liveHistory.values();
    }

    public void reset() {
        backtestBaseline = null;
        expectedModel = null;
        liveHistory.clear();
    }

    public List<PerformanceSnapshot> checkpoint() {
        return liveHistory.values();
    }

    public void restore(List<PerformanceSnapshot> checkpoint) {
        liveHistory.replaceWith(checkpoint);
    }

    private PerformanceSnapshot average(List<PerformanceSnapshot> snapshots) {
        double winRate = 0;
        double slippage = 0;
        double spread = 0;
        double volatility = 0;
        double liquidity = 0;
        double fillQuality = 0;
        for (PerformanceSnapshot s : snapshots) {
            winRate += s.winRate();
            slippage += s.avgSlippage();
            spread += s.avgSpread();
            volatility += s.volatility();
            liquidity += s.liquidity();
            fillQuality += s.fillQuality();
        }
        int n = snapshots.size();
        return new PerformanceSnapshot(
                winRate / n,
                slippage / n,
                spread / n,
                volatility / n,
                liquidity / n,
                fillQuality / n,
                snapshots.get(n - 1).timestamp()
        );
    }
}
