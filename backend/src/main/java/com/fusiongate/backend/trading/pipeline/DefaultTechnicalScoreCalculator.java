package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.fusiongate.backend.util.SignalFilters.clamp;

@Service
@RequiredArgsConstructor
public class DefaultTechnicalScoreCalculator implements TechnicalScoreCalculator {

    private final FusionProperties fusionProperties;

    @Override
    public double strength(TechnicalSnapshot snapshot) {
        FusionProperties.Technical cfg = fusionProperties.getTechnical();
        double rsiComponent = clamp(snapshot.rsi() / 100.0, 0.0, 1.0);
        double adxComponent = clamp(snapshot.adx() / cfg.getAdxCeiling(), 0.0, 1.0);
        double macdComponent = clamp(0.5 + snapshot.macdHistogram() * 0.5, 0.0, 1.0);
        double momentumComponent = clamp(0.5 + snapshot.momentumPct() / (2.0 * cfg.getMomentumRangePct()), 0.0, 1.0);

        double weightSum = cfg.getRsiWeight() + cfg.getAdxWeight() + cfg.getMacdWeight() + cfg.getMomentumWeight();
        if (weightSum == 0) {
            return 0.0;
        }
        double raw = rsiComponent * cfg.getRsiWeight()
                + adxComponent * cfg.getAdxWeight()
                + macdComponent * cfg.getMacdWeight()
                + momentumComponent * cfg.getMomentumWeight();
        return clamp((raw / weightSum) * 100.0, 0.0, 100.0);
    }

    @Override
    public double volatility(TechnicalSnapshot snapshot) {
        double ceiling = fusionProperties.getTechnical().getAtrPercentCeiling();
        return clamp(snapshot.atrPercent() / ceiling * 100.0, 0.0, 100.0);
    }
}
