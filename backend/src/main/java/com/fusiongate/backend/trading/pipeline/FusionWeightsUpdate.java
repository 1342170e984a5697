package com.fusiongate.backend.trading.pipeline;

public record FusionWeightsUpdate(Double fusionCore, Double divergence, Double stabilizer) {

    public static FusionWeightsUpdate ofCore(double fusionCore) {
        return new FusionWeightsUpdate(fusionCore, null, null);
    }
}
