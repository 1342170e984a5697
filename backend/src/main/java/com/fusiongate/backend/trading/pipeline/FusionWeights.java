package com.fusiongate.backend.trading.pipeline;

import com.fusiongate.backend.config.FusionProperties;

public record FusionWeights(double fusionCore, double divergence, double stabilizer) {

    public static FusionWeights from(FusionProperties.Weights weights) {
        return new FusionWeights(weights.getFusionCore(), weights.getDivergence(), weights.getStabilizer());
    }

    /**
     * Null fields of the update keep the current value.
     */
    public FusionWeights merge(FusionWeightsUpdate update) {
        if (update == null) {
            return this;
        }
        return new FusionWeights(
                update.fusionCore() != null ? update.fusionCore() : fusionCore,
                update.divergence() != null ? update.divergence() : divergence,
                update.stabilizer() != null ? update.stabilizer() : stabilizer
        );
    }
}
