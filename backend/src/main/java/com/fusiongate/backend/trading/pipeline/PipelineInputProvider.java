package com.fusiongate.backend.trading.pipeline;

import java.util.Optional;

public interface PipelineInputProvider {

    /**
     * @return the input for the next cycle, or empty when nothing new has arrived
     */
    Optional<PipelineTickInput> nextInput();
}
