package com.fusiongate.backend.exception;

import com.fusiongate.backend.trading.pipeline.PipelineStage;
import lombok.Getter;

@Getter
public class PipelineException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public PipelineException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
