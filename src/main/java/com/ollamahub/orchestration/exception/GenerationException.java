package com.ollamahub.orchestration.exception;

import com.ollamahub.orchestration.model.GenerationStage;

/**
 * Base class for request-level failures of the generate pipeline.
 */
public abstract class GenerationException extends RuntimeException {

    private final GenerationStage stage;

    protected GenerationException(String message, GenerationStage stage) {
        super(message);
        this.stage = stage;
    }

    /** Stage at which the request terminated. */
    public GenerationStage getStage() {
        return stage;
    }
}
