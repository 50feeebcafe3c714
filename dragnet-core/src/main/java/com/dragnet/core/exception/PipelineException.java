package com.dragnet.core.exception;

import lombok.Getter;

/** Wraps the first failure raised by a pipeline stage. */
@Getter
public class PipelineException extends DragnetException {

    private final String stage;

    public PipelineException(String stage, Throwable cause) {
        super("stage \"" + stage + "\" failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }
}
