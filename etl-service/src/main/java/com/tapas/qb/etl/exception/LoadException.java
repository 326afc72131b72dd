package com.tapas.qb.etl.exception;

import com.tapas.qb.etl.service.PipelineStage;

/**
 * A batch insert or upsert failed; the stage's transaction was rolled back.
 */
public class LoadException extends EtlException {

    private final PipelineStage stage;

    public LoadException(PipelineStage stage, Throwable cause) {
        super("Stage " + stage + " failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
