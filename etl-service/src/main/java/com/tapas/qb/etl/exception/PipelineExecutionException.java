package com.tapas.qb.etl.exception;

import com.tapas.qb.etl.service.PipelineRunReport;
import com.tapas.qb.etl.service.PipelineStage;

/**
 * Surfaced by the orchestrator when a run aborts. Stages committed before
 * {@link #getFailedStage()} stay in the warehouse.
 */
public class PipelineExecutionException extends EtlException {

    private final PipelineStage failedStage;
    private final PipelineRunReport report;

    public PipelineExecutionException(PipelineStage failedStage, PipelineRunReport report, Throwable cause) {
        super("Pipeline failed at stage " + failedStage + ": " + cause.getMessage(), cause);
        this.failedStage = failedStage;
        this.report = report;
    }

    public PipelineStage getFailedStage() {
        return failedStage;
    }

    public PipelineRunReport getReport() {
        return report;
    }
}
