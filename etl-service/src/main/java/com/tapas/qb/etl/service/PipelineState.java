package com.tapas.qb.etl.service;

/**
 * Lifecycle of a single pipeline run. {@link #FAILED} can follow any state
 * before {@link #CLOSED}.
 */
public enum PipelineState {
    IDLE,
    CONNECTED,
    DATE_LOADED,
    DIMENSIONS_LOADED,
    FACTS_LOADED,
    CLOSED,
    FAILED
}
