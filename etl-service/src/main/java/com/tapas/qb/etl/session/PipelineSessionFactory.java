package com.tapas.qb.etl.session;

/**
 * Opens the connections for one pipeline run.
 */
@FunctionalInterface
public interface PipelineSessionFactory {

    PipelineSession openSession();
}
