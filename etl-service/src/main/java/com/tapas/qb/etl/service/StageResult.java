package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.DimensionType;

import java.util.Map;

/**
 * Counts reported by one stage: records read from the source, rows written to
 * the warehouse and rows skipped on key resolution.
 */
public record StageResult(
        PipelineStage stage,
        int extracted,
        int loaded,
        int skipped,
        Map<DimensionType, Integer> skippedByDimension) {

    public static StageResult of(PipelineStage stage, int extracted, int loaded) {
        return new StageResult(stage, extracted, loaded, 0, Map.of());
    }

    public static StageResult of(PipelineStage stage, int extracted, int loaded, SkipCounter skips) {
        return new StageResult(stage, extracted, loaded, skips.total(), skips.byDimension());
    }
}
