package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.DimensionType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Counts fact rows dropped because a dimension key could not be resolved.
 */
public class SkipCounter {

    private final Map<DimensionType, Integer> counts = new EnumMap<>(DimensionType.class);

    public void skip(DimensionType dimension) {
        counts.merge(dimension, 1, Integer::sum);
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public Map<DimensionType, Integer> byDimension() {
        return Map.copyOf(counts);
    }
}
