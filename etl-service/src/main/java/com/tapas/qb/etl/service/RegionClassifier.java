package com.tapas.qb.etl.service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * State code to sales region lookup. The single source of truth for region
 * assignment, used both when locations are bulk loaded and when the resolver
 * creates one during fact loading.
 */
public class RegionClassifier {

    private final Map<String, String> regionsByState;
    private final String defaultRegion;

    public RegionClassifier(Map<String, String> regionsByState, String defaultRegion) {
        var normalized = new HashMap<String, String>();
        regionsByState.forEach((state, region) -> normalized.put(normalize(state), region));
        this.regionsByState = Map.copyOf(normalized);
        this.defaultRegion = defaultRegion;
    }

    public String classify(String state) {
        if (state == null || state.isBlank()) {
            return defaultRegion;
        }
        return regionsByState.getOrDefault(normalize(state), defaultRegion);
    }

    private static String normalize(String state) {
        return state.trim().toUpperCase(Locale.ROOT);
    }
}
