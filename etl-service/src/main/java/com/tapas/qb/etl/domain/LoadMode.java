package com.tapas.qb.etl.domain;

import java.util.Locale;

public enum LoadMode {
    FULL,
    INCREMENTAL;

    public static LoadMode fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Load mode must not be blank");
        }
        return LoadMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
