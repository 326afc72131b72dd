package com.tapas.qb.etl.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LocationKeyTest {

    @Test
    @DisplayName("null and padded components compare equal to their trimmed form")
    void normalizesComponents() {
        assertEquals(LocationKey.of("Canada", "ON", "Toronto", ""),
                LocationKey.of(" Canada", "ON ", "Toronto", null));
    }
}
