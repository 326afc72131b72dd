package com.tapas.qb.etl.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LoadModeTest {

    @Test
    @DisplayName("parses case-insensitively and rejects unknown values")
    void parsesLoadMode() {
        assertEquals(LoadMode.FULL, LoadMode.fromString("full"));
        assertEquals(LoadMode.INCREMENTAL, LoadMode.fromString(" Incremental "));
        assertThrows(IllegalArgumentException.class, () -> LoadMode.fromString("delta"));
        assertThrows(IllegalArgumentException.class, () -> LoadMode.fromString(" "));
    }
}
