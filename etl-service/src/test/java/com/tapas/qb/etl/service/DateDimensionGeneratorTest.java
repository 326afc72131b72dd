package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.DateDimensionRow;
import com.tapas.qb.etl.exception.ConfigurationException;
import com.tapas.qb.etl.session.PipelineSession;
import com.tapas.qb.etl.support.DuckDbTestDatabase;
import com.tapas.qb.etl.support.TestSessions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DateDimensionGenerator")
class DateDimensionGeneratorTest {

    private final DateDimensionGenerator generator = new DateDimensionGenerator();

    @Test
    @DisplayName("2024-03-01 is a Friday in Q1")
    void describesFirstOfMarch() {
        DateDimensionRow row = DateDimensionGenerator.toRow(LocalDate.of(2024, 3, 1));

        assertEquals(20240301, row.dateKey());
        assertEquals(5, row.dayOfWeek());
        assertEquals("Friday", row.dayName());
        assertEquals(1, row.dayOfMonth());
        assertEquals(61, row.dayOfYear());
        assertEquals(9, row.weekOfYear());
        assertEquals(3, row.monthNumber());
        assertEquals("March", row.monthName());
        assertEquals(1, row.quarterNumber());
        assertEquals("Q1", row.quarterName());
        assertEquals(2024, row.yearNumber());
        assertFalse(row.weekend());
        assertFalse(row.holiday());
    }

    @ParameterizedTest(name = "month {0} -> Q{1}")
    @CsvSource({"1, 1", "3, 1", "4, 2", "6, 2", "7, 3", "9, 3", "10, 4", "12, 4"})
    void quarterIsCeilingOfMonthOverThree(int month, int quarter) {
        assertEquals(quarter, DateDimensionGenerator.toRow(LocalDate.of(2023, month, 15)).quarterNumber());
    }

    @ParameterizedTest(name = "{0} weekend={1}")
    @CsvSource({
            "2024-03-02, true",
            "2024-03-03, true",
            "2024-03-04, false",
            "2024-03-08, false"
    })
    void weekendOnSaturdayAndSunday(LocalDate date, boolean weekend) {
        assertEquals(weekend, DateDimensionGenerator.toRow(date).weekend());
    }

    @Test
    @DisplayName("range is inclusive with one row per day, leap day included")
    void oneRowPerDay() {
        List<DateDimensionRow> rows = generator.generate(LocalDate.of(2024, 2, 27), LocalDate.of(2024, 3, 2));

        assertEquals(List.of(20240227, 20240228, 20240229, 20240301, 20240302),
                rows.stream().map(DateDimensionRow::dateKey).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("single-day range yields one row")
    void singleDay() {
        LocalDate day = LocalDate.of(2024, 12, 31);

        assertEquals(1, generator.generate(day, day).size());
    }

    @Test
    @DisplayName("start after end is a configuration error")
    void startAfterEnd() {
        assertThrows(ConfigurationException.class,
                () -> generator.generate(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 31)));
        assertThrows(ConfigurationException.class,
                () -> generator.generate(null, LocalDate.of(2024, 1, 31)));
    }

    @Test
    @DisplayName("overlapping loads never duplicate a date")
    void overlappingLoads() throws Exception {
        try (var source = DuckDbTestDatabase.source();
             var warehouse = DuckDbTestDatabase.warehouse();
             PipelineSession session = TestSessions.open(source, warehouse)) {

            generator.load(session, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
            StageResult second = generator.load(session, LocalDate.of(2024, 1, 15), LocalDate.of(2024, 2, 29));

            assertEquals(46, second.extracted());
            assertEquals(60, warehouse.count("dim_date"));
            Integer distinct = warehouse.jdbc().queryForObject(
                    "SELECT COUNT(DISTINCT date_key) FROM dim_date", Integer.class);
            assertEquals(60, distinct);
            assertTrue(warehouse.jdbc().queryForObject(
                    "SELECT is_weekend FROM dim_date WHERE date_key = 20240203", Boolean.class));
        }
    }
}
