package com.tapas.qb.etl.domain;

import java.time.LocalDate;

public record DateDimensionRow(
        int dateKey,
        LocalDate fullDate,
        int dayOfWeek,
        String dayName,
        int dayOfMonth,
        int dayOfYear,
        int weekOfYear,
        int monthNumber,
        String monthName,
        int quarterNumber,
        String quarterName,
        int yearNumber,
        boolean weekend,
        boolean holiday
) {
}
