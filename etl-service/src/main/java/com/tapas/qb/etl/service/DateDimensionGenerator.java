package com.tapas.qb.etl.service;

import com.tapas.qb.etl.domain.DateDimensionRow;
import com.tapas.qb.etl.exception.ConfigurationException;
import com.tapas.qb.etl.session.PipelineSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Materializes the calendar dimension, one row per day.
 */
@Service
public class DateDimensionGenerator {

    private static final Logger log = LoggerFactory.getLogger(DateDimensionGenerator.class);

    /**
     * {@code yyyyMMdd} as an integer.
     */
    public static int dateKey(LocalDate date) {
        return date.getYear() * 10_000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    public List<DateDimensionRow> generate(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ConfigurationException("Date dimension range requires both a start and an end date");
        }
        if (startDate.isAfter(endDate)) {
            throw new ConfigurationException(
                    "Date dimension start " + startDate + " is after end " + endDate);
        }

        var rows = new ArrayList<DateDimensionRow>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            rows.add(toRow(date));
        }
        return rows;
    }

    public StageResult load(PipelineSession session, LocalDate startDate, LocalDate endDate) {
        log.info("Populating dim_date from {} to {}", startDate, endDate);
        List<DateDimensionRow> rows = generate(startDate, endDate);
        int inserted = session.dimensions().upsertDates(rows);
        log.info("Generated {} calendar days, {} new rows in dim_date", rows.size(), inserted);
        return StageResult.of(PipelineStage.DATE_DIMENSION, rows.size(), inserted);
    }

    static DateDimensionRow toRow(LocalDate date) {
        int dayOfWeek = date.getDayOfWeek().getValue();
        int quarter = (date.getMonthValue() - 1) / 3 + 1;

        return new DateDimensionRow(
                dateKey(date),
                date,
                dayOfWeek,
                date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                date.getDayOfMonth(),
                date.getDayOfYear(),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
                date.getMonthValue(),
                date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                quarter,
                "Q" + quarter,
                date.getYear(),
                dayOfWeek >= 6,
                false);
    }
}
