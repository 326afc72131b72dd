package com.tapas.qb.etl.support;

import com.tapas.qb.etl.config.EtlProperties;
import com.tapas.qb.etl.service.RegionClassifier;
import com.tapas.qb.etl.session.PipelineSession;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

public final class TestSessions {

    public static final LocalDate TODAY = LocalDate.of(2024, 6, 15);
    public static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    private TestSessions() {
    }

    public static PipelineSession open(DuckDbTestDatabase source, DuckDbTestDatabase target) {
        return PipelineSession.open(source.dataSource(), target.dataSource(), 2);
    }

    public static RegionClassifier regions() {
        return new RegionClassifier(
                Map.of("CA", "West", "NY", "East", "TX", "South", "IL", "Central"), "Other");
    }

    public static EtlProperties properties() {
        var properties = new EtlProperties();
        properties.getSource().setUrl("jdbc:duckdb:");
        properties.getTarget().setUrl("jdbc:duckdb:");
        properties.getDateDimension().setStartDate(LocalDate.of(2024, 1, 1));
        properties.getDateDimension().setEndDate(LocalDate.of(2024, 12, 31));
        properties.setBatchSize(2);
        properties.setRegions(Map.of("CA", "West", "NY", "East", "TX", "South", "IL", "Central"));
        return properties;
    }
}
