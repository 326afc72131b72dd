package com.tapas.qb.etl.service;

import com.tapas.qb.etl.config.EtlProperties;
import com.tapas.qb.etl.domain.LoadMode;
import com.tapas.qb.etl.domain.WarehouseHealth;
import com.tapas.qb.etl.exception.ConfigurationException;
import com.tapas.qb.etl.exception.LoadException;
import com.tapas.qb.etl.exception.PipelineExecutionException;
import com.tapas.qb.etl.session.PipelineSession;
import com.tapas.qb.etl.session.PipelineSessionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.function.Supplier;

/**
 * Runs one warehouse load: date dimension, business dimensions, then facts,
 * followed by a read-only check for orphaned facts and calendar coverage.
 * <p>
 * Every stage commits in its own target transaction. A failing stage rolls
 * back only its own writes and aborts the stages after it; stages that already
 * committed stay in the warehouse.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final PipelineSessionFactory sessionFactory;
    private final DateDimensionGenerator dateDimensionGenerator;
    private final DimensionLoader dimensionLoader;
    private final FactLoader factLoader;
    private final RegionClassifier regionClassifier;
    private final EtlProperties properties;
    private final Clock clock;

    public PipelineOrchestrator(PipelineSessionFactory sessionFactory,
                                DateDimensionGenerator dateDimensionGenerator,
                                DimensionLoader dimensionLoader,
                                FactLoader factLoader,
                                RegionClassifier regionClassifier,
                                EtlProperties properties,
                                Clock clock) {
        this.sessionFactory = sessionFactory;
        this.dateDimensionGenerator = dateDimensionGenerator;
        this.dimensionLoader = dimensionLoader;
        this.factLoader = factLoader;
        this.regionClassifier = regionClassifier;
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineRunReport run() {
        return run(properties.getLoadMode());
    }

    /**
     * @throws ConfigurationException     before any connection is opened
     * @throws PipelineExecutionException when a stage fails; carries the
     *                                    partial report
     */
    public PipelineRunReport run(LoadMode mode) {
        validateConfiguration(mode);

        var report = new PipelineRunReport(mode, clock.instant());
        log.info("Starting {} warehouse load, run {}", mode, report.getRunId());

        PipelineStage stage = PipelineStage.CONNECT;
        try (PipelineSession session = sessionFactory.openSession()) {
            report.transitionTo(PipelineState.CONNECTED);

            stage = PipelineStage.DATE_DIMENSION;
            LocalDate start = properties.getDateDimension().getStartDate();
            LocalDate end = properties.getDateDimension().getEndDate();
            report.record(runStage(session, stage, () -> dateDimensionGenerator.load(session, start, end)));
            report.transitionTo(PipelineState.DATE_LOADED);

            stage = PipelineStage.CUSTOMER_DIMENSION;
            report.record(runStage(session, stage, () -> dimensionLoader.loadCustomers(session)));
            stage = PipelineStage.PRODUCT_DIMENSION;
            report.record(runStage(session, stage, () -> dimensionLoader.loadProducts(session)));
            stage = PipelineStage.SUPPLIER_DIMENSION;
            report.record(runStage(session, stage, () -> dimensionLoader.loadSuppliers(session)));
            stage = PipelineStage.LOCATION_DIMENSION;
            report.record(runStage(session, stage, () -> dimensionLoader.loadLocations(session)));
            report.transitionTo(PipelineState.DIMENSIONS_LOADED);

            stage = PipelineStage.SALES_FACTS;
            DimensionResolver resolver = runStage(session, stage, () -> new DimensionResolver(
                    session.dimensions().loadKeyMap(), session.dimensions(), regionClassifier));
            report.record(runStage(session, stage, () -> factLoader.loadSales(session, resolver, mode)));

            stage = PipelineStage.INVENTORY_FACTS;
            report.record(runStage(session, stage, () -> factLoader.loadInventory(session, resolver)));
            report.transitionTo(PipelineState.FACTS_LOADED);

            stage = PipelineStage.VERIFY;
            report.recordHealth(runStage(session, stage, () -> session.facts().checkHealth()));
        } catch (RuntimeException e) {
            report.fail(stage);
            log.error("Warehouse load {} failed at stage {}: {}", report.getRunId(), stage, e.getMessage(), e);
            throw new PipelineExecutionException(stage, report, e);
        }

        report.transitionTo(PipelineState.CLOSED);
        logSummary(report);
        return report;
    }

    private <T> T runStage(PipelineSession session, PipelineStage stage, Supplier<T> work) {
        try {
            return session.inTargetTransaction(work);
        } catch (DataAccessException e) {
            throw new LoadException(stage, e);
        }
    }

    private void validateConfiguration(LoadMode mode) {
        if (mode == null) {
            throw new ConfigurationException("Load mode must be set");
        }
        if (properties.getSource() == null || !StringUtils.hasText(properties.getSource().getUrl())) {
            throw new ConfigurationException("etl.source.url must be set");
        }
        if (properties.getTarget() == null || !StringUtils.hasText(properties.getTarget().getUrl())) {
            throw new ConfigurationException("etl.target.url must be set");
        }
        LocalDate start = properties.getDateDimension().getStartDate();
        LocalDate end = properties.getDateDimension().getEndDate();
        if (start == null || end == null) {
            throw new ConfigurationException("etl.date-dimension.start-date and end-date must be set");
        }
        if (start.isAfter(end)) {
            throw new ConfigurationException(
                    "etl.date-dimension.start-date " + start + " is after end-date " + end);
        }
        if (properties.getBatchSize() < 1) {
            throw new ConfigurationException("etl.batch-size must be positive, was " + properties.getBatchSize());
        }
    }

    private void logSummary(PipelineRunReport report) {
        for (StageResult result : report.getStageResults()) {
            log.info("  {}: extracted={}, loaded={}, skipped={}",
                    result.stage(), result.extracted(), result.loaded(), result.skipped());
        }
        WarehouseHealth health = report.getHealth();
        if (health != null) {
            log.info("  warehouse: {} sales facts ({} revenue), {} inventory facts, {} calendar days {}..{}",
                    health.salesFacts(), health.totalRevenue(), health.inventoryFacts(),
                    health.calendarDays(), health.firstCalendarDate(), health.lastCalendarDate());
            if (health.hasOrphans()) {
                log.warn("  warehouse has orphaned facts: {} sales, {} inventory",
                        health.orphanedSalesFacts(), health.orphanedInventoryFacts());
            }
        }
        Duration elapsed = Duration.between(report.getStartedAt(), Instant.now(clock));
        log.info("Warehouse load {} completed in {} ms: {} rows loaded, {} skipped",
                report.getRunId(), elapsed.toMillis(), report.totalLoaded(), report.totalSkipped());
    }
}
