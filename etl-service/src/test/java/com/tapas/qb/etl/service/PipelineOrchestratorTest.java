package com.tapas.qb.etl.service;

import com.tapas.qb.etl.config.EtlProperties;
import com.tapas.qb.etl.domain.DimensionType;
import com.tapas.qb.etl.domain.LoadMode;
import com.tapas.qb.etl.domain.WarehouseHealth;
import com.tapas.qb.etl.exception.ConfigurationException;
import com.tapas.qb.etl.exception.ConnectionException;
import com.tapas.qb.etl.exception.LoadException;
import com.tapas.qb.etl.exception.PipelineExecutionException;
import com.tapas.qb.etl.repository.FactRepository;
import com.tapas.qb.etl.session.PipelineSession;
import com.tapas.qb.etl.session.PipelineSessionFactory;
import com.tapas.qb.etl.support.DuckDbTestDatabase;
import com.tapas.qb.etl.support.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("PipelineOrchestrator")
class PipelineOrchestratorTest {

    private DuckDbTestDatabase source;
    private DuckDbTestDatabase warehouse;
    private EtlProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        source = DuckDbTestDatabase.source();
        warehouse = DuckDbTestDatabase.warehouse();
        properties = TestSessions.properties();
    }

    @AfterEach
    void tearDown() throws Exception {
        source.close();
        warehouse.close();
    }

    @Test
    @DisplayName("a full run loads every stage and ends closed")
    void fullRun() {
        PipelineRunReport report = orchestrator(() -> TestSessions.open(source, warehouse)).run(LoadMode.FULL);

        assertEquals(PipelineState.CLOSED, report.getState());
        assertEquals(List.of(
                PipelineState.IDLE,
                PipelineState.CONNECTED,
                PipelineState.DATE_LOADED,
                PipelineState.DIMENSIONS_LOADED,
                PipelineState.FACTS_LOADED,
                PipelineState.CLOSED), report.getTransitions());
        assertEquals(List.of(
                PipelineStage.DATE_DIMENSION,
                PipelineStage.CUSTOMER_DIMENSION,
                PipelineStage.PRODUCT_DIMENSION,
                PipelineStage.SUPPLIER_DIMENSION,
                PipelineStage.LOCATION_DIMENSION,
                PipelineStage.SALES_FACTS,
                PipelineStage.INVENTORY_FACTS),
                report.getStageResults().stream().map(StageResult::stage).toList());

        StageResult sales = report.result(PipelineStage.SALES_FACTS).orElseThrow();
        assertEquals(5, sales.loaded());
        assertEquals(Map.of(DimensionType.PRODUCT, 1), sales.skippedByDimension());
        assertEquals(1, report.totalSkipped());

        assertEquals(366, warehouse.count("dim_date"));
        assertEquals(3, warehouse.count("dim_customer"));
        assertEquals(5, warehouse.count("fact_sales"));
        assertEquals(3, warehouse.count("fact_inventory"));
        assertEquals(5, warehouse.count("dim_location"));

        WarehouseHealth health = report.getHealth();
        assertEquals(5, health.salesFacts());
        assertEquals(3, health.inventoryFacts());
        assertFalse(health.hasOrphans());
        assertEquals(366, health.calendarDays());
        assertEquals(LocalDate.of(2024, 1, 1), health.firstCalendarDate());
        assertEquals(LocalDate.of(2024, 12, 31), health.lastCalendarDate());
        assertEquals(0, new BigDecimal("1553.00").compareTo(health.totalRevenue()));
    }

    @Test
    @DisplayName("the post-load check counts facts left without a dimension row")
    void healthCheckFindsOrphans() {
        orchestrator(() -> TestSessions.open(source, warehouse)).run(LoadMode.FULL);
        warehouse.jdbc().update("DELETE FROM dim_customer WHERE customer_id = 2");
        warehouse.jdbc().update("DELETE FROM dim_product WHERE product_id = 102");

        WarehouseHealth health = new FactRepository(warehouse.jdbc(), 2).checkHealth();

        assertTrue(health.hasOrphans());
        assertEquals(2, health.orphanedSalesFacts());
        assertEquals(1, health.orphanedInventoryFacts());
        assertEquals(5, health.salesFacts());
    }

    @Test
    @DisplayName("a second incremental run with no new orders loads no sales")
    void secondIncrementalRunLoadsNothing() {
        PipelineOrchestrator orchestrator = orchestrator(() -> TestSessions.open(source, warehouse));
        orchestrator.run(LoadMode.INCREMENTAL);

        PipelineRunReport second = orchestrator.run(LoadMode.INCREMENTAL);

        assertEquals(0, second.result(PipelineStage.SALES_FACTS).orElseThrow().loaded());
        assertEquals(5, warehouse.count("fact_sales"));
        assertEquals(3, warehouse.count("dim_customer"));
    }

    @Test
    @DisplayName("the configured load mode is used when none is given")
    void defaultsToConfiguredMode() {
        properties.setLoadMode(LoadMode.FULL);

        PipelineRunReport report = orchestrator(() -> TestSessions.open(source, warehouse)).run();

        assertEquals(LoadMode.FULL, report.getMode());
    }

    @Test
    @DisplayName("a failing stage aborts the run and keeps earlier stages committed")
    void failingStageKeepsEarlierCommits() {
        warehouse.jdbc().execute("DROP TABLE fact_inventory");
        PipelineOrchestrator orchestrator = orchestrator(() -> TestSessions.open(source, warehouse));

        var failure = assertThrows(PipelineExecutionException.class, () -> orchestrator.run(LoadMode.FULL));

        assertEquals(PipelineStage.INVENTORY_FACTS, failure.getFailedStage());
        assertInstanceOf(LoadException.class, failure.getCause());
        PipelineRunReport report = failure.getReport();
        assertEquals(PipelineState.FAILED, report.getState());
        assertEquals(PipelineStage.INVENTORY_FACTS, report.getFailedStage());
        assertTrue(report.result(PipelineStage.SALES_FACTS).isPresent());
        assertTrue(report.result(PipelineStage.INVENTORY_FACTS).isEmpty());
        assertEquals(5, warehouse.count("fact_sales"));
        assertEquals(3, warehouse.count("dim_customer"));
    }

    @Test
    @DisplayName("both connections are closed when a stage fails")
    void closesConnectionsOnFailure() throws SQLException {
        warehouse.jdbc().execute("DROP TABLE dim_supplier");
        PipelineOrchestrator orchestrator = orchestrator(() -> PipelineSession.open(
                source.closingDataSource(), warehouse.closingDataSource(), properties.getBatchSize()));

        var failure = assertThrows(PipelineExecutionException.class, () -> orchestrator.run(LoadMode.FULL));

        assertEquals(PipelineStage.SUPPLIER_DIMENSION, failure.getFailedStage());
        assertEquals(List.of(
                PipelineState.IDLE,
                PipelineState.CONNECTED,
                PipelineState.DATE_LOADED,
                PipelineState.FAILED), failure.getReport().getTransitions());
        assertTrue(source.connection().isClosed());
        assertTrue(warehouse.connection().isClosed());
    }

    @Test
    @DisplayName("both connections are closed after a successful run")
    void closesConnectionsOnSuccess() throws SQLException {
        PipelineOrchestrator orchestrator = orchestrator(() -> PipelineSession.open(
                source.closingDataSource(), warehouse.closingDataSource(), properties.getBatchSize()));

        orchestrator.run(LoadMode.FULL);

        assertTrue(source.connection().isClosed());
        assertTrue(warehouse.connection().isClosed());
    }

    @Test
    @DisplayName("connection failures are reported against the connect stage")
    void connectionFailure() {
        PipelineOrchestrator orchestrator = orchestrator(() -> {
            throw new ConnectionException("target", new SQLException("refused"));
        });

        var failure = assertThrows(PipelineExecutionException.class, () -> orchestrator.run(LoadMode.FULL));

        assertEquals(PipelineStage.CONNECT, failure.getFailedStage());
        assertInstanceOf(ConnectionException.class, failure.getCause());
        assertEquals(PipelineState.FAILED, failure.getReport().getState());
    }

    @Test
    @DisplayName("an invalid date range aborts before any connection is opened")
    void invalidConfigurationNeverConnects() {
        properties.getDateDimension().setStartDate(LocalDate.of(2025, 1, 1));
        PipelineSessionFactory sessions = mock(PipelineSessionFactory.class);

        assertThrows(ConfigurationException.class, () -> orchestrator(sessions).run(LoadMode.FULL));

        verifyNoInteractions(sessions);
    }

    @Test
    @DisplayName("a missing target url aborts before any connection is opened")
    void missingTargetUrl() {
        properties.getTarget().setUrl(" ");
        PipelineSessionFactory sessions = mock(PipelineSessionFactory.class);
        when(sessions.openSession()).thenThrow(new AssertionError("must not connect"));

        assertThrows(ConfigurationException.class, () -> orchestrator(sessions).run(LoadMode.INCREMENTAL));
    }

    private PipelineOrchestrator orchestrator(PipelineSessionFactory sessions) {
        RegionClassifier regions = TestSessions.regions();
        return new PipelineOrchestrator(
                sessions,
                new DateDimensionGenerator(),
                new DimensionLoader(TestSessions.CLOCK, regions),
                new FactLoader(TestSessions.CLOCK, properties),
                regions,
                properties,
                TestSessions.CLOCK);
    }
}
