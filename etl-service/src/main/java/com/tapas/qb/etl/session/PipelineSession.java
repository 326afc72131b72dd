package com.tapas.qb.etl.session;

import com.tapas.qb.etl.exception.ConnectionException;
import com.tapas.qb.etl.repository.DimensionRepository;
import com.tapas.qb.etl.repository.FactRepository;
import com.tapas.qb.etl.repository.SourceRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * The source and target connections of one pipeline run. Both are held for the
 * whole run and released by {@link #close()}, which the orchestrator calls on
 * every exit path.
 */
public class PipelineSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineSession.class);

    private final Connection sourceConnection;
    private final Connection targetConnection;
    private final SourceRecordRepository source;
    private final DimensionRepository dimensions;
    private final FactRepository facts;
    private final TransactionTemplate targetTransactions;

    private PipelineSession(Connection sourceConnection, Connection targetConnection, int batchSize) {
        this.sourceConnection = sourceConnection;
        this.targetConnection = targetConnection;

        var sourceDataSource = new SingleConnectionDataSource(sourceConnection, true);
        var targetDataSource = new SingleConnectionDataSource(targetConnection, true);
        var targetJdbcTemplate = new JdbcTemplate(targetDataSource);

        this.source = new SourceRecordRepository(new JdbcTemplate(sourceDataSource));
        this.dimensions = new DimensionRepository(targetJdbcTemplate, batchSize);
        this.facts = new FactRepository(targetJdbcTemplate, batchSize);
        this.targetTransactions = new TransactionTemplate(new DataSourceTransactionManager(targetDataSource));
    }

    /**
     * Opens the source connection, then the target connection. If the target
     * cannot be reached the already open source connection is closed before
     * the failure propagates.
     */
    public static PipelineSession open(DataSource sourceDataSource, DataSource targetDataSource, int batchSize) {
        Connection source = connect("source", sourceDataSource);
        Connection target;
        try {
            target = connect("target", targetDataSource);
        } catch (ConnectionException e) {
            closeQuietly("source", source, e);
            throw e;
        }
        log.info("Connected to source and target databases");
        return new PipelineSession(source, target, batchSize);
    }

    public SourceRecordRepository source() {
        return source;
    }

    public DimensionRepository dimensions() {
        return dimensions;
    }

    public FactRepository facts() {
        return facts;
    }

    /**
     * Runs {@code work} in one target transaction; it commits when the work
     * returns and rolls back when it throws.
     */
    public <T> T inTargetTransaction(Supplier<T> work) {
        return targetTransactions.execute(status -> work.get());
    }

    @Override
    public void close() {
        closeConnection("source", sourceConnection);
        closeConnection("target", targetConnection);
    }

    private static Connection connect(String endpoint, DataSource dataSource) {
        try {
            return dataSource.getConnection();
        } catch (SQLException | RuntimeException e) {
            throw new ConnectionException(endpoint, e);
        }
    }

    private static void closeConnection(String endpoint, Connection connection) {
        try {
            connection.close();
            log.info("{} database connection closed", endpoint);
        } catch (SQLException e) {
            log.warn("Failed to close {} database connection", endpoint, e);
        }
    }

    private static void closeQuietly(String endpoint, Connection connection, Exception primary) {
        try {
            connection.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
        log.info("{} database connection closed after connection failure", endpoint);
    }
}
