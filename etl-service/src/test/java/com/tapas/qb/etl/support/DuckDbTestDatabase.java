package com.tapas.qb.etl.support;

import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.datasource.init.ScriptUtils;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * In-memory DuckDB database for tests. Each instance is a separate database.
 */
public final class DuckDbTestDatabase implements AutoCloseable {

    public static final String WAREHOUSE_SCHEMA = "schema/warehouse.sql";
    public static final String SOURCE_SCHEMA = "db/source-schema.sql";
    public static final String SOURCE_DATA = "db/source-data.sql";

    private final Connection connection;

    private DuckDbTestDatabase(Connection connection) {
        this.connection = connection;
    }

    public static DuckDbTestDatabase create(String... scripts) throws SQLException {
        var database = new DuckDbTestDatabase(DriverManager.getConnection("jdbc:duckdb:"));
        for (String script : scripts) {
            database.runScript(script);
        }
        return database;
    }

    public static DuckDbTestDatabase source() throws SQLException {
        return create(SOURCE_SCHEMA, SOURCE_DATA);
    }

    public static DuckDbTestDatabase warehouse() throws SQLException {
        return create(WAREHOUSE_SCHEMA);
    }

    public void runScript(String classpathLocation) {
        ScriptUtils.executeSqlScript(connection, new ClassPathResource(classpathLocation));
    }

    /**
     * Hands out the shared connection; closing it is a no-op so the data
     * survives the pipeline run.
     */
    public DataSource dataSource() {
        return new SingleConnectionDataSource(connection, true);
    }

    /**
     * Hands out the raw connection, so closing it closes the database.
     */
    public DataSource closingDataSource() {
        return new SingleConnectionDataSource(connection, false);
    }

    public JdbcTemplate jdbc() {
        return new JdbcTemplate(dataSource());
    }

    public Connection connection() {
        return connection;
    }

    public int count(String table) {
        Integer count = jdbc().queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public void close() throws SQLException {
        if (!connection.isClosed()) {
            connection.close();
        }
    }
}
