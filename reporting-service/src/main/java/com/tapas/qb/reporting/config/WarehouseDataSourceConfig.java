package com.tapas.qb.reporting.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Read-only connection to the sales warehouse, bound from
 * {@code warehouse.datasource}.
 */
@Configuration
public class WarehouseDataSourceConfig {

    private static final Logger logger = LoggerFactory.getLogger(WarehouseDataSourceConfig.class);

    @Bean
    @ConfigurationProperties("warehouse.datasource")
    public DataSourceProperties warehouseDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    public DataSource warehouseDataSource(DataSourceProperties warehouseDataSourceProperties) {
        logger.info("Initializing warehouse DataSource with URL: {}", warehouseDataSourceProperties.getUrl());
        return warehouseDataSourceProperties
                .initializeDataSourceBuilder()
                .build();
    }

    @Bean
    public JdbcTemplate warehouseJdbcTemplate(DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }
}
