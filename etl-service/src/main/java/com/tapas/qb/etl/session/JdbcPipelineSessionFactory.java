package com.tapas.qb.etl.session;

import com.tapas.qb.etl.config.EtlProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.sql.DataSource;

/**
 * Builds unpooled data sources from {@code etl.source} and {@code etl.target};
 * a run only ever needs one connection per side.
 */
@Component
public class JdbcPipelineSessionFactory implements PipelineSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(JdbcPipelineSessionFactory.class);

    private final EtlProperties properties;

    public JdbcPipelineSessionFactory(EtlProperties properties) {
        this.properties = properties;
    }

    @Override
    public PipelineSession openSession() {
        return PipelineSession.open(
                dataSource("source", properties.getSource()),
                dataSource("target", properties.getTarget()),
                properties.getBatchSize());
    }

    private static DataSource dataSource(String name, EtlProperties.Endpoint endpoint) {
        log.info("Creating {} DataSource with URL: {}", name, endpoint.getUrl());
        DataSourceBuilder<SimpleDriverDataSource> builder = DataSourceBuilder.create()
                .type(SimpleDriverDataSource.class)
                .url(endpoint.getUrl())
                .username(endpoint.getUsername())
                .password(endpoint.getPassword());
        if (StringUtils.hasText(endpoint.getDriverClassName())) {
            builder.driverClassName(endpoint.getDriverClassName());
        }
        return builder.build();
    }
}
