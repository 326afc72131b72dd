package com.tapas.qb.etl.config;

import com.tapas.qb.etl.service.RegionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EtlProperties.class)
public class EtlConfig {

    private static final Logger log = LoggerFactory.getLogger(EtlConfig.class);

    @Bean
    public Clock etlClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RegionClassifier regionClassifier(EtlProperties properties) {
        log.info("Region mapping configured for {} states, default region '{}'",
                properties.getRegions().size(), properties.getDefaultRegion());
        return new RegionClassifier(properties.getRegions(), properties.getDefaultRegion());
    }
}
