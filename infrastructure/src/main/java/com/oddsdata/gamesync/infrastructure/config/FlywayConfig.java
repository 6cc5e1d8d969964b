package com.oddsdata.gamesync.infrastructure.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.configuration.FluentConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Flyway configuration for the PostgreSQL schema.
 * Migrations run when the bean is created so they complete before Hibernate starts.
 */
@Configuration
@EnableConfigurationProperties(FlywayProperties.class)
@ConditionalOnProperty(name = "spring.flyway.enabled", havingValue = "true", matchIfMissing = true)
public class FlywayConfig {
    
    private static final Logger log = LoggerFactory.getLogger(FlywayConfig.class);
    
    @Bean
    @Primary
    public Flyway flyway(DataSource dataSource, FlywayProperties flywayProperties) {
        FluentConfiguration config = Flyway.configure()
                .dataSource(dataSource)
                .baselineOnMigrate(flywayProperties.isBaselineOnMigrate())
                .validateOnMigrate(flywayProperties.isValidateOnMigrate());
        
        if (flywayProperties.getLocations() != null && !flywayProperties.getLocations().isEmpty()) {
            config.locations(flywayProperties.getLocations().toArray(new String[0]));
        } else {
            config.locations("classpath:db/migration");
        }
        
        Flyway flyway = config.load();
        int applied = flyway.migrate().migrationsExecuted;
        log.info("Flyway applied {} migration(s)", applied);
        return flyway;
    }
}
