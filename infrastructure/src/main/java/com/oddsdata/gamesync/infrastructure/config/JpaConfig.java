package com.oddsdata.gamesync.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * JPA/Hibernate configuration for PostgreSQL.
 * Applies the statement timeout shared by every store round trip.
 */
@Configuration
public class JpaConfig {
    
    private static final Logger log = LoggerFactory.getLogger(JpaConfig.class);
    
    @Value("${app.database.statement-timeout-ms:30000}")
    private int statementTimeoutMs;
    
    @Bean
    public HibernatePropertiesCustomizer hibernatePropertiesCustomizer() {
        return (Map<String, Object> hibernateProperties) -> {
            log.info("Configuring Hibernate for PostgreSQL (query timeout {} ms)", statementTimeoutMs);
            hibernateProperties.put("hibernate.dialect", "org.hibernate.dialect.PostgreSQLDialect");
            hibernateProperties.put("jakarta.persistence.query.timeout", statementTimeoutMs);
        };
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
