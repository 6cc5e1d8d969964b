package com.oddsdata.gamesync.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;

/**
 * JDBC access to the read-only collaborator tables (raw ingestion and outcome sources)
 */
@Configuration
public class JdbcConfig {
    
    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(
            DataSource dataSource,
            @Value("${app.database.statement-timeout-ms:30000}") int statementTimeoutMs) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout(Math.max(1, statementTimeoutMs / 1000));
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }
}
