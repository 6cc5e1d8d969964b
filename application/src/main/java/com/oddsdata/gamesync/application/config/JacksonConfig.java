package com.oddsdata.gamesync.application.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.oddsdata.gamesync.domain.enums.GameSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Centralized Jackson ObjectMapper configuration
 * Used for the REST bodies and the resolver client payloads
 */
@Configuration
public class JacksonConfig {
    
    /**
     * Primary ObjectMapper bean
     * - Ignores unknown properties so resolver responses may grow
     * - Handles LocalDate and OffsetDateTime
     * - Writes dates as ISO-8601 strings
     * - Writes sources as their tags
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.registerModule(new SimpleModule("game-source")
                .addSerializer(GameSource.class, ToStringSerializer.instance));
        return mapper;
    }
}
