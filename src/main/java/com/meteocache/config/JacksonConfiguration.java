package com.meteocache.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API JSON conventions, applied on top of Boot's auto-configured ObjectMapper so the
 * registered modules (java.time, JDK 8 types, parameter names) stay in place.
 */
@Configuration
public class JacksonConfiguration {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer meteoCacheJacksonCustomizer() {
        return builder -> builder
                // Don't fail on unknown properties
                .featuresToDisable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                // ISO-8601 instead of epoch numbers
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // Don't include null values in JSON
                .serializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
