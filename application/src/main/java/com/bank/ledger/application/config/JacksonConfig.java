package com.bank.ledger.application.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Centralized Jackson ObjectMapper configuration
 * Shared by the Kraken client, the file sources and the REST layer
 */
@Configuration
public class JacksonConfig {

    /**
     * Primary ObjectMapper bean configured for the application
     * - Ignores unknown properties (exchange payloads carry many fields we do not read)
     * - Keeps floating point JSON numbers as BigDecimal so prices and times are not rounded
     * - Writes BigDecimal without exponent notation
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // Kraken sends "time": 1688667796.6 as a bare number
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

        return mapper;
    }
}
