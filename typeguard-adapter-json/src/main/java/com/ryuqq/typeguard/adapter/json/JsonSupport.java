package com.ryuqq.typeguard.adapter.json;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared {@link ObjectMapper} configuration for the JSON edge.
 *
 * <p>Instants are written as ISO-8601 strings; floating point input is read as {@link Double}
 * so that numeric predicates see the same values a JSON client sent.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class JsonSupport {

    private JsonSupport() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
}
