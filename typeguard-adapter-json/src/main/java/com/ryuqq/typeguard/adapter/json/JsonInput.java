package com.ryuqq.typeguard.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses JSON text into the untyped value model consumed by the core.
 *
 * <p>Objects become {@code LinkedHashMap<String, Object>}, arrays become {@code List},
 * numbers become {@code Integer}/{@code Long}/{@code BigInteger}/{@code Double}.</p>
 *
 * <p><strong>Failure Cases:</strong></p>
 * <ul>
 *   <li>null or blank text: validation/INVALID_JSON</li>
 *   <li>malformed JSON or trailing tokens: validation/INVALID_JSON</li>
 *   <li>the literal {@code null}: validation/INVALID_JSON</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class JsonInput {

    public static final String BODY_FIELD = "body";

    private static final Logger log = LoggerFactory.getLogger(JsonInput.class);

    private final ObjectMapper objectMapper;

    public JsonInput() {
        this(JsonSupport.objectMapper());
    }

    public JsonInput(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a request body.
     *
     * @param json JSON text
     * @return untyped value or validation failure
     */
    public Result<Object> parse(String json) {
        if (json == null || json.isBlank()) {
            return invalid("Request body is empty");
        }
        Object value;
        try {
            value = objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Rejected malformed JSON body: {}", e.getOriginalMessage());
            return invalid("Malformed JSON: " + e.getOriginalMessage());
        }
        if (value == null) {
            return invalid("Request body must not be null");
        }
        return Result.success(value);
    }

    private static Result<Object> invalid(String message) {
        return Result.failure(ValidationError.of(BODY_FIELD, message, ErrorCodes.INVALID_JSON));
    }
}
