package com.ryuqq.typeguard.adapter.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.typeguard.application.query.Page;
import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.event.AuditEventDocuments;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.result.Failure;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.Success;
import com.ryuqq.typeguard.core.shape.FieldError;
import com.ryuqq.typeguard.core.shape.UserDocuments;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders {@link Result} values into {@link ApiResponse} envelopes and JSON text.
 *
 * <p><strong>Payload Conversion:</strong></p>
 * <ul>
 *   <li>{@link User}: its document form</li>
 *   <li>{@link AuditEvent}: its {@code {type, timestamp, data}} document</li>
 *   <li>{@link Page}: its items as {@code data}, bounds as {@code pagination}</li>
 *   <li>{@link FieldError}: {@code {field, message, value, details?}}</li>
 *   <li>Lists and maps: converted element by element</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class ApiResponses {

    private final ObjectMapper objectMapper;

    public ApiResponses() {
        this(JsonSupport.objectMapper());
    }

    public ApiResponses(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    public ApiResponse render(Result<?> result) {
        if (result instanceof Success) {
            Success<?> success = (Success<?>) result;
            Map<String, Object> metadata = success.metadata().isEmpty() ? null : toWireMap(success.metadata());
            if (success.data() instanceof Page) {
                Page<?> page = (Page<?>) success.data();
                return new ApiResponse(true, toWire(page.items()), null, null, Pagination.of(page), metadata);
            }
            return new ApiResponse(true, toWire(success.data()), null, null, null, metadata);
        }
        Failure<?> failure = (Failure<?>) result;
        Map<String, Object> context = failure.context().isEmpty() ? null : toWireMap(failure.context());
        return new ApiResponse(false, null, ApiError.from(failure.error()), context, null, null);
    }

    /**
     * Renders a result as JSON text.
     *
     * @param result operation result
     * @return JSON envelope
     * @throws UncheckedIOException if the payload cannot be serialized
     */
    public String toJson(Result<?> result) {
        return write(render(result));
    }

    String write(ApiResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize API response", e);
        }
    }

    static Object toWire(Object value) {
        if (value instanceof User) {
            return UserDocuments.toDocument((User) value);
        }
        if (value instanceof AuditEvent) {
            return AuditEventDocuments.toDocument((AuditEvent) value);
        }
        if (value instanceof FieldError) {
            return toWire((FieldError) value);
        }
        if (value instanceof Map) {
            return toWireMap((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> items = new ArrayList<>();
            for (Object item : (List<?>) value) {
                items.add(toWire(item));
            }
            return items;
        }
        return value;
    }

    private static Map<String, Object> toWire(FieldError error) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("field", error.field());
        wire.put("message", error.message());
        wire.put("value", toWire(error.offendingValue()));
        if (error.hasDetails()) {
            wire.put("details", toWire(error.details()));
        }
        return wire;
    }

    private static Map<String, Object> toWireMap(Map<?, ?> map) {
        Map<String, Object> wire = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            wire.put(String.valueOf(entry.getKey()), toWire(entry.getValue()));
        }
        return wire;
    }
}
