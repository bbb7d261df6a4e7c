package com.ryuqq.typeguard.adapter.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ryuqq.typeguard.core.result.AppError;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.NetworkError;
import com.ryuqq.typeguard.core.result.ValidationError;

import java.util.Map;

/**
 * Wire form of a classified error.
 *
 * <p>Only the fields of the error's own kind are populated; the rest stay null and are omitted.</p>
 *
 * @param type validation, network or business
 * @param code validation and business errors
 * @param field validation errors
 * @param message all kinds
 * @param status network errors
 * @param endpoint network errors
 * @param details business errors (optional)
 * @author TypeGuard Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    String type,
    String code,
    String field,
    String message,
    Integer status,
    String endpoint,
    Map<String, Object> details
) {

    public static ApiError from(AppError error) {
        String type = error.type().label();
        return switch (error.type()) {
            case VALIDATION -> {
                ValidationError validation = (ValidationError) error;
                yield new ApiError(type, validation.code(), validation.field(), validation.message(), null, null, null);
            }
            case NETWORK -> {
                NetworkError network = (NetworkError) error;
                yield new ApiError(type, null, null, network.message(), network.status(), network.endpoint(), null);
            }
            case BUSINESS -> {
                BusinessError business = (BusinessError) error;
                yield new ApiError(type, business.code(), null, business.message(), null, null, business.details());
            }
        };
    }
}
