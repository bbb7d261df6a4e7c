package com.ryuqq.typeguard.adapter.json;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Response envelope: {@code {success, data?, error?, context?, pagination?, metadata?}}.
 *
 * @param success whether the operation succeeded
 * @param data payload on success
 * @param error classified error on failure
 * @param context failure context (field errors)
 * @param pagination page bounds for list results
 * @param metadata success metadata
 * @author TypeGuard Team
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
    boolean success,
    Object data,
    ApiError error,
    Map<String, Object> context,
    Pagination pagination,
    Map<String, Object> metadata
) {

    public ApiResponse {
        if (success && error != null) {
            throw new IllegalArgumentException("successful response cannot carry an error");
        }
        if (!success && (error == null || data != null)) {
            throw new IllegalArgumentException("failed response requires an error and no data");
        }
    }
}
