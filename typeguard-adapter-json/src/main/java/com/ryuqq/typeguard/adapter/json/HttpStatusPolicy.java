package com.ryuqq.typeguard.adapter.json;

import com.ryuqq.typeguard.core.result.AppError;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.Failure;
import com.ryuqq.typeguard.core.result.Result;

/**
 * Maps classified errors to HTTP status codes.
 *
 * <ul>
 *   <li>validation: 400</li>
 *   <li>business/NOT_FOUND: 404</li>
 *   <li>any other business or network error: 500</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class HttpStatusPolicy {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_SERVER_ERROR = 500;

    private HttpStatusPolicy() {
    }

    public static int statusOf(AppError error) {
        return switch (error.type()) {
            case VALIDATION -> BAD_REQUEST;
            case BUSINESS -> ErrorCodes.NOT_FOUND.equals(((BusinessError) error).code())
                ? NOT_FOUND
                : INTERNAL_SERVER_ERROR;
            case NETWORK -> INTERNAL_SERVER_ERROR;
        };
    }

    /**
     * Status for a result.
     *
     * @param result operation result
     * @param successStatus status to use on success (200 or 201)
     * @return HTTP status code
     */
    public static int statusOf(Result<?> result, int successStatus) {
        if (result instanceof Failure) {
            return statusOf(((Failure<?>) result).error());
        }
        return successStatus;
    }
}
