package com.ryuqq.typeguard.core.result;

/**
 * 오류 코드 상수.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class ErrorCodes {

    // validation
    public static final String INVALID_ID = "INVALID_ID";
    public static final String INVALID_USER_DATA = "INVALID_USER_DATA";
    public static final String INVALID_UPDATES = "INVALID_UPDATES";
    public static final String INVALID_UPDATED_DATA = "INVALID_UPDATED_DATA";
    public static final String INVALID_PAGINATION = "INVALID_PAGINATION";
    public static final String INVALID_SORT = "INVALID_SORT";
    public static final String INVALID_EVENT_FILTER = "INVALID_EVENT_FILTER";
    public static final String INVALID_LOGIN_ATTEMPT = "INVALID_LOGIN_ATTEMPT";
    public static final String INVALID_JSON = "INVALID_JSON";

    // business
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String DATA_CORRUPTION = "DATA_CORRUPTION";
    public static final String ID_CONFLICT = "ID_CONFLICT";
    public static final String REGISTRY_CLOSED = "REGISTRY_CLOSED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
    }
}
