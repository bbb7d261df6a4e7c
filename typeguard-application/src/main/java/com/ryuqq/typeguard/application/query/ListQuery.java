package com.ryuqq.typeguard.application.query;

import com.ryuqq.typeguard.core.predicate.Predicates;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.ValidationError;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 검증된 목록 조회 조건.
 *
 * <p>범위를 벗어난 값은 보정(clamp)하지 않고 {@code INVALID_PAGINATION}으로 거절합니다.</p>
 *
 * <p><strong>원시 조회 조건 (raw query):</strong></p>
 * <ul>
 *   <li>page: 1 이상의 정수 또는 정수 문자열 (기본 1)</li>
 *   <li>limit: 1 ~ maxLimit 정수 또는 정수 문자열 (기본 defaultLimit)</li>
 *   <li>sortBy: {@link SortField} 이름 (기본 createdAt)</li>
 *   <li>sortOrder: asc | desc (기본 desc)</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 * @param page 페이지 번호 (1 이상)
 * @param limit 페이지 크기 (1 이상)
 * @param sortBy 정렬 필드
 * @param sortOrder 정렬 방향
 */
public record ListQuery(
    int page,
    int limit,
    SortField sortBy,
    SortOrder sortOrder
) {

    public static final String PAGE = "page";
    public static final String LIMIT = "limit";
    public static final String SORT_BY = "sortBy";
    public static final String SORT_ORDER = "sortOrder";

    public static final int DEFAULT_PAGE = 1;
    public static final SortField DEFAULT_SORT_FIELD = SortField.CREATED_AT;
    public static final SortOrder DEFAULT_SORT_ORDER = SortOrder.DESC;

    public ListQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be at least 1 (current: " + page + ")");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1 (current: " + limit + ")");
        }
        if (sortBy == null) {
            throw new IllegalArgumentException("sortBy cannot be null");
        }
        if (sortOrder == null) {
            throw new IllegalArgumentException("sortOrder cannot be null");
        }
    }

    /**
     * 타입이 지정된 인자를 범위 검증합니다.
     *
     * @param page 페이지 번호
     * @param limit 페이지 크기
     * @param sortBy 정렬 필드 (null이면 기본값)
     * @param sortOrder 정렬 방향 (null이면 기본값)
     * @param maxLimit 허용 최대 페이지 크기
     * @return 검증된 조건 또는 validation 실패
     */
    public static Result<ListQuery> of(int page, int limit, SortField sortBy, SortOrder sortOrder, int maxLimit) {
        if (page < 1) {
            return invalidPagination(PAGE, "page must be an integer greater than or equal to 1");
        }
        if (limit < 1 || limit > maxLimit) {
            return invalidPagination(LIMIT, "limit must be an integer between 1 and " + maxLimit);
        }
        return Result.success(new ListQuery(
            page,
            limit,
            sortBy == null ? DEFAULT_SORT_FIELD : sortBy,
            sortOrder == null ? DEFAULT_SORT_ORDER : sortOrder
        ));
    }

    /**
     * 원시 조회 조건(쿼리 파라미터 등)을 해석합니다.
     *
     * @param raw null 또는 plain object
     * @param defaultLimit limit 미지정 시 사용할 값
     * @param maxLimit 허용 최대 페이지 크기
     * @return 검증된 조건 또는 validation 실패
     */
    public static Result<ListQuery> parse(Object raw, int defaultLimit, int maxLimit) {
        if (raw == null) {
            return of(DEFAULT_PAGE, defaultLimit, null, null, maxLimit);
        }
        if (!Predicates.isPlainObject(raw)) {
            return invalidPagination("query", "List query must be an object");
        }
        Map<?, ?> query = (Map<?, ?>) raw;

        Integer page = toInt(query.get(PAGE), DEFAULT_PAGE);
        if (page == null) {
            return invalidPagination(PAGE, "page must be an integer greater than or equal to 1");
        }
        Integer limit = toInt(query.get(LIMIT), defaultLimit);
        if (limit == null) {
            return invalidPagination(LIMIT, "limit must be an integer between 1 and " + maxLimit);
        }

        SortField sortBy = null;
        Object rawSortBy = query.get(SORT_BY);
        if (rawSortBy != null) {
            sortBy = Predicates.isString(rawSortBy)
                ? SortField.fromWireName((String) rawSortBy).orElse(null)
                : null;
            if (sortBy == null) {
                return invalidSort(SORT_BY, "sortBy must be one of id, name, age, isActive, createdAt, updatedAt, email");
            }
        }

        SortOrder sortOrder = null;
        Object rawSortOrder = query.get(SORT_ORDER);
        if (rawSortOrder != null) {
            sortOrder = Predicates.isString(rawSortOrder)
                ? SortOrder.fromWireName((String) rawSortOrder).orElse(null)
                : null;
            if (sortOrder == null) {
                return invalidSort(SORT_ORDER, "sortOrder must be asc or desc");
            }
        }
        return of(page, limit, sortBy, sortOrder, maxLimit);
    }

    /**
     * 정수 또는 정수 문자열을 int로 변환합니다.
     *
     * @return 변환 값, 값이 없으면 fallback, 정수가 아니면 null
     */
    private static Integer toInt(Object value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (Predicates.isIntValue(value)) {
            return ((Number) value).intValue();
        }
        if (Predicates.isNumericString(value)) {
            BigDecimal decimal = new BigDecimal(((String) value).trim());
            try {
                return decimal.intValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return null;
    }

    private static Result<ListQuery> invalidPagination(String field, String message) {
        return Result.failure(ValidationError.of(field, message, ErrorCodes.INVALID_PAGINATION));
    }

    private static Result<ListQuery> invalidSort(String field, String message) {
        return Result.failure(ValidationError.of(field, message, ErrorCodes.INVALID_SORT));
    }
}
