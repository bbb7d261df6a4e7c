package com.ryuqq.typeguard.core.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 성공 결과.
 *
 * @param data 성공 데이터
 * @param metadata 부가 정보 (비어 있을 수 있음, null이면 빈 Map으로 대체)
 * @param <T> 데이터 타입
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record Success<T>(
    T data,
    Map<String, Object> metadata
) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException data가 null인 경우
     */
    public Success {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
