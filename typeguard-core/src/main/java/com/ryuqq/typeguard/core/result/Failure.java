package com.ryuqq.typeguard.core.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실패 결과.
 *
 * <p>예상 가능한 실패(입력 오류, 대상 없음 등)는 예외 대신 이 타입으로 전달됩니다.</p>
 *
 * @param error 분류된 오류
 * @param context 진단용 부가 정보 (예: 필드별 검증 오류 목록)
 * @param <T> 원래 연산의 데이터 타입
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record Failure<T>(
    AppError error,
    Map<String, Object> context
) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failure {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * 다른 데이터 타입의 연산 결과로 실패를 그대로 전파합니다.
     *
     * @param <U> 대상 데이터 타입
     * @return 같은 error와 context를 가진 Failure
     */
    public <U> Failure<U> propagate() {
        return new Failure<>(error, context);
    }
}
