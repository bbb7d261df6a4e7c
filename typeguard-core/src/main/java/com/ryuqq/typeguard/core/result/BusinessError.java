package com.ryuqq.typeguard.core.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 비즈니스 규칙 위반 또는 내부 오류.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>NOT_FOUND: 대상 없음</li>
 *   <li>DATA_CORRUPTION: 저장된 데이터가 검증을 통과하지 못함 (재시도 불가)</li>
 *   <li>INTERNAL_ERROR: 경계에서 포착된 결함</li>
 * </ul>
 *
 * @param code 오류 코드
 * @param message 오류 메시지
 * @param details 부가 정보 (선택, null 가능)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record BusinessError(
    String code,
    String message,
    Map<String, Object> details
) implements AppError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null이거나 빈 문자열인 경우
     */
    public BusinessError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (details != null) {
            details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }
    }

    public static BusinessError of(String code, String message) {
        return new BusinessError(code, message, null);
    }

    public static BusinessError of(String code, String message, Map<String, Object> details) {
        return new BusinessError(code, message, details);
    }

    @Override
    public ErrorType type() {
        return ErrorType.BUSINESS;
    }
}
