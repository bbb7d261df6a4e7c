package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.ValidationError;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 상세 검증 결과.
 *
 * <p>valid이면 좁혀진(narrowed) 데이터를, 아니면 실패한 필드마다 하나씩의 오류를 가집니다.
 * 필드 검사는 첫 실패에서 멈추지 않으므로 독립적으로 실패한 모든 필드가 수집됩니다.</p>
 *
 * @param valid 검증 통과 여부
 * @param data 좁혀진 데이터 (valid가 아니면 null)
 * @param errors 필드 오류 목록 (valid이면 빈 목록, 아니면 1개 이상)
 * @param <T> 좁혀진 데이터 타입
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record ValidationResult<T>(
    boolean valid,
    T data,
    List<FieldError> errors
) {

    /**
     * Context 키: 필드 오류 목록.
     */
    public static final String ERRORS_KEY = "validationErrors";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException valid/data/errors 조합이 맞지 않는 경우
     */
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid && (data == null || !errors.isEmpty())) {
            throw new IllegalArgumentException("valid result requires data and no errors");
        }
        if (!valid && (data != null || errors.isEmpty())) {
            throw new IllegalArgumentException("invalid result requires at least one error and no data");
        }
    }

    public static <T> ValidationResult<T> valid(T data) {
        return new ValidationResult<>(true, data, List.of());
    }

    public static <T> ValidationResult<T> invalid(List<FieldError> errors) {
        return new ValidationResult<>(false, null, errors);
    }

    /**
     * Failure context에서 필드 오류 목록을 꺼냅니다.
     *
     * @param context Failure의 context
     * @return {@value #ERRORS_KEY} 키의 필드 오류 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException 해당 키의 값이 FieldError 목록이 아닌 경우
     */
    public static List<FieldError> errorsOf(Map<String, ?> context) {
        Object value = context.get(ERRORS_KEY);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(ERRORS_KEY + " must be a list (current: " + value + ")");
        }
        List<FieldError> errors = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (!(item instanceof FieldError)) {
                throw new IllegalArgumentException(ERRORS_KEY + " must contain FieldError entries (current: " + item + ")");
            }
            errors.add((FieldError) item);
        }
        return List.copyOf(errors);
    }

    /**
     * Result로 변환합니다.
     *
     * <p>실패 시 {@link ValidationError}를 만들고 필드 오류 목록은
     * context의 {@value #ERRORS_KEY} 키에 담습니다.</p>
     *
     * @param field 실패 시 보고할 필드 이름
     * @param message 실패 시 메시지
     * @param code 실패 시 오류 코드
     * @return Success 또는 Failure
     */
    public Result<T> toResult(String field, String message, String code) {
        if (valid) {
            return Result.success(data);
        }
        return Result.failure(ValidationError.of(field, message, code), Map.of(ERRORS_KEY, errors));
    }
}
