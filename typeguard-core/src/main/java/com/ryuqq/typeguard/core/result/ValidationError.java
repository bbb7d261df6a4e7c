package com.ryuqq.typeguard.core.result;

/**
 * 입력 검증 오류.
 *
 * @param field 문제가 된 필드 (예: id, pagination, userData)
 * @param message 오류 메시지
 * @param code 오류 코드 (예: INVALID_ID)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record ValidationError(
    String field,
    String message,
    String code
) implements AppError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 빈 문자열인 경우
     */
    public ValidationError {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
    }

    public static ValidationError of(String field, String message, String code) {
        return new ValidationError(field, message, code);
    }

    @Override
    public ErrorType type() {
        return ErrorType.VALIDATION;
    }
}
