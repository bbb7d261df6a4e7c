package com.ryuqq.typeguard.core.shape;

import java.util.List;

/**
 * 필드 단위 검증 오류.
 *
 * <p>중첩 레코드(예: contact)의 검증이 실패하면 부모는 자기 필드 하나만 오류로 보고하고,
 * 중첩 레코드의 오류들은 {@link #details()}에 첨부됩니다.</p>
 *
 * @param field 필드 이름 (루트 자체가 잘못된 경우 "root", 배열 원소는 "tags[1]")
 * @param message 오류 메시지
 * @param offendingValue 받은 값 (필드가 없으면 null)
 * @param details 하위 오류 목록 (없으면 빈 목록)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record FieldError(
    String field,
    String message,
    Object offendingValue,
    List<FieldError> details
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException field 또는 message가 null이거나 빈 문자열인 경우
     */
    public FieldError {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static FieldError of(String field, String message, Object offendingValue) {
        return new FieldError(field, message, offendingValue, List.of());
    }

    public boolean hasDetails() {
        return !details.isEmpty();
    }
}
