package com.ryuqq.typeguard.core.result;

/**
 * 오류 분류.
 *
 * <p>{@link #label()} 값은 호출자에게 노출되는 계약이므로 변경하면 안 됩니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum ErrorType {

    /**
     * 입력 검증 실패.
     */
    VALIDATION("validation"),

    /**
     * 외부 호출 실패.
     */
    NETWORK("network"),

    /**
     * 비즈니스 규칙 위반 또는 내부 오류.
     */
    BUSINESS("business");

    private final String label;

    ErrorType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
