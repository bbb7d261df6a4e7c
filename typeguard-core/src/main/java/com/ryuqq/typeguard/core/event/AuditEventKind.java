package com.ryuqq.typeguard.core.event;

import java.util.Optional;

/**
 * 감사 이벤트 종류 (판별자).
 *
 * <p>닫힌 집합입니다. 종류별 분기는 default 없는 switch 식으로 작성하여
 * 새 종류가 추가되면 처리되지 않은 모든 분기가 컴파일 오류가 되도록 합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum AuditEventKind {

    CREATED("created"),
    UPDATED("updated"),
    DELETED("deleted"),
    LOGIN_ATTEMPT("login-attempt");

    private final String wireName;

    AuditEventKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 문서의 {@code type} 필드에 기록되는 이름.
     *
     * @return wire 이름 (예: login-attempt)
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire 이름으로 종류 조회.
     *
     * @param wireName wire 이름 (null 허용)
     * @return 알려진 종류면 값, 아니면 empty
     */
    public static Optional<AuditEventKind> fromWireName(String wireName) {
        for (AuditEventKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
