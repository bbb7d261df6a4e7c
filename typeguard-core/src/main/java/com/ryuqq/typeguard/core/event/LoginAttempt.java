package com.ryuqq.typeguard.core.event;

import java.time.Instant;

/**
 * 로그인 시도 이벤트.
 *
 * @param timestamp 발생 시각
 * @param userId 대상 사용자 ID
 * @param ip 요청 IP
 * @param userAgent 요청 User-Agent
 * @param successful 성공 여부
 * @param failureReason 실패 사유 (선택, null 가능)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record LoginAttempt(
    Instant timestamp,
    String userId,
    String ip,
    String userAgent,
    boolean successful,
    String failureReason
) implements AuditEvent {

    public LoginAttempt {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (ip == null || ip.isBlank()) {
            throw new IllegalArgumentException("ip cannot be null or blank");
        }
        if (userAgent == null || userAgent.isBlank()) {
            throw new IllegalArgumentException("userAgent cannot be null or blank");
        }
    }

    @Override
    public AuditEventKind kind() {
        return AuditEventKind.LOGIN_ATTEMPT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLoginAttempt(this);
    }
}
