package com.ryuqq.typeguard.core.event;

import com.ryuqq.typeguard.core.model.User;

import java.time.Instant;

/**
 * 사용자 삭제 이벤트.
 *
 * @param timestamp 발생 시각
 * @param userId 삭제된 사용자 ID
 * @param deletedBy 삭제 주체
 * @param reason 사유 (선택, null 가능)
 * @param backup 삭제 직전 사용자 전체
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record UserDeleted(
    Instant timestamp,
    String userId,
    String deletedBy,
    String reason,
    User backup
) implements AuditEvent {

    public UserDeleted {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (deletedBy == null || deletedBy.isBlank()) {
            throw new IllegalArgumentException("deletedBy cannot be null or blank");
        }
        if (backup == null) {
            throw new IllegalArgumentException("backup cannot be null");
        }
    }

    @Override
    public AuditEventKind kind() {
        return AuditEventKind.DELETED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDeleted(this);
    }
}
