package com.ryuqq.typeguard.core.event;

import com.ryuqq.typeguard.core.model.Documents;

import java.time.Instant;
import java.util.Map;

/**
 * 사용자 변경 이벤트.
 *
 * <p>롤백에 쓸 수 있도록 변경 전 문서 전체를 {@code previousValues}에 보관합니다.</p>
 *
 * @param timestamp 발생 시각
 * @param userId 대상 사용자 ID
 * @param changes 호출자가 요청한 변경 내용
 * @param previousValues 변경 전 사용자 문서
 * @param updatedBy 변경 주체
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record UserUpdated(
    Instant timestamp,
    String userId,
    Map<String, Object> changes,
    Map<String, Object> previousValues,
    String updatedBy
) implements AuditEvent {

    public UserUpdated {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (changes == null || previousValues == null) {
            throw new IllegalArgumentException("changes and previousValues cannot be null");
        }
        if (updatedBy == null || updatedBy.isBlank()) {
            throw new IllegalArgumentException("updatedBy cannot be null or blank");
        }
        changes = Documents.freeze(changes);
        previousValues = Documents.freeze(previousValues);
    }

    @Override
    public AuditEventKind kind() {
        return AuditEventKind.UPDATED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUpdated(this);
    }
}
