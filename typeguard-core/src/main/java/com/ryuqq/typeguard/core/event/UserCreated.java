package com.ryuqq.typeguard.core.event;

import com.ryuqq.typeguard.core.model.Documents;
import com.ryuqq.typeguard.core.model.User;

import java.time.Instant;
import java.util.Map;

/**
 * 사용자 생성 이벤트.
 *
 * @param timestamp 발생 시각
 * @param user 생성된 사용자
 * @param source 생성 경로
 * @param metadata 부가 정보 (선택, null 가능)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record UserCreated(
    Instant timestamp,
    User user,
    CreationSource source,
    Map<String, Object> metadata
) implements AuditEvent {

    public UserCreated {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (metadata != null) {
            metadata = Documents.freeze(metadata);
        }
    }

    @Override
    public AuditEventKind kind() {
        return AuditEventKind.CREATED;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCreated(this);
    }
}
