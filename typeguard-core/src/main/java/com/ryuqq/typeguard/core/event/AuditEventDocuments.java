package com.ryuqq.typeguard.core.event;

import com.ryuqq.typeguard.core.shape.UserDocuments;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link AuditEvent}를 {@code {type, timestamp, data}} 문서로 변환합니다.
 *
 * <p>{@link AuditEventValidator#validate(Object)}의 역변환입니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class AuditEventDocuments {

    private static final AuditEvent.Visitor<Map<String, Object>> PAYLOAD = new AuditEvent.Visitor<>() {

        @Override
        public Map<String, Object> visitCreated(UserCreated event) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("user", UserDocuments.toDocument(event.user()));
            data.put("source", event.source().wireName());
            if (event.metadata() != null) {
                data.put("metadata", event.metadata());
            }
            return data;
        }

        @Override
        public Map<String, Object> visitUpdated(UserUpdated event) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("userId", event.userId());
            data.put("changes", event.changes());
            data.put("previousValues", event.previousValues());
            data.put("updatedBy", event.updatedBy());
            return data;
        }

        @Override
        public Map<String, Object> visitDeleted(UserDeleted event) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("userId", event.userId());
            data.put("deletedBy", event.deletedBy());
            if (event.reason() != null) {
                data.put("reason", event.reason());
            }
            data.put("backup", UserDocuments.toDocument(event.backup()));
            return data;
        }

        @Override
        public Map<String, Object> visitLoginAttempt(LoginAttempt event) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("userId", event.userId());
            data.put("ip", event.ip());
            data.put("userAgent", event.userAgent());
            data.put("successful", event.successful());
            if (event.failureReason() != null) {
                data.put("failureReason", event.failureReason());
            }
            return data;
        }
    };

    private AuditEventDocuments() {
    }

    public static Map<String, Object> toDocument(AuditEvent event) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(AuditEventValidator.TYPE, event.kind().wireName());
        document.put(AuditEventValidator.TIMESTAMP, event.timestamp());
        document.put(AuditEventValidator.DATA, event.accept(PAYLOAD));
        return document;
    }
}
