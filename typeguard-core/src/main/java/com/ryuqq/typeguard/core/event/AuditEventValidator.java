package com.ryuqq.typeguard.core.event;

import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.predicate.Predicates;
import com.ryuqq.typeguard.core.shape.FieldError;
import com.ryuqq.typeguard.core.shape.FieldValues;
import com.ryuqq.typeguard.core.shape.RecordShape;
import com.ryuqq.typeguard.core.shape.UserShape;
import com.ryuqq.typeguard.core.shape.ValidationResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * 감사 이벤트 문서를 {@link AuditEvent}로 좁히는 판별자 기반 검증기.
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>공통 봉투 검증: type(문자열), timestamp(날짜), data(plain object)</li>
 *   <li>type을 {@link AuditEventKind}로 해석. 알 수 없는 값은 거부</li>
 *   <li>종류별 payload 검증 후 이벤트 생성</li>
 * </ol>
 *
 * <p>종류 분기는 default 없는 enum switch 식입니다. 새 종류가 추가되면 이 클래스가 컴파일되지 않으며,
 * 따로 컴파일된 새 상수가 런타임에 들어오면 JVM이 {@link IncompatibleClassChangeError}를 던집니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class AuditEventValidator {

    public static final String TYPE = "type";
    public static final String TIMESTAMP = "timestamp";
    public static final String DATA = "data";

    private static final RecordShape<FieldValues> ENVELOPE = RecordShape.<FieldValues>builder("AuditEvent")
        .required(TYPE, Predicates::isNonEmptyString, "type must be a non-empty string")
        .required(TIMESTAMP, Predicates::isDate, "timestamp must be a valid date")
        .required(DATA, Predicates::isPlainObject, "data must be a plain object")
        .build(values -> values);

    private static final RecordShape<FieldValues> CREATED_PAYLOAD = RecordShape.<FieldValues>builder("UserCreated")
        .requiredRecord("user", UserShape.INSTANCE, "user must be a valid user")
        .required("source", value -> Predicates.isOneOf(value, (Object[]) CreationSource.wireNames()),
            "source must be one of registration, admin, import")
        .optional("metadata", Predicates::isPlainObject, "metadata must be a plain object")
        .build(values -> values);

    private static final RecordShape<FieldValues> UPDATED_PAYLOAD = RecordShape.<FieldValues>builder("UserUpdated")
        .required("userId", Predicates::isNonEmptyString, "userId must be a non-empty string")
        .required("changes", Predicates::isPlainObject, "changes must be a plain object")
        .required("previousValues", Predicates::isPlainObject, "previousValues must be a plain object")
        .required("updatedBy", Predicates::isNonEmptyString, "updatedBy must be a non-empty string")
        .build(values -> values);

    private static final RecordShape<FieldValues> DELETED_PAYLOAD = RecordShape.<FieldValues>builder("UserDeleted")
        .required("userId", Predicates::isNonEmptyString, "userId must be a non-empty string")
        .required("deletedBy", Predicates::isNonEmptyString, "deletedBy must be a non-empty string")
        .optional("reason", Predicates::isString, "reason must be a string")
        .requiredRecord("backup", UserShape.INSTANCE, "backup must be a valid user")
        .build(values -> values);

    private static final RecordShape<FieldValues> LOGIN_PAYLOAD = RecordShape.<FieldValues>builder("LoginAttempt")
        .required("userId", Predicates::isNonEmptyString, "userId must be a non-empty string")
        .required("ip", Predicates::isNonEmptyString, "ip must be a non-empty string")
        .required("userAgent", Predicates::isNonEmptyString, "userAgent must be a non-empty string")
        .required("successful", Predicates::isBoolean, "successful must be a boolean")
        .optional("failureReason", Predicates::isString, "failureReason must be a string")
        .build(values -> values);

    private AuditEventValidator() {
    }

    public static boolean isAuditEvent(Object value) {
        return validate(value).valid();
    }

    /**
     * 이벤트 문서를 검증하고 좁힙니다.
     *
     * @param value 비정형 이벤트 문서
     * @return 검증 결과 (실패 시 봉투 필드 또는 data 필드 오류)
     */
    public static ValidationResult<AuditEvent> validate(Object value) {
        ValidationResult<FieldValues> envelope = ENVELOPE.validate(value);
        if (!envelope.valid()) {
            return ValidationResult.invalid(envelope.errors());
        }
        FieldValues header = envelope.data();
        String type = header.string(TYPE);
        Optional<AuditEventKind> kind = AuditEventKind.fromWireName(type);
        if (kind.isEmpty()) {
            return ValidationResult.invalid(List.of(FieldError.of(TYPE, "Unknown event type: " + type, type)));
        }

        Instant timestamp = header.instant(TIMESTAMP);
        Map<String, Object> data = header.object(DATA);
        return switch (kind.get()) {
            case CREATED -> narrow(kind.get(), CREATED_PAYLOAD, data, payload -> new UserCreated(
                timestamp,
                payload.get("user", User.class),
                CreationSource.fromWireName(payload.string("source")).orElseThrow(),
                payload.object("metadata")
            ));
            case UPDATED -> narrow(kind.get(), UPDATED_PAYLOAD, data, payload -> new UserUpdated(
                timestamp,
                payload.string("userId"),
                payload.object("changes"),
                payload.object("previousValues"),
                payload.string("updatedBy")
            ));
            case DELETED -> narrow(kind.get(), DELETED_PAYLOAD, data, payload -> new UserDeleted(
                timestamp,
                payload.string("userId"),
                payload.string("deletedBy"),
                payload.string("reason"),
                payload.get("backup", User.class)
            ));
            case LOGIN_ATTEMPT -> narrow(kind.get(), LOGIN_PAYLOAD, data, payload -> new LoginAttempt(
                timestamp,
                payload.string("userId"),
                payload.string("ip"),
                payload.string("userAgent"),
                payload.bool("successful"),
                payload.string("failureReason")
            ));
        };
    }

    private static ValidationResult<AuditEvent> narrow(
        AuditEventKind kind,
        RecordShape<FieldValues> payloadShape,
        Map<String, Object> data,
        Function<FieldValues, AuditEvent> factory
    ) {
        ValidationResult<FieldValues> payload = payloadShape.validate(data);
        if (!payload.valid()) {
            return ValidationResult.invalid(List.of(new FieldError(
                DATA, "Invalid " + kind.wireName() + " event payload", data, payload.errors())));
        }
        return ValidationResult.valid(factory.apply(payload.data()));
    }
}
