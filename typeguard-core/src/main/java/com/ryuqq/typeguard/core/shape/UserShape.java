package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.ContactInfo;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.predicate.Predicates;

/**
 * {@link User} 형태.
 *
 * <p>빠른 판별은 {@link #isUser(Object)}, 필드별 오류가 필요하면 {@link #validateUser(Object)}를 사용합니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>id, name: 비어 있지 않은 문자열</li>
 *   <li>contact: {@link ContactInfoShape}</li>
 *   <li>age: 32비트 범위의 양의 정수</li>
 *   <li>isActive: boolean</li>
 *   <li>tags: 비어 있지 않은 문자열의 배열</li>
 *   <li>metadata: 선택, plain object</li>
 *   <li>createdAt, updatedAt: 날짜, updatedAt ≥ createdAt</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class UserShape {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String CONTACT = "contact";
    public static final String AGE = "age";
    public static final String IS_ACTIVE = "isActive";
    public static final String TAGS = "tags";
    public static final String METADATA = "metadata";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";

    public static final RecordShape<User> INSTANCE = RecordShape.<User>builder("User")
        .required(ID, Predicates::isNonEmptyString, "id must be a non-empty string")
        .required(NAME, Predicates::isNonEmptyString, "name must be a non-empty string")
        .requiredRecord(CONTACT, ContactInfoShape.INSTANCE, "contact must be a valid contact info record")
        .required(AGE, Predicates.and(Predicates::isPositiveInteger, Predicates::isIntValue),
            "age must be a positive integer")
        .required(IS_ACTIVE, Predicates::isBoolean, "isActive must be a boolean")
        .requiredArray(TAGS, Predicates::isNonEmptyString, "tags must be an array of non-empty strings")
        .optional(METADATA, Predicates::isPlainObject, "metadata must be a plain object")
        .required(CREATED_AT, Predicates::isDate, "createdAt must be a valid date")
        .required(UPDATED_AT, Predicates::isDate, "updatedAt must be a valid date")
        .rule(UPDATED_AT, values -> !values.instant(UPDATED_AT).isBefore(values.instant(CREATED_AT)),
            "updatedAt must not precede createdAt")
        .build(UserShape::narrow);

    private UserShape() {
    }

    /**
     * 공통 사용자 필드를 {@link User}로 좁힙니다. 이 형태를 물려받는 역할 형태도 사용합니다.
     */
    static User narrow(FieldValues values) {
        return new User(
            values.string(ID),
            values.string(NAME),
            values.get(CONTACT, ContactInfo.class),
            values.intValue(AGE),
            values.bool(IS_ACTIVE),
            values.strings(TAGS),
            values.object(METADATA),
            values.instant(CREATED_AT),
            values.instant(UPDATED_AT)
        );
    }

    public static boolean isUser(Object value) {
        return INSTANCE.test(value);
    }

    public static ValidationResult<User> validateUser(Object value) {
        return INSTANCE.validate(value);
    }
}
