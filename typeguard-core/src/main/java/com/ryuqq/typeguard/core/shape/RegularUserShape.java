package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.RegularUser;
import com.ryuqq.typeguard.core.model.Subscription;
import com.ryuqq.typeguard.core.model.UserRole;
import com.ryuqq.typeguard.core.predicate.Predicates;

/**
 * {@link RegularUser} 형태.
 *
 * <p>{@link UserShape}의 필드와 규칙에 role({@code "user"})과
 * 선택 필드 subscription(basic, premium, enterprise 중 하나)을 더합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class RegularUserShape {

    public static final String SUBSCRIPTION = "subscription";

    public static final RecordShape<RegularUser> INSTANCE = RecordShape.<RegularUser>builder("RegularUser")
        .extend(UserShape.INSTANCE)
        .required(RoleUserValidator.ROLE, value -> UserRole.USER.wireName().equals(value), "role must be user")
        .optional(SUBSCRIPTION, RegularUserShape::isSubscription,
            "subscription must be one of basic, premium, enterprise")
        .build(values -> new RegularUser(
            UserShape.narrow(values),
            values.has(SUBSCRIPTION)
                ? Subscription.fromWireName(values.string(SUBSCRIPTION)).orElseThrow()
                : null
        ));

    private RegularUserShape() {
    }

    public static boolean isRegularUser(Object value) {
        return INSTANCE.test(value);
    }

    public static ValidationResult<RegularUser> validateRegularUser(Object value) {
        return INSTANCE.validate(value);
    }

    private static boolean isSubscription(Object value) {
        return Predicates.isString(value) && Subscription.fromWireName((String) value).isPresent();
    }
}
