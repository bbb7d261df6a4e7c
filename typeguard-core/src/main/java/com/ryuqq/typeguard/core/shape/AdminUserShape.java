package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.AdminUser;
import com.ryuqq.typeguard.core.model.UserRole;
import com.ryuqq.typeguard.core.predicate.Predicates;

/**
 * {@link AdminUser} 형태.
 *
 * <p>{@link UserShape}의 필드와 규칙을 모두 물려받고 다음을 더합니다:</p>
 * <ul>
 *   <li>role: 정확히 {@code "admin"}</li>
 *   <li>permissions: 문자열 배열</li>
 *   <li>lastLogin: 선택, 날짜</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class AdminUserShape {

    public static final String PERMISSIONS = "permissions";
    public static final String LAST_LOGIN = "lastLogin";

    public static final RecordShape<AdminUser> INSTANCE = RecordShape.<AdminUser>builder("AdminUser")
        .extend(UserShape.INSTANCE)
        .required(RoleUserValidator.ROLE, value -> UserRole.ADMIN.wireName().equals(value), "role must be admin")
        .requiredArray(PERMISSIONS, Predicates::isString, "permissions must be an array of strings")
        .optional(LAST_LOGIN, Predicates::isDate, "lastLogin must be a valid date")
        .build(values -> new AdminUser(
            UserShape.narrow(values),
            values.strings(PERMISSIONS),
            values.instant(LAST_LOGIN)
        ));

    private AdminUserShape() {
    }

    public static boolean isAdminUser(Object value) {
        return INSTANCE.test(value);
    }

    public static ValidationResult<AdminUser> validateAdminUser(Object value) {
        return INSTANCE.validate(value);
    }
}
