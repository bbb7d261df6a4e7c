package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.RoleUser;
import com.ryuqq.typeguard.core.model.UserRole;
import com.ryuqq.typeguard.core.predicate.Predicates;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code role} 판별자로 역할 사용자 문서를 좁히는 검증기.
 *
 * <p>role이 없거나 문자열이 아니면 role 필드 오류 하나만 보고합니다. role이 해석되면
 * 해당 역할의 형태가 나머지 필드를 모두 검사합니다.
 * 역할 분기는 default 없는 enum switch 식이므로 역할이 추가되면 이 클래스가 컴파일되지 않습니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class RoleUserValidator {

    public static final String ROLE = "role";

    private RoleUserValidator() {
    }

    public static boolean isRoleUser(Object value) {
        return validate(value).valid();
    }

    public static ValidationResult<RoleUser> validate(Object value) {
        if (!Predicates.isPlainObject(value)) {
            return ValidationResult.invalid(List.of(
                FieldError.of(RecordShape.ROOT_FIELD, RecordShape.NOT_AN_OBJECT, value)));
        }
        Object role = ((Map<?, ?>) value).get(ROLE);
        if (role == null) {
            return ValidationResult.invalid(List.of(FieldError.of(ROLE, "Missing or invalid role field", null)));
        }
        if (!Predicates.isString(role)) {
            return ValidationResult.invalid(List.of(FieldError.of(ROLE, "role must be a string", role)));
        }
        Optional<UserRole> parsed = UserRole.fromWireName((String) role);
        if (parsed.isEmpty()) {
            return ValidationResult.invalid(List.of(FieldError.of(ROLE, "Unknown user role: " + role, role)));
        }
        return switch (parsed.get()) {
            case ADMIN -> widen(AdminUserShape.validateAdminUser(value));
            case USER -> widen(RegularUserShape.validateRegularUser(value));
        };
    }

    private static ValidationResult<RoleUser> widen(ValidationResult<? extends RoleUser> result) {
        if (result.valid()) {
            return ValidationResult.valid(result.data());
        }
        return ValidationResult.invalid(result.errors());
    }
}
