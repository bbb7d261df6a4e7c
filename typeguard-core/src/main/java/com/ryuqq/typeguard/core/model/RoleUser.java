package com.ryuqq.typeguard.core.model;

/**
 * 역할이 붙은 사용자.
 *
 * <p>공통 사용자 필드는 {@link #user()}에 있고, 역할별 필드는 각 구현 레코드가 가집니다.
 * 분기는 {@link #role()}에 대한 enum switch로 합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public sealed interface RoleUser permits AdminUser, RegularUser {

    User user();

    UserRole role();
}
