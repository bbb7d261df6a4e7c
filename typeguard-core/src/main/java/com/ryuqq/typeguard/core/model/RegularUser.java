package com.ryuqq.typeguard.core.model;

/**
 * 일반 사용자.
 *
 * @param user 공통 사용자 필드
 * @param subscription 구독 등급 (선택, null 가능)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record RegularUser(
    User user,
    Subscription subscription
) implements RoleUser {

    public RegularUser {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
    }

    @Override
    public UserRole role() {
        return UserRole.USER;
    }
}
