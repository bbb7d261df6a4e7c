package com.ryuqq.typeguard.core.model;

import java.time.Instant;
import java.util.List;

/**
 * 관리자 사용자.
 *
 * @param user 공통 사용자 필드
 * @param permissions 권한 문자열 목록 (순서 유지)
 * @param lastLogin 마지막 로그인 시각 (선택, null 가능)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record AdminUser(
    User user,
    List<String> permissions,
    Instant lastLogin
) implements RoleUser {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException user나 permissions가 null인 경우
     */
    public AdminUser {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        if (permissions == null) {
            throw new IllegalArgumentException("permissions cannot be null");
        }
        permissions = List.copyOf(permissions);
    }

    @Override
    public UserRole role() {
        return UserRole.ADMIN;
    }

    public boolean hasPermission(String permission) {
        return permissions.contains(permission);
    }
}
