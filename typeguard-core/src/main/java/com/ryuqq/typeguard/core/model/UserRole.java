package com.ryuqq.typeguard.core.model;

import java.util.Optional;

/**
 * 역할 사용자 문서의 {@code role} 판별자.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum UserRole {

    ADMIN("admin"),
    USER("user");

    private final String wireName;

    UserRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<UserRole> fromWireName(String wireName) {
        for (UserRole role : values()) {
            if (role.wireName.equals(wireName)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
