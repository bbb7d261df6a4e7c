package com.ryuqq.typeguard.core.model;

import java.util.Optional;

/**
 * 일반 사용자의 구독 등급.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum Subscription {

    BASIC("basic"),
    PREMIUM("premium"),
    ENTERPRISE("enterprise");

    private final String wireName;

    Subscription(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Subscription> fromWireName(String wireName) {
        for (Subscription subscription : values()) {
            if (subscription.wireName.equals(wireName)) {
                return Optional.of(subscription);
            }
        }
        return Optional.empty();
    }
}
