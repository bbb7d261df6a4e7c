package com.ryuqq.typeguard.application.query;

import java.util.Optional;

/**
 * 정렬 방향.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum SortOrder {

    ASC("asc"),
    DESC("desc");

    private final String wireName;

    SortOrder(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 대소문자를 구분하지 않고 정렬 방향을 찾습니다.
     *
     * @param wireName "asc" 또는 "desc"
     * @return 일치하는 방향, 없으면 empty
     */
    public static Optional<SortOrder> fromWireName(String wireName) {
        for (SortOrder order : values()) {
            if (order.wireName.equalsIgnoreCase(wireName)) {
                return Optional.of(order);
            }
        }
        return Optional.empty();
    }
}
