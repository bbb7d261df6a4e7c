package com.ryuqq.typeguard.application.query;

import com.ryuqq.typeguard.core.model.User;

import java.util.Comparator;
import java.util.Optional;

/**
 * 사용자 목록 정렬 기준 필드.
 *
 * <p>각 필드는 전순서(total order) 비교자를 제공합니다. 동률은 비교자가 아니라
 * 안정 정렬(stable sort)이 삽입 순서로 해소합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public enum SortField {

    ID("id", Comparator.comparing(User::id)),
    NAME("name", Comparator.comparing(User::name)),
    AGE("age", Comparator.comparingInt(User::age)),
    IS_ACTIVE("isActive", Comparator.comparing(User::active)),
    CREATED_AT("createdAt", Comparator.comparing(User::createdAt)),
    UPDATED_AT("updatedAt", Comparator.comparing(User::updatedAt)),
    EMAIL("email", Comparator.comparing(user -> user.contact().email()));

    private final String wireName;
    private final Comparator<User> comparator;

    SortField(String wireName, Comparator<User> comparator) {
        this.wireName = wireName;
        this.comparator = comparator;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 지정한 방향의 비교자.
     *
     * @param order 정렬 방향
     * @return 오름차순 비교자 또는 그 역순
     */
    public Comparator<User> comparator(SortOrder order) {
        return switch (order) {
            case ASC -> comparator;
            case DESC -> comparator.reversed();
        };
    }

    public static Optional<SortField> fromWireName(String wireName) {
        for (SortField field : values()) {
            if (field.wireName.equals(wireName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
