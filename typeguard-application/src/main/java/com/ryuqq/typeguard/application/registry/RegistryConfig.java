package com.ryuqq.typeguard.application.registry;

import com.ryuqq.typeguard.core.event.CreationSource;

/**
 * UserRegistry 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>eventCapacity: 조회 가능한 감사 이벤트 최대 건수 (기본 100). 감사 로그가 더 많이 보존해도
 *       listEvents는 최신 eventCapacity건까지만 반환합니다.</li>
 *   <li>defaultPageSize: limit 미지정 시 페이지 크기 (기본 10)</li>
 *   <li>maxPageSize: 허용 최대 페이지 크기 (기본 100, {@value #PAGE_SIZE_CEILING} 이하)</li>
 *   <li>actor: 감사 이벤트의 updatedBy/deletedBy (기본 "api")</li>
 *   <li>creationSource: created 이벤트의 source (기본 ADMIN)</li>
 *   <li>deleteReason: deleted 이벤트의 reason (기본 "API request")</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 * @param eventCapacity 감사 로그 보존 건수 (양수)
 * @param defaultPageSize 기본 페이지 크기 (1 이상, maxPageSize 이하)
 * @param maxPageSize 최대 페이지 크기 (1 이상, 100 이하)
 * @param actor 변경 주체 (공백 불가)
 * @param creationSource 생성 출처
 * @param deleteReason 삭제 사유 (null 허용)
 */
public record RegistryConfig(
    int eventCapacity,
    int defaultPageSize,
    int maxPageSize,
    String actor,
    CreationSource creationSource,
    String deleteReason
) {

    /**
     * maxPageSize 상한.
     */
    public static final int PAGE_SIZE_CEILING = 100;

    /**
     * 기본 설정 생성자.
     */
    public RegistryConfig() {
        this(100, 10, 100, "api", CreationSource.ADMIN, "API request");
    }

    public RegistryConfig {
        if (eventCapacity <= 0) {
            throw new IllegalArgumentException(
                "eventCapacity must be positive (current: " + eventCapacity + ")"
            );
        }
        if (maxPageSize <= 0 || maxPageSize > PAGE_SIZE_CEILING) {
            throw new IllegalArgumentException(
                "maxPageSize must be between 1 and " + PAGE_SIZE_CEILING + " (current: " + maxPageSize + ")"
            );
        }
        if (defaultPageSize <= 0 || defaultPageSize > maxPageSize) {
            throw new IllegalArgumentException(
                "defaultPageSize must be between 1 and " + maxPageSize + " (current: " + defaultPageSize + ")"
            );
        }
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor cannot be null or blank");
        }
        if (creationSource == null) {
            throw new IllegalArgumentException("creationSource cannot be null");
        }
    }

    public RegistryConfig withEventCapacity(int eventCapacity) {
        return new RegistryConfig(eventCapacity, defaultPageSize, maxPageSize, actor, creationSource, deleteReason);
    }

    public RegistryConfig withDefaultPageSize(int defaultPageSize) {
        return new RegistryConfig(eventCapacity, defaultPageSize, maxPageSize, actor, creationSource, deleteReason);
    }

    public RegistryConfig withMaxPageSize(int maxPageSize) {
        return new RegistryConfig(eventCapacity, defaultPageSize, maxPageSize, actor, creationSource, deleteReason);
    }

    public RegistryConfig withActor(String actor) {
        return new RegistryConfig(eventCapacity, defaultPageSize, maxPageSize, actor, creationSource, deleteReason);
    }

    public RegistryConfig withCreationSource(CreationSource creationSource) {
        return new RegistryConfig(eventCapacity, defaultPageSize, maxPageSize, actor, creationSource, deleteReason);
    }

    public RegistryConfig withDeleteReason(String deleteReason) {
        return new RegistryConfig(eventCapacity, defaultPageSize, maxPageSize, actor, creationSource, deleteReason);
    }
}
