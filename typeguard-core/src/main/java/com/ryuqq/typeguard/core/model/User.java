package com.ryuqq.typeguard.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 검증을 통과한 사용자 엔티티.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>id, createdAt은 생성 후 변경되지 않음</li>
 *   <li>updatedAt ≥ createdAt</li>
 *   <li>tags, metadata는 변경 불가 뷰 (호출자가 수정해도 저장소 상태에 영향 없음)</li>
 * </ul>
 *
 * <p>인스턴스는 {@code UserShape}의 검증을 거쳐서만 만들어지므로
 * 모든 필드 검사를 통과한 상태입니다.</p>
 *
 * @param id 시스템이 생성한 식별자
 * @param name 표시 이름
 * @param contact 연락처
 * @param age 나이 (양의 정수)
 * @param active 활성 여부
 * @param tags 태그 목록 (순서 유지, 중복 허용)
 * @param metadata 자유 형식 메타데이터 (선택, null 가능)
 * @param createdAt 생성 시각
 * @param updatedAt 마지막 변경 시각
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record User(
    String id,
    String name,
    ContactInfo contact,
    int age,
    boolean active,
    List<String> tags,
    Map<String, Object> metadata,
    Instant createdAt,
    Instant updatedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반하는 경우
     */
    public User {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (contact == null) {
            throw new IllegalArgumentException("contact cannot be null");
        }
        if (age < 1) {
            throw new IllegalArgumentException("age must be positive (current: " + age + ")");
        }
        if (tags == null) {
            throw new IllegalArgumentException("tags cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        if (updatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException(
                "updatedAt must not precede createdAt (createdAt: " + createdAt + ", updatedAt: " + updatedAt + ")");
        }
        tags = List.copyOf(tags);
        if (metadata != null) {
            metadata = Documents.freeze(metadata);
        }
    }
}
