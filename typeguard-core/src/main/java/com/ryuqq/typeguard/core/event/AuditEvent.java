package com.ryuqq.typeguard.core.event;

import java.time.Instant;

/**
 * 감사 이벤트 (tagged union).
 *
 * <p>상태를 바꾼 연산의 불변 기록입니다. 네 가지 종류가 있습니다:</p>
 * <ul>
 *   <li>{@link UserCreated}: 사용자 생성</li>
 *   <li>{@link UserUpdated}: 사용자 변경 (이전 값 포함)</li>
 *   <li>{@link UserDeleted}: 사용자 삭제 (전체 백업 포함)</li>
 *   <li>{@link LoginAttempt}: 로그인 시도</li>
 * </ul>
 *
 * <p>종류별 처리는 {@link Visitor}를 구현하거나 {@link #kind()}에 대한 switch 식으로 작성합니다.
 * 두 방식 모두 새 종류가 추가되면 컴파일 단계에서 누락이 드러납니다.</p>
 *
 * <pre>
 * String text = switch (event.kind()) {
 *     case CREATED -&gt; "created";
 *     case UPDATED -&gt; "updated";
 *     case DELETED -&gt; "deleted";
 *     case LOGIN_ATTEMPT -&gt; "login";
 * };
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public sealed interface AuditEvent permits UserCreated, UserUpdated, UserDeleted, LoginAttempt {

    AuditEventKind kind();

    Instant timestamp();

    <R> R accept(Visitor<R> visitor);

    /**
     * 종류별 처리기.
     *
     * @param <R> 처리 결과 타입
     */
    interface Visitor<R> {

        R visitCreated(UserCreated event);

        R visitUpdated(UserUpdated event);

        R visitDeleted(UserDeleted event);

        R visitLoginAttempt(LoginAttempt event);
    }
}
