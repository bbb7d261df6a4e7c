package com.ryuqq.typeguard.testkit.contract;

import com.ryuqq.typeguard.application.feed.SessionEventFeed;
import com.ryuqq.typeguard.application.registry.UserRegistry;
import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.event.AuditEventKind;
import com.ryuqq.typeguard.core.event.LoginAttempt;
import com.ryuqq.typeguard.core.event.UserCreated;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.Success;
import com.ryuqq.typeguard.testkit.fixture.UserFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 감사 이벤트 계약 테스트: 순서, 필터, 보존 한도, 로그인 시도, 세션 피드.
 */
class AuditEventContractTest extends AbstractRegistryContractTest {

    @Test
    @DisplayName("이벤트는 최신순으로 반환된다")
    void eventsAreNewestFirst() {
        // Given
        User ann = createUser(UserFixtures.ann());
        clock.advance(Duration.ofSeconds(1));
        registry.update(ann.id(), Map.of("age", 31));
        clock.advance(Duration.ofSeconds(1));
        registry.recordLoginAttempt(UserFixtures.loginAttempt(ann.id(), true));

        // When
        List<AuditEvent> events = events();

        // Then
        assertThat(events).extracting(AuditEvent::kind)
            .containsExactly(AuditEventKind.LOGIN_ATTEMPT, AuditEventKind.UPDATED, AuditEventKind.CREATED);
        assertThat(events).extracting(AuditEvent::timestamp).isSortedAccordingTo((a, b) -> b.compareTo(a));
    }

    @Test
    @DisplayName("종류별 필터는 해당 종류만 반환하고 잘못된 종류는 거부된다")
    void filtersByKind() {
        // Given
        User ann = createUser(UserFixtures.ann());
        createUser(UserFixtures.user("Bob", "bob@example.com", 40));
        registry.delete(ann.id());

        // When
        List<AuditEvent> created = assertSuccess(registry.listEventsByType("created"));
        List<AuditEvent> deleted = assertSuccess(registry.listEvents(AuditEventKind.DELETED));

        // Then
        assertThat(created).hasSize(2).allMatch(event -> event instanceof UserCreated);
        assertThat(deleted).hasSize(1);
        assertValidationError(registry.listEventsByType("purged"), ErrorCodes.INVALID_EVENT_FILTER);
        assertValidationError(registry.listEventsByType(7), ErrorCodes.INVALID_EVENT_FILTER);
        assertThat(assertSuccess(registry.listEventsByType(null))).hasSize(3);
    }

    @Test
    @DisplayName("감사 로그는 최근 100개만 보존한다")
    void retainsMostRecentHundredEvents() {
        // Given
        for (int i = 0; i < 105; i++) {
            createUser(UserFixtures.user("User" + i, "u" + i + "@example.com", 30));
            clock.advance(Duration.ofSeconds(1));
        }

        // When
        List<AuditEvent> events = events();

        // Then
        assertThat(auditLog.size()).isEqualTo(100);
        assertThat(events).hasSize(100);
        assertThat(((UserCreated) events.get(0)).user().name()).isEqualTo("User104");
        assertThat(((UserCreated) events.get(99)).user().name()).isEqualTo("User5");
        assertThat(registry.count()).isEqualTo(105);
    }

    @Test
    @DisplayName("로그인 시도는 검증 후 login-attempt 이벤트로 기록된다")
    void recordsLoginAttempts() {
        // When
        LoginAttempt failed = assertSuccess(registry.recordLoginAttempt(UserFixtures.loginAttempt("user_1", false)));

        // Then
        assertThat(failed.successful()).isFalse();
        assertThat(failed.failureReason()).isEqualTo("invalid password");
        assertThat(failed.timestamp()).isEqualTo(clock.instant());
        assertThat(events()).containsExactly(failed);
    }

    @Test
    @DisplayName("잘못된 로그인 시도는 기록되지 않는다")
    void rejectsInvalidLoginAttempt() {
        // Given
        Map<String, Object> attempt = UserFixtures.loginAttempt("user_1", true);
        attempt.remove("ip");

        // When
        assertValidationError(registry.recordLoginAttempt(attempt), ErrorCodes.INVALID_LOGIN_ATTEMPT);
        assertValidationError(registry.recordLoginAttempt("nope"), ErrorCodes.INVALID_LOGIN_ATTEMPT);

        // Then
        assertThat(auditLog.size()).isZero();
    }

    @Test
    @DisplayName("세션 피드는 최근 50개를 최신순으로 유지한다")
    void sessionFeedKeepsFiftyNewest() {
        // Given
        SessionEventFeed feed = new SessionEventFeed();
        registry.addListener(feed);

        // When
        for (int i = 0; i < 60; i++) {
            registry.recordLoginAttempt(UserFixtures.loginAttempt("user_" + i, true));
        }

        // Then
        assertThat(feed.size()).isEqualTo(50);
        assertThat(((LoginAttempt) feed.events().get(0)).userId()).isEqualTo("user_59");
        assertThat(((LoginAttempt) feed.events().get(49)).userId()).isEqualTo("user_10");
    }

    @Test
    @DisplayName("잘못된 이벤트 문서는 제외되고 excluded로 보고된다")
    void invalidEventDocumentsAreExcluded() {
        // Given
        createUser(UserFixtures.ann());
        auditLog.append(Map.of("type", "created", "timestamp", clock.instant(), "data", Map.of("source", "api")));

        // When
        Result<List<AuditEvent>> result = registry.listEvents();

        // Then
        assertThat(assertSuccess(result)).hasSize(1);
        assertThat(((Success<List<AuditEvent>>) result).metadata()).containsEntry(UserRegistry.EXCLUDED_KEY, 1);
    }
}
