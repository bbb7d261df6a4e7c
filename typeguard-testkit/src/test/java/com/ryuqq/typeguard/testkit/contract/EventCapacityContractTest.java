package com.ryuqq.typeguard.testkit.contract;

import com.ryuqq.typeguard.adapter.inmemory.audit.InMemoryAuditLog;
import com.ryuqq.typeguard.application.registry.RegistryConfig;
import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.event.UserCreated;
import com.ryuqq.typeguard.core.spi.AuditLog;
import com.ryuqq.typeguard.testkit.fixture.UserFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * eventCapacity 계약 테스트: 감사 로그가 더 많이 보존해도 조회는 설정된 건수로 제한된다.
 */
class EventCapacityContractTest extends AbstractRegistryContractTest {

    private static final int EVENT_CAPACITY = 3;
    private static final int LOG_CAPACITY = 10;

    @Override
    protected RegistryConfig createConfig() {
        return new RegistryConfig().withEventCapacity(EVENT_CAPACITY);
    }

    @Override
    protected AuditLog createAuditLog(int capacity) {
        return new InMemoryAuditLog(LOG_CAPACITY);
    }

    @Test
    @DisplayName("listEvents는 최신 eventCapacity건만 반환한다")
    void listEventsIsBoundedByEventCapacity() {
        // Given
        for (int i = 0; i < 5; i++) {
            createUser(UserFixtures.user("User" + i, "u" + i + "@example.com", 30));
            clock.advance(Duration.ofSeconds(1));
        }

        // When
        List<AuditEvent> events = events();

        // Then
        assertThat(auditLog.size()).isEqualTo(5);
        assertThat(events).hasSize(EVENT_CAPACITY);
        assertThat(events).extracting(event -> ((UserCreated) event).user().name())
            .containsExactly("User4", "User3", "User2");
    }

    @Test
    @DisplayName("종류 필터는 제한 전에 적용된다")
    void kindFilterAppliesBeforeCapacity() {
        // Given
        for (int i = 0; i < 4; i++) {
            createUser(UserFixtures.user("User" + i, "u" + i + "@example.com", 30));
            clock.advance(Duration.ofSeconds(1));
        }
        registry.recordLoginAttempt(UserFixtures.loginAttempt("user_1", true));

        // When
        List<AuditEvent> created = assertSuccess(registry.listEventsByType("created"));

        // Then
        assertThat(created).hasSize(EVENT_CAPACITY);
    }
}
