package com.ryuqq.typeguard.application.registry;

import com.ryuqq.typeguard.application.query.Page;
import com.ryuqq.typeguard.application.query.SortField;
import com.ryuqq.typeguard.application.query.SortOrder;
import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.event.AuditEventKind;
import com.ryuqq.typeguard.core.event.CreationSource;
import com.ryuqq.typeguard.core.event.LoginAttempt;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.spi.AuditEventListener;

import java.util.List;

/**
 * 감사 로그를 갖춘 사용자 저장소 서비스.
 *
 * <p>모든 연산은 비정형 입력을 받아 {@link Result}를 반환합니다. 예상된 실패
 * (잘못된 입력, 없는 사용자)는 예외가 아니라 실패 결과로 전달됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;User&gt; created = registry.create(Map.of(
 *     "name", "Ann",
 *     "contact", Map.of("email", "a@b.com"),
 *     "age", 30,
 *     "isActive", true,
 *     "tags", List.of("x")));
 *
 * if (created.isSuccess()) {
 *     String id = ((Success&lt;User&gt;) created).data().id();
 *     registry.update(id, Map.of("age", 31));
 * }
 * </pre>
 *
 * <p><strong>오류 분류:</strong></p>
 * <ul>
 *   <li>validation: INVALID_ID, INVALID_USER_DATA, INVALID_UPDATES, INVALID_UPDATED_DATA,
 *       INVALID_PAGINATION, INVALID_SORT, INVALID_EVENT_FILTER, INVALID_LOGIN_ATTEMPT</li>
 *   <li>business: NOT_FOUND, DATA_CORRUPTION, ID_CONFLICT, REGISTRY_CLOSED, INTERNAL_ERROR</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public interface UserRegistry extends AutoCloseable {

    /**
     * 메타데이터 키: 손상으로 제외된 레코드 수.
     */
    String EXCLUDED_KEY = "excluded";

    /**
     * 사용자를 생성합니다.
     *
     * <p>입력에 시스템 필드(id, createdAt, updatedAt)를 덮어써 병합한 뒤 상세 검증합니다.
     * 실패 시 아무것도 저장하지 않고 이벤트도 남기지 않습니다.</p>
     *
     * @param rawInput 비정형 사용자 입력
     * @return 저장된 사용자 또는 validation/INVALID_USER_DATA
     */
    Result<User> create(Object rawInput);

    /**
     * 생성 출처를 지정하여 사용자를 생성합니다.
     *
     * @param rawInput 비정형 사용자 입력
     * @param source created 이벤트에 기록할 출처
     * @return 저장된 사용자 또는 validation/INVALID_USER_DATA
     */
    Result<User> create(Object rawInput, CreationSource source);

    /**
     * ID로 사용자를 조회합니다. 저장된 값은 반환 전에 다시 검증합니다.
     *
     * @param id 비어 있지 않은 문자열이어야 함
     * @return 사용자, 또는 INVALID_ID / NOT_FOUND / DATA_CORRUPTION
     */
    Result<User> getById(Object id);

    /**
     * 원시 조회 조건으로 목록을 조회합니다.
     *
     * @param rawQuery null 또는 page/limit/sortBy/sortOrder를 가진 plain object
     * @return 페이지 (metadata에 {@value #EXCLUDED_KEY}) 또는 INVALID_PAGINATION / INVALID_SORT
     */
    Result<Page<User>> list(Object rawQuery);

    Result<Page<User>> list(int page, int limit, SortField sortBy, SortOrder sortOrder);

    /**
     * 부분 입력을 기존 사용자에 병합합니다. id와 createdAt은 항상 보존됩니다.
     *
     * @param id 사용자 ID
     * @param partialInput name, contact, age, isActive, tags, metadata 중 하나 이상을 가진 plain object
     * @return 갱신된 사용자, 또는 INVALID_ID / NOT_FOUND / INVALID_UPDATES / INVALID_UPDATED_DATA
     */
    Result<User> update(Object id, Object partialInput);

    /**
     * 사용자를 삭제하고 전체 백업을 담은 deleted 이벤트를 남깁니다.
     *
     * @param id 사용자 ID
     * @return 삭제 확인, 또는 INVALID_ID / NOT_FOUND
     */
    Result<DeleteConfirmation> delete(Object id);

    /**
     * 감사 이벤트를 최신순으로 조회합니다. 검증에 실패한 이벤트는 제외되고 최대 {@code eventCapacity}건까지 반환합니다.
     *
     * @return 이벤트 목록 (metadata에 {@value #EXCLUDED_KEY})
     */
    Result<List<AuditEvent>> listEvents();

    Result<List<AuditEvent>> listEvents(AuditEventKind kind);

    /**
     * 와이어 이름(created, updated, deleted, login-attempt)으로 필터링하여 조회합니다.
     *
     * @param rawType null이면 전체
     * @return 이벤트 목록 또는 INVALID_EVENT_FILTER
     */
    Result<List<AuditEvent>> listEventsByType(Object rawType);

    /**
     * 로그인 시도를 감사 로그에 기록합니다.
     *
     * @param rawAttempt userId, ip, userAgent, successful, failureReason(선택)을 가진 plain object
     * @return 기록된 이벤트 또는 INVALID_LOGIN_ATTEMPT
     */
    Result<LoginAttempt> recordLoginAttempt(Object rawAttempt);

    /**
     * 저장된 사용자 수.
     *
     * @return 사용자 수 (닫힌 뒤에는 0)
     */
    int count();

    void addListener(AuditEventListener listener);

    void removeListener(AuditEventListener listener);

    /**
     * 보유 상태를 비우고 레지스트리를 닫습니다. 이후 연산은 REGISTRY_CLOSED로 실패합니다.
     */
    @Override
    void close();
}
