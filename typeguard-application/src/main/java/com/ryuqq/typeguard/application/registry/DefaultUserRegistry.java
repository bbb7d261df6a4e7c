package com.ryuqq.typeguard.application.registry;

import com.ryuqq.typeguard.application.boundary.Boundary;
import com.ryuqq.typeguard.application.query.ListQuery;
import com.ryuqq.typeguard.application.query.Page;
import com.ryuqq.typeguard.application.query.SortField;
import com.ryuqq.typeguard.application.query.SortOrder;
import com.ryuqq.typeguard.core.assertion.TypeAssertions;
import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.event.AuditEventDocuments;
import com.ryuqq.typeguard.core.event.AuditEventKind;
import com.ryuqq.typeguard.core.event.AuditEventValidator;
import com.ryuqq.typeguard.core.event.CreationSource;
import com.ryuqq.typeguard.core.event.LoginAttempt;
import com.ryuqq.typeguard.core.event.UserCreated;
import com.ryuqq.typeguard.core.event.UserDeleted;
import com.ryuqq.typeguard.core.event.UserUpdated;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.predicate.Predicates;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.ValidationError;
import com.ryuqq.typeguard.core.shape.FieldError;
import com.ryuqq.typeguard.core.shape.UserDocuments;
import com.ryuqq.typeguard.core.shape.UserShape;
import com.ryuqq.typeguard.core.shape.ValidationResult;
import com.ryuqq.typeguard.core.spi.AuditEventListener;
import com.ryuqq.typeguard.core.spi.AuditLog;
import com.ryuqq.typeguard.core.spi.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.ryuqq.typeguard.core.shape.UserShape.AGE;
import static com.ryuqq.typeguard.core.shape.UserShape.CONTACT;
import static com.ryuqq.typeguard.core.shape.UserShape.CREATED_AT;
import static com.ryuqq.typeguard.core.shape.UserShape.ID;
import static com.ryuqq.typeguard.core.shape.UserShape.IS_ACTIVE;
import static com.ryuqq.typeguard.core.shape.UserShape.METADATA;
import static com.ryuqq.typeguard.core.shape.UserShape.NAME;
import static com.ryuqq.typeguard.core.shape.UserShape.TAGS;
import static com.ryuqq.typeguard.core.shape.UserShape.UPDATED_AT;

/**
 * UserRegistry 기본 구현체.
 *
 * <p>{@link UserRepository}와 {@link AuditLog}를 소유하며, 모든 공개 연산을
 * {@code synchronized}로 직렬화하여 읽기가 부분 적용된 쓰기를 관찰하지 않도록 합니다.</p>
 *
 * <p><strong>저장 정책:</strong></p>
 * <ul>
 *   <li>저장소에는 검증을 통과한 사용자의 문서 형태만 기록</li>
 *   <li>읽을 때마다 문서를 다시 검증 (저장소 손상 탐지)</li>
 *   <li>단건 조회의 손상은 DATA_CORRUPTION으로 드러내고, 목록 조회는 손상 레코드를 제외한 뒤
 *       제외 건수를 metadata의 {@value UserRegistry#EXCLUDED_KEY}에 기록</li>
 * </ul>
 *
 * <p><strong>감사 이벤트:</strong></p>
 * <ul>
 *   <li>create → created (user, source)</li>
 *   <li>update → updated (changes, previousValues, updatedBy)</li>
 *   <li>delete → deleted (deletedBy, reason, backup)</li>
 *   <li>recordLoginAttempt → login-attempt</li>
 * </ul>
 * <p>이벤트는 문서로 변환되어 {@link AuditLog}에 추가된 뒤 등록된 리스너에 전달됩니다.</p>
 *
 * <p>예상하지 못한 예외는 {@link Boundary}가 {@code business/INTERNAL_ERROR}로 변환합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class DefaultUserRegistry implements UserRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultUserRegistry.class);

    /**
     * update 입력에서 반영하는 필드. 그 밖의 키(id, createdAt, updatedAt 포함)는 무시됩니다.
     */
    static final List<String> UPDATABLE_FIELDS = List.of(NAME, CONTACT, AGE, IS_ACTIVE, TAGS, METADATA);

    private final UserRepository repository;
    private final AuditLog auditLog;
    private final RegistryConfig config;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final List<AuditEventListener> listeners = new CopyOnWriteArrayList<>();
    private boolean closed;

    /**
     * 기본 설정, UTC 시스템 시계, {@code user_<32 hex>} ID로 생성합니다.
     *
     * @param repository 사용자 저장소
     * @param auditLog 감사 로그
     */
    public DefaultUserRegistry(UserRepository repository, AuditLog auditLog) {
        this(repository, auditLog, new RegistryConfig(), Clock.systemUTC(), DefaultUserRegistry::generateId);
    }

    /**
     * 생성자.
     *
     * @param repository 사용자 저장소
     * @param auditLog 감사 로그
     * @param config 설정
     * @param clock 타임스탬프 시계
     * @param idGenerator 사용자 ID 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultUserRegistry(
        UserRepository repository,
        AuditLog auditLog,
        RegistryConfig config,
        Clock clock,
        Supplier<String> idGenerator
    ) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (auditLog == null) {
            throw new IllegalArgumentException("auditLog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.repository = repository;
        this.auditLog = auditLog;
        this.config = config;
        this.clock = clock;
        this.idGenerator = idGenerator;

        if (auditLog.capacity() != config.eventCapacity()) {
            log.warn("Audit log capacity {} differs from configured eventCapacity {}; listEvents returns at most {} events",
                auditLog.capacity(), config.eventCapacity(), config.eventCapacity());
        }
    }

    /**
     * 기본 ID 생성 규칙: {@code user_} + 하이픈 없는 UUID.
     *
     * @return 새 사용자 ID
     */
    public static String generateId() {
        return "user_" + UUID.randomUUID().toString().replace("-", "");
    }

    public RegistryConfig config() {
        return config;
    }

    // ============================================================
    // 생성
    // ============================================================

    @Override
    public Result<User> create(Object rawInput) {
        return create(rawInput, config.creationSource());
    }

    @Override
    public synchronized Result<User> create(Object rawInput, CreationSource source) {
        return Boundary.guard("create", () -> {
            if (closed) {
                return closedFailure();
            }
            Instant now = now();
            Object candidate = rawInput;
            if (Predicates.isPlainObject(rawInput)) {
                Map<String, Object> merged = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) rawInput).entrySet()) {
                    merged.put((String) entry.getKey(), entry.getValue());
                }
                merged.put(ID, idGenerator.get());
                merged.put(CREATED_AT, now);
                merged.put(UPDATED_AT, now);
                candidate = merged;
            }

            ValidationResult<User> validation = UserShape.validateUser(candidate);
            if (!validation.valid()) {
                log.debug("User creation rejected: {}", describe(validation.errors()));
                return validation.toResult("userData", "Invalid user data", ErrorCodes.INVALID_USER_DATA);
            }

            User user = validation.data();
            if (repository.existsById(user.id())) {
                log.warn("Generated user id {} already exists", user.id());
                return Result.failure(BusinessError.of(
                    ErrorCodes.ID_CONFLICT,
                    "User with ID " + user.id() + " already exists",
                    Map.of("userId", user.id())
                ));
            }

            CreationSource eventSource = source == null ? config.creationSource() : source;
            store(user);
            appendEvent(new UserCreated(now, user, eventSource, null));
            log.info("User {} created (source: {})", user.id(), eventSource.wireName());
            return Result.success(user);
        });
    }

    // ============================================================
    // 조회
    // ============================================================

    @Override
    public synchronized Result<User> getById(Object id) {
        return Boundary.guard("getById", () -> {
            if (closed) {
                return closedFailure();
            }
            return load(id);
        });
    }

    @Override
    public synchronized Result<Page<User>> list(Object rawQuery) {
        return Boundary.guard("list", () -> {
            if (closed) {
                return closedFailure();
            }
            return ListQuery.parse(rawQuery, config.defaultPageSize(), config.maxPageSize())
                .flatMap(this::page);
        });
    }

    @Override
    public synchronized Result<Page<User>> list(int page, int limit, SortField sortBy, SortOrder sortOrder) {
        return Boundary.guard("list", () -> {
            if (closed) {
                return closedFailure();
            }
            return ListQuery.of(page, limit, sortBy, sortOrder, config.maxPageSize())
                .flatMap(this::page);
        });
    }

    // ============================================================
    // 변경
    // ============================================================

    @Override
    public synchronized Result<User> update(Object id, Object partialInput) {
        return Boundary.guard("update", () -> {
            if (closed) {
                return closedFailure();
            }
            return load(id).flatMap(existing -> merge(existing, partialInput));
        });
    }

    @Override
    public synchronized Result<DeleteConfirmation> delete(Object id) {
        return Boundary.guard("delete", () -> {
            if (closed) {
                return closedFailure();
            }
            return load(id).map(this::remove);
        });
    }

    // ============================================================
    // 감사 이벤트
    // ============================================================

    @Override
    public synchronized Result<List<AuditEvent>> listEvents() {
        return listEvents(null);
    }

    /**
     * {@inheritDoc}
     *
     * @param kind null이면 전체
     */
    @Override
    public synchronized Result<List<AuditEvent>> listEvents(AuditEventKind kind) {
        return Boundary.guard("listEvents", () -> {
            if (closed) {
                return closedFailure();
            }
            return collectEvents(kind);
        });
    }

    @Override
    public synchronized Result<List<AuditEvent>> listEventsByType(Object rawType) {
        return Boundary.guard("listEvents", () -> {
            if (closed) {
                return closedFailure();
            }
            if (rawType == null) {
                return collectEvents(null);
            }
            Optional<AuditEventKind> kind = Predicates.isString(rawType)
                ? AuditEventKind.fromWireName((String) rawType)
                : Optional.empty();
            if (kind.isEmpty()) {
                return Result.failure(ValidationError.of(
                    AuditEventValidator.TYPE,
                    "Event type must be one of created, updated, deleted, login-attempt",
                    ErrorCodes.INVALID_EVENT_FILTER
                ));
            }
            return collectEvents(kind.get());
        });
    }

    @Override
    public synchronized Result<LoginAttempt> recordLoginAttempt(Object rawAttempt) {
        return Boundary.guard("recordLoginAttempt", () -> {
            if (closed) {
                return closedFailure();
            }
            Map<String, Object> document = new LinkedHashMap<>();
            document.put(AuditEventValidator.TYPE, AuditEventKind.LOGIN_ATTEMPT.wireName());
            document.put(AuditEventValidator.TIMESTAMP, now());
            document.put(AuditEventValidator.DATA, rawAttempt);

            ValidationResult<AuditEvent> validation = AuditEventValidator.validate(document);
            if (!validation.valid()) {
                log.debug("Login attempt rejected: {}", describe(validation.errors()));
                return Result.failure(
                    ValidationError.of("loginAttempt", "Invalid login attempt", ErrorCodes.INVALID_LOGIN_ATTEMPT),
                    Map.of(ValidationResult.ERRORS_KEY, validation.errors())
                );
            }

            LoginAttempt attempt = (LoginAttempt) validation.data();
            appendEvent(attempt);
            log.info("Login attempt recorded for user {} (successful: {})", attempt.userId(), attempt.successful());
            return Result.success(attempt);
        });
    }

    // ============================================================
    // 수명 주기
    // ============================================================

    @Override
    public synchronized int count() {
        return closed ? 0 : repository.count();
    }

    @Override
    public void addListener(AuditEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    @Override
    public void removeListener(AuditEventListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        int users = repository.count();
        int events = auditLog.size();
        repository.clear();
        auditLog.clear();
        listeners.clear();
        log.info("User registry closed: discarded {} users and {} audit events", users, events);
    }

    // ============================================================
    // 내부
    // ============================================================

    private Result<User> load(Object id) {
        if (!Predicates.isNonEmptyString(id)) {
            return Result.failure(ValidationError.of(ID, "User ID must be a non-empty string", ErrorCodes.INVALID_ID));
        }
        String userId = (String) id;
        Optional<Map<String, Object>> stored = repository.findById(userId);
        if (stored.isEmpty()) {
            return Result.failure(BusinessError.of(
                ErrorCodes.NOT_FOUND,
                "User with ID " + userId + " not found",
                Map.of("userId", userId)
            ));
        }

        ValidationResult<User> check = UserShape.validateUser(stored.get());
        if (!check.valid()) {
            log.warn("Stored user {} failed re-validation: {}", userId, describe(check.errors()));
            return Result.failure(BusinessError.of(
                ErrorCodes.DATA_CORRUPTION,
                "Stored user data is corrupted",
                Map.of("userId", userId, "fields", fieldNames(check.errors()))
            ));
        }
        return Result.success(check.data());
    }

    private Result<Page<User>> page(ListQuery query) {
        List<User> users = new ArrayList<>();
        int excluded = 0;
        for (Map<String, Object> document : repository.findAll()) {
            ValidationResult<User> check = UserShape.validateUser(document);
            if (check.valid()) {
                users.add(check.data());
            } else {
                excluded++;
                log.warn("Excluding corrupt user record {} from list: {}", document.get(ID), describe(check.errors()));
            }
        }

        // List.sort는 안정 정렬: 동률은 삽입 순서 유지
        users.sort(query.sortBy().comparator(query.sortOrder()));
        Page<User> page = Page.slice(users, query.page(), query.limit());
        return Result.success(page, Map.of(EXCLUDED_KEY, excluded));
    }

    private Result<User> merge(User existing, Object partialInput) {
        if (!Predicates.isPlainObject(partialInput)) {
            return Result.failure(ValidationError.of("updates", "Updates must be an object", ErrorCodes.INVALID_UPDATES));
        }
        Map<?, ?> partial = (Map<?, ?>) partialInput;
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : UPDATABLE_FIELDS) {
            if (partial.containsKey(field)) {
                changes.put(field, partial.get(field));
            }
        }
        if (changes.isEmpty()) {
            return Result.failure(ValidationError.of(
                "updates",
                "Updates must contain at least one of " + String.join(", ", UPDATABLE_FIELDS),
                ErrorCodes.INVALID_UPDATES
            ));
        }

        Instant now = now();
        Instant updatedAt = now.isBefore(existing.updatedAt()) ? existing.updatedAt() : now;
        Map<String, Object> previous = UserDocuments.toDocument(existing);
        Map<String, Object> merged = new LinkedHashMap<>(previous);
        for (Map.Entry<String, Object> change : changes.entrySet()) {
            if (change.getValue() == null) {
                merged.remove(change.getKey());
            } else {
                merged.put(change.getKey(), change.getValue());
            }
        }
        merged.put(ID, existing.id());
        merged.put(CREATED_AT, existing.createdAt());
        merged.put(UPDATED_AT, updatedAt);

        ValidationResult<User> validation = UserShape.validateUser(merged);
        if (!validation.valid()) {
            log.debug("Update of user {} rejected: {}", existing.id(), describe(validation.errors()));
            return validation.toResult("userData", "Updated user data is invalid", ErrorCodes.INVALID_UPDATED_DATA);
        }

        User updated = validation.data();
        store(updated);
        appendEvent(new UserUpdated(now, existing.id(), changes, previous, config.actor()));
        log.info("User {} updated: {}", existing.id(), changes.keySet());
        return Result.success(updated);
    }

    private DeleteConfirmation remove(User user) {
        repository.delete(user.id());
        appendEvent(new UserDeleted(now(), user.id(), config.actor(), config.deleteReason(), user));
        log.info("User {} deleted", user.id());
        return DeleteConfirmation.of(user.id());
    }

    private Result<List<AuditEvent>> collectEvents(AuditEventKind kind) {
        List<Map<String, Object>> entries = auditLog.entries();
        List<AuditEvent> events = new ArrayList<>();
        int excluded = 0;
        // 최신 항목부터 순회하여 같은 타임스탬프는 나중에 추가된 이벤트가 앞에 오도록 함
        for (int i = entries.size() - 1; i >= 0; i--) {
            ValidationResult<AuditEvent> check = AuditEventValidator.validate(entries.get(i));
            if (!check.valid()) {
                excluded++;
                log.warn("Excluding invalid audit event {}: {}",
                    entries.get(i).get(AuditEventValidator.TYPE), describe(check.errors()));
                continue;
            }
            if (kind == null || check.data().kind() == kind) {
                events.add(check.data());
            }
        }
        events.sort(Comparator.comparing(AuditEvent::timestamp).reversed());
        if (events.size() > config.eventCapacity()) {
            events = events.subList(0, config.eventCapacity());
        }
        return Result.success(List.copyOf(events), Map.of(EXCLUDED_KEY, excluded));
    }

    private void store(User user) {
        Map<String, Object> document = UserDocuments.toDocument(user);
        TypeAssertions.assertIsUser(document, "user");
        repository.save(user.id(), document);
    }

    private void appendEvent(AuditEvent event) {
        auditLog.append(AuditEventDocuments.toDocument(event));
        for (AuditEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Audit event listener {} failed on {} event", listener, event.kind().wireName(), e);
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static <T> Result<T> closedFailure() {
        return Result.failure(BusinessError.of(ErrorCodes.REGISTRY_CLOSED, "User registry is closed"));
    }

    private static String describe(List<FieldError> errors) {
        return errors.stream()
            .map(error -> error.field() + ": " + error.message())
            .collect(Collectors.joining("; "));
    }

    private static List<String> fieldNames(List<FieldError> errors) {
        return errors.stream().map(FieldError::field).collect(Collectors.toList());
    }
}
