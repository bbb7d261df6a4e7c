package com.ryuqq.typeguard.testkit.contract;

import com.ryuqq.typeguard.adapter.inmemory.audit.InMemoryAuditLog;
import com.ryuqq.typeguard.adapter.inmemory.repository.InMemoryUserRepository;
import com.ryuqq.typeguard.application.registry.DefaultUserRegistry;
import com.ryuqq.typeguard.application.registry.RegistryConfig;
import com.ryuqq.typeguard.core.event.AuditEvent;
import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.result.AppError;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.Failure;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.Success;
import com.ryuqq.typeguard.core.result.ValidationError;
import com.ryuqq.typeguard.core.shape.FieldError;
import com.ryuqq.typeguard.core.shape.ValidationResult;
import com.ryuqq.typeguard.core.spi.AuditLog;
import com.ryuqq.typeguard.core.spi.UserRepository;
import com.ryuqq.typeguard.testkit.fixture.MutableClock;
import com.ryuqq.typeguard.testkit.fixture.UserFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for registry contract tests.
 *
 * <p>Wires a {@link DefaultUserRegistry} over fresh SPI implementations before each test
 * and closes it afterwards. The repository and audit log are exposed so that tests can
 * inspect sizes or plant corrupt documents directly.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>{@link #createRepository()}: in-memory by default; override to run against another adapter</li>
 *   <li>{@link #createAuditLog(int)}: in-memory, bounded by {@link RegistryConfig#eventCapacity()}</li>
 *   <li>{@link MutableClock}: starts at {@link MutableClock#DEFAULT_START}</li>
 *   <li>{@link UserFixtures#sequentialIds()}: deterministic ids</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractRegistryContractTest {
 *     {@literal @}Test
 *     void scenario() {
 *         User ann = createUser(UserFixtures.ann());
 *         assertBusinessError(registry.getById("user_missing"), ErrorCodes.NOT_FOUND);
 *     }
 * }
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public abstract class AbstractRegistryContractTest {

    protected RegistryConfig config;
    protected MutableClock clock;
    protected UserRepository repository;
    protected AuditLog auditLog;
    protected DefaultUserRegistry registry;

    @BeforeEach
    void setUpRegistry() {
        config = createConfig();
        clock = new MutableClock();
        repository = createRepository();
        auditLog = createAuditLog(config.eventCapacity());
        registry = new DefaultUserRegistry(repository, auditLog, config, clock, UserFixtures.sequentialIds());
    }

    @AfterEach
    void tearDownRegistry() {
        if (registry != null) {
            registry.close();
        }
    }

    protected RegistryConfig createConfig() {
        return new RegistryConfig();
    }

    protected UserRepository createRepository() {
        return new InMemoryUserRepository();
    }

    protected AuditLog createAuditLog(int capacity) {
        return new InMemoryAuditLog(capacity);
    }

    /**
     * Creates a user and asserts success.
     *
     * @param rawInput raw user input
     * @return the stored user
     */
    protected User createUser(Map<String, Object> rawInput) {
        return assertSuccess(registry.create(rawInput));
    }

    protected List<AuditEvent> events() {
        return assertSuccess(registry.listEvents());
    }

    protected <T> T assertSuccess(Result<T> result) {
        assertThat(result.isSuccess())
            .as("expected success but got %s", result)
            .isTrue();
        return ((Success<T>) result).data();
    }

    protected <T> Failure<T> assertFailure(Result<T> result) {
        assertThat(result.isFailure())
            .as("expected failure but got %s", result)
            .isTrue();
        return (Failure<T>) result;
    }

    /**
     * Asserts a validation failure with the given code.
     *
     * @return the field errors carried in the failure context (empty when none)
     */
    protected List<FieldError> assertValidationError(Result<?> result, String code) {
        AppError error = assertFailure(result).error();
        assertThat(error.isValidationError()).as("expected validation error but got %s", error).isTrue();
        assertThat(((ValidationError) error).code()).isEqualTo(code);
        return ValidationResult.errorsOf(((Failure<?>) result).context());
    }

    protected BusinessError assertBusinessError(Result<?> result, String code) {
        AppError error = assertFailure(result).error();
        assertThat(error.isBusinessError()).as("expected business error but got %s", error).isTrue();
        BusinessError business = (BusinessError) error;
        assertThat(business.code()).isEqualTo(code);
        return business;
    }
}
