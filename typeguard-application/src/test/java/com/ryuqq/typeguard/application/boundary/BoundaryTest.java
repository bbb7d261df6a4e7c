package com.ryuqq.typeguard.application.boundary;

import com.ryuqq.typeguard.core.assertion.TypeAssertions;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.ErrorType;
import com.ryuqq.typeguard.core.result.Failure;
import com.ryuqq.typeguard.core.result.Result;
import com.ryuqq.typeguard.core.result.ValidationError;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Boundary 테스트.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class BoundaryTest {

    @Test
    void guard_SuccessfulAction_ReturnsResultUnchanged() {
        // Given
        Result<String> expected = Result.success("ok");

        // When
        Result<String> result = Boundary.guard("test", () -> expected);

        // Then
        assertThat(result).isSameAs(expected);
    }

    @Test
    void guard_ExpectedFailure_PassesThrough() {
        // Given
        Result<String> expected = Result.failure(ValidationError.of("id", "bad id", ErrorCodes.INVALID_ID));

        // When
        Result<String> result = Boundary.guard("test", () -> expected);

        // Then
        assertThat(result).isSameAs(expected);
    }

    @Test
    void guard_AssertionViolation_ConvertedToInternalError() {
        // When
        Result<String> result = Boundary.guard("assertUser", () -> {
            TypeAssertions.assertIsNonEmptyString("", "name");
            return Result.success("unreachable");
        });

        // Then
        assertInternalError(result, "assertUser");
    }

    @Test
    void guard_UnexpectedRuntimeException_ConvertedToInternalError() {
        // When
        Result<String> result = Boundary.guard("explode", () -> {
            throw new IllegalStateException("boom");
        });

        // Then
        assertInternalError(result, "explode");
    }

    @Test
    void guard_NullResult_ConvertedToInternalError() {
        Result<String> result = Boundary.guard("nothing", () -> null);

        assertInternalError(result, "nothing");
    }

    @Test
    void guard_Error_NotCaught() {
        assertThatThrownBy(() -> Boundary.guard("fatal", () -> {
            throw new AssertionError("fatal");
        })).isInstanceOf(AssertionError.class);
    }

    private static void assertInternalError(Result<?> result, String operation) {
        assertThat(result.isFailure()).isTrue();
        Failure<?> failure = (Failure<?>) result;
        assertThat(failure.error().type()).isEqualTo(ErrorType.BUSINESS);
        BusinessError error = (BusinessError) failure.error();
        assertThat(error.code()).isEqualTo(ErrorCodes.INTERNAL_ERROR);
        assertThat(error.message()).isEqualTo(Boundary.INTERNAL_ERROR_MESSAGE);
        assertThat(error.details()).containsEntry("operation", operation);
    }
}
