package com.ryuqq.typeguard.application.boundary;

import com.ryuqq.typeguard.core.assertion.TypeAssertionException;
import com.ryuqq.typeguard.core.result.BusinessError;
import com.ryuqq.typeguard.core.result.ErrorCodes;
import com.ryuqq.typeguard.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 최상위 예외 경계.
 *
 * <p>예상된 실패는 {@link Result}로 전달되므로, 여기까지 올라오는 예외는 모두 결함입니다.
 * 단언 위반({@link TypeAssertionException})과 그 밖의 런타임 예외를 한 곳에서 잡아
 * 로그를 남기고 {@code business/INTERNAL_ERROR} 결과로 변환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * public Result&lt;User&gt; create(Object rawInput) {
 *     return Boundary.guard("create", () -&gt; doCreate(rawInput));
 * }
 * </pre>
 *
 * <p>{@link Error}는 잡지 않습니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class Boundary {

    public static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private static final Logger log = LoggerFactory.getLogger(Boundary.class);

    private Boundary() {
    }

    /**
     * 작업을 실행하고 예외를 INTERNAL_ERROR 결과로 변환합니다.
     *
     * @param operation 로그와 오류 상세에 남길 작업 이름
     * @param action 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과 또는 INTERNAL_ERROR 실패
     */
    public static <T> Result<T> guard(String operation, Supplier<Result<T>> action) {
        try {
            Result<T> result = action.get();
            if (result == null) {
                log.error("Operation {} returned no result", operation);
                return internalError(operation);
            }
            return result;
        } catch (TypeAssertionException e) {
            log.error("Assertion failed during {}: field '{}', expected {}",
                operation, e.getFieldName(), e.getExpectedDescription(), e);
            return internalError(operation);
        } catch (RuntimeException e) {
            log.error("Unexpected failure during {}", operation, e);
            return internalError(operation);
        }
    }

    public static <T> Result<T> internalError(String operation) {
        return Result.failure(BusinessError.of(
            ErrorCodes.INTERNAL_ERROR,
            INTERNAL_ERROR_MESSAGE,
            Map.of("operation", operation)
        ));
    }
}
