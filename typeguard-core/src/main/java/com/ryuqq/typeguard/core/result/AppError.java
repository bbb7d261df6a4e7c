package com.ryuqq.typeguard.core.result;

/**
 * 분류된 오류.
 *
 * <p>세 종류 중 하나이며 각 종류는 자기 필드만 가집니다:</p>
 * <ul>
 *   <li>{@link ValidationError}: field, message, code</li>
 *   <li>{@link NetworkError}: status, message, endpoint</li>
 *   <li>{@link BusinessError}: code, message, details</li>
 * </ul>
 *
 * <p>종류별 분기는 {@link #type()}에 대한 switch 식으로 작성합니다.
 * enum switch 식은 default 없이 모든 상수를 다뤄야 컴파일되므로 새 종류가 추가되면
 * 처리되지 않은 모든 분기가 컴파일 오류가 됩니다.</p>
 *
 * <pre>
 * int status = switch (error.type()) {
 *     case VALIDATION -&gt; 400;
 *     case NETWORK -&gt; 502;
 *     case BUSINESS -&gt; 500;
 * };
 * </pre>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public sealed interface AppError permits ValidationError, NetworkError, BusinessError {

    ErrorType type();

    String message();

    default boolean isValidationError() {
        return this instanceof ValidationError;
    }

    default boolean isNetworkError() {
        return this instanceof NetworkError;
    }

    default boolean isBusinessError() {
        return this instanceof BusinessError;
    }
}
