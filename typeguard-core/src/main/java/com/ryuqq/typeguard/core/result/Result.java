package com.ryuqq.typeguard.core.result;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 실패 가능한 연산의 결과.
 *
 * <p>Result는 두 가지 경우 중 정확히 하나입니다:</p>
 * <ul>
 *   <li>{@link Success}: 데이터(및 선택적 메타데이터)를 가진 성공</li>
 *   <li>{@link Failure}: 분류된 오류({@link AppError})와 선택적 컨텍스트를 가진 실패</li>
 * </ul>
 *
 * <p>Sealed interface이므로 data와 error가 동시에 존재하거나 둘 다 없는 상태는 만들 수 없습니다.
 * 소비자는 구현 타입을 직접 검사하기보다 {@link #isSuccess()}, {@link #isFailure()}를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;User&gt; result = registry.getById(id);
 * String text = result.fold(
 *     user -&gt; "found " + user.name(),
 *     failure -&gt; "failed: " + failure.error().message()
 * );
 * </pre>
 *
 * @param <T> 성공 데이터 타입
 * @author TypeGuard Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param data 성공 데이터 (null 불가)
     * @param <T> 데이터 타입
     * @return Success 인스턴스
     */
    static <T> Result<T> success(T data) {
        return new Success<>(data, Map.of());
    }

    /**
     * 메타데이터를 포함한 성공 결과 생성.
     *
     * @param data 성공 데이터 (null 불가)
     * @param metadata 부가 정보
     * @param <T> 데이터 타입
     * @return Success 인스턴스
     */
    static <T> Result<T> success(T data, Map<String, Object> metadata) {
        return new Success<>(data, metadata);
    }

    static <T> Result<T> failure(AppError error) {
        return new Failure<>(error, Map.of());
    }

    static <T> Result<T> failure(AppError error, Map<String, Object> context) {
        return new Failure<>(error, context);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 성공 데이터를 변환합니다. 실패는 그대로 전파됩니다.
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper cannot be null");
        if (this instanceof Success) {
            Success<T> success = (Success<T>) this;
            return new Success<>(mapper.apply(success.data()), success.metadata());
        }
        return ((Failure<T>) this).propagate();
    }

    /**
     * 성공 데이터로 다음 연산을 이어갑니다. 실패는 그대로 전파됩니다.
     *
     * @param next 다음 연산
     * @param <U> 다음 연산의 데이터 타입
     * @return 다음 연산의 Result 또는 전파된 실패
     */
    default <U> Result<U> flatMap(Function<? super T, Result<U>> next) {
        Objects.requireNonNull(next, "next cannot be null");
        if (this instanceof Success) {
            return next.apply(((Success<T>) this).data());
        }
        return ((Failure<T>) this).propagate();
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess cannot be null");
        Objects.requireNonNull(onFailure, "onFailure cannot be null");
        if (this instanceof Success) {
            return onSuccess.apply(((Success<T>) this).data());
        }
        return onFailure.apply((Failure<T>) this);
    }
}
