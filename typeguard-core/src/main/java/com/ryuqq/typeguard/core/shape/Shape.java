package com.ryuqq.typeguard.core.shape;

/**
 * 선언된 형태(shape)에 대한 검증기.
 *
 * <p>같은 형태에 대해 두 가지 모드를 제공합니다:</p>
 * <ul>
 *   <li>{@link #test(Object)}: 빠른 판별. boolean 하나만 반환</li>
 *   <li>{@link #validate(Object)}: 상세 검증. 실패한 필드별 오류 목록 반환</li>
 * </ul>
 *
 * <p>두 메서드 모두 예외를 던지지 않고 입력을 변경하지 않습니다.
 * 이미 검증된 데이터를 다시 검증하면 항상 같은 값으로 valid가 나옵니다.</p>
 *
 * @param <T> 좁혀진 타입
 * @author TypeGuard Team
 * @since 1.0.0
 */
public interface Shape<T> {

    /**
     * 형태 이름 (예: User, ContactInfo).
     *
     * @return 형태 이름
     */
    String name();

    boolean test(Object value);

    ValidationResult<T> validate(Object value);
}
