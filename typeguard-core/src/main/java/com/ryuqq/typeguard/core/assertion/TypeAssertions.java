package com.ryuqq.typeguard.core.assertion;

import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.predicate.Predicates;
import com.ryuqq.typeguard.core.shape.FieldError;
import com.ryuqq.typeguard.core.shape.UserShape;
import com.ryuqq.typeguard.core.shape.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 실패 시 즉시 예외를 던지는 단언 함수 모음.
 *
 * <p>판별 함수가 false를 반환하면 필드 이름, 받은 값, 기대 형태를 담은
 * {@link TypeAssertionException}을 던지고, 통과하면 좁혀진 값을 반환합니다.</p>
 *
 * <p><strong>주의:</strong> 신뢰 경계(이미 검증되었다고 주장하는 데이터)에서만 사용합니다.
 * 모든 오류를 모아야 하는 상세 검증({@code Shape#validate})에서는 사용하지 않습니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class TypeAssertions {

    private TypeAssertions() {
    }

    public static <T> T assertDefined(T value, String fieldName) {
        if (value == null) {
            throw new TypeAssertionException(fieldName + " is required but was null", fieldName, null, "defined value");
        }
        return value;
    }

    public static String assertIsString(Object value, String fieldName) {
        check(Predicates.isString(value), value, fieldName, "string");
        return (String) value;
    }

    public static String assertIsNonEmptyString(Object value, String fieldName) {
        check(Predicates.isNonEmptyString(value), value, fieldName, "non-empty string");
        return (String) value;
    }

    public static Number assertIsNumber(Object value, String fieldName) {
        check(Predicates.isNumber(value), value, fieldName, "number");
        return (Number) value;
    }

    public static Number assertIsPositiveNumber(Object value, String fieldName) {
        check(Predicates.isPositiveNumber(value), value, fieldName, "positive number");
        return (Number) value;
    }

    /**
     * 배열과 모든 원소를 검사합니다. 처음 실패한 원소를 {@code fieldName[index]}로 보고합니다.
     *
     * @param value 검사 대상
     * @param element 원소 조건
     * @param fieldName 필드 이름
     * @return 검사된 배열
     */
    public static List<?> assertIsArrayOf(Object value, Predicate<Object> element, String fieldName) {
        check(Predicates.isArray(value), value, fieldName, "array");
        List<?> items = (List<?>) value;
        for (int i = 0; i < items.size(); i++) {
            check(element.test(items.get(i)), items.get(i), fieldName + "[" + i + "]", "valid array element");
        }
        return items;
    }

    public static Map<?, ?> assertHasProperty(Object value, String key, String fieldName) {
        check(Predicates.isObject(value) && ((Map<?, ?>) value).containsKey(key),
            value, fieldName, "object with property '" + key + "'");
        return (Map<?, ?>) value;
    }

    /**
     * 속성이 있고 그 값이 조건을 만족하는지 검사합니다.
     *
     * @param value 검사 대상 객체
     * @param key 속성 이름
     * @param guard 속성 값 조건
     * @param fieldName 객체 필드 이름 (실패 시 {@code fieldName.key}로 보고)
     * @return 속성 값
     */
    public static Object assertHasTypedProperty(Object value, String key, Predicate<Object> guard, String fieldName) {
        Map<?, ?> object = assertHasProperty(value, key, fieldName);
        Object property = object.get(key);
        check(guard.test(property), property, fieldName + "." + key, "valid property value");
        return property;
    }

    /**
     * condition이 true일 때만 guard를 검사합니다.
     */
    public static void assertIf(boolean condition, Object value, Predicate<Object> guard, String errorMessage) {
        if (condition && !guard.test(value)) {
            throw new TypeAssertionException(errorMessage, "value", value, "condition to be met");
        }
    }

    /**
     * 완전한 사용자인지 검사하고 좁혀진 값을 반환합니다.
     *
     * @param value 검사 대상
     * @param fieldName 필드 이름
     * @return 좁혀진 사용자
     */
    public static User assertIsUser(Object value, String fieldName) {
        ValidationResult<User> result = UserShape.validateUser(value);
        if (!result.valid()) {
            String messages = result.errors().stream()
                .map(FieldError::message)
                .collect(Collectors.joining(", "));
            throw new TypeAssertionException(fieldName, value, "User object. Errors: " + messages);
        }
        return result.data();
    }

    private static void check(boolean passed, Object value, String fieldName, String expected) {
        if (!passed) {
            throw new TypeAssertionException(fieldName, value, expected);
        }
    }
}
