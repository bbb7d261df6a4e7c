package com.ryuqq.typeguard.core.predicate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 비정형(untyped) 값에 대한 구조 판별 함수 모음.
 *
 * <p>모든 함수는 임의의 {@code Object}(null 포함)를 받아 boolean을 반환합니다.
 * 예외를 던지지 않으며 입력을 변경하지 않습니다.</p>
 *
 * <p><strong>값 모델:</strong></p>
 * <ul>
 *   <li>객체(레코드): String 키를 가진 {@link Map}</li>
 *   <li>배열: {@link List}</li>
 *   <li>숫자: {@link Number} (NaN, Infinity 제외)</li>
 *   <li>날짜: {@link Instant} 또는 {@link Date}</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class Predicates {

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[\\d\\s\\-()]+$");
    private static final int MIN_PHONE_DIGITS = 10;

    private Predicates() {
    }

    // ============================================================
    // 문자열
    // ============================================================

    public static boolean isString(Object value) {
        return value instanceof String;
    }

    /**
     * 공백을 제외하고 한 글자 이상인 문자열인지 확인.
     *
     * @param value 검사 대상
     * @return 빈 문자열, 공백 문자열이면 false
     */
    public static boolean isNonEmptyString(Object value) {
        return isString(value) && !((String) value).trim().isEmpty();
    }

    /**
     * 유한한 숫자로 해석 가능한 문자열인지 확인.
     *
     * @param value 검사 대상
     * @return "42", "-1.5" 등은 true, "", "abc", "NaN"은 false
     */
    public static boolean isNumericString(Object value) {
        if (!isNonEmptyString(value)) {
            return false;
        }
        try {
            new BigDecimal(((String) value).trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static boolean isEmail(Object value) {
        return isString(value) && EMAIL.matcher((String) value).matches();
    }

    /**
     * 전화번호 형식 확인.
     *
     * <p>숫자, 공백, 하이픈, 괄호와 선행 '+'만 허용하며 숫자가 10개 이상이어야 합니다.</p>
     *
     * @param value 검사 대상
     * @return 정책을 만족하면 true
     */
    public static boolean isPhoneNumber(Object value) {
        if (!isString(value)) {
            return false;
        }
        String phone = (String) value;
        if (!PHONE.matcher(phone).matches()) {
            return false;
        }
        long digits = phone.chars().filter(Character::isDigit).count();
        return digits >= MIN_PHONE_DIGITS;
    }

    // ============================================================
    // 숫자
    // ============================================================

    /**
     * 유한한 숫자인지 확인.
     *
     * <p>정수 타입과 {@link BigDecimal}은 항상 유한합니다. 그 외 Number는
     * {@code doubleValue()}가 NaN이나 무한대이면 숫자로 인정하지 않습니다.</p>
     *
     * @param value 검사 대상
     * @return 유한한 Number이면 true
     */
    public static boolean isNumber(Object value) {
        if (!(value instanceof Number)) {
            return false;
        }
        if (isIntegralType(value) || value instanceof BigDecimal) {
            return true;
        }
        return Double.isFinite(((Number) value).doubleValue());
    }

    public static boolean isPositiveNumber(Object value) {
        return isNumber(value) && signum((Number) value) > 0;
    }

    /**
     * 정수 값인지 확인.
     *
     * <p>소수부가 0인 실수(예: 30.0)도 정수로 인정합니다.</p>
     *
     * @param value 검사 대상
     * @return 정수 값이면 true
     */
    public static boolean isInteger(Object value) {
        if (!isNumber(value)) {
            return false;
        }
        if (isIntegralType(value)) {
            return true;
        }
        if (value instanceof BigDecimal) {
            BigDecimal decimal = (BigDecimal) value;
            return decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0;
        }
        double d = ((Number) value).doubleValue();
        return d == Math.rint(d);
    }

    public static boolean isPositiveInteger(Object value) {
        return isInteger(value) && isPositiveNumber(value);
    }

    /**
     * 32비트 int 범위에 들어가는 정수인지 확인.
     *
     * @param value 검사 대상
     * @return int로 손실 없이 변환 가능하면 true
     */
    public static boolean isIntValue(Object value) {
        if (!isInteger(value)) {
            return false;
        }
        BigDecimal decimal = toBigDecimal((Number) value);
        return decimal.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) >= 0
            && decimal.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) <= 0;
    }

    // ============================================================
    // 기타 원시 타입
    // ============================================================

    public static boolean isBoolean(Object value) {
        return value instanceof Boolean;
    }

    public static boolean isNull(Object value) {
        return value == null;
    }

    // ============================================================
    // 배열
    // ============================================================

    public static boolean isArray(Object value) {
        return value instanceof List;
    }

    public static boolean isNonEmptyArray(Object value) {
        return isArray(value) && !((List<?>) value).isEmpty();
    }

    public static boolean isArrayOfLength(Object value, int length) {
        return isArray(value) && ((List<?>) value).size() == length;
    }

    /**
     * 모든 원소가 조건을 만족하는 배열인지 확인.
     *
     * <p>첫 실패에서 멈추지 않고 모든 원소를 검사합니다.
     * 실패한 인덱스가 필요하면 {@code Shape}의 상세 검증을 사용하세요.</p>
     *
     * @param value 검사 대상
     * @param element 원소 조건
     * @return 배열이고 모든 원소가 조건을 만족하면 true
     */
    public static boolean isArrayOf(Object value, Predicate<Object> element) {
        Objects.requireNonNull(element, "element predicate cannot be null");
        if (!isArray(value)) {
            return false;
        }
        boolean allMatch = true;
        for (Object item : (List<?>) value) {
            allMatch &= element.test(item);
        }
        return allMatch;
    }

    // ============================================================
    // 객체
    // ============================================================

    public static boolean isObject(Object value) {
        return value instanceof Map;
    }

    /**
     * 모든 키가 String인 Map인지 확인.
     *
     * @param value 검사 대상
     * @return plain object이면 true
     */
    public static boolean isPlainObject(Object value) {
        if (!isObject(value)) {
            return false;
        }
        for (Object key : ((Map<?, ?>) value).keySet()) {
            if (!(key instanceof String)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isEmptyObject(Object value) {
        return isPlainObject(value) && ((Map<?, ?>) value).isEmpty();
    }

    // ============================================================
    // 날짜
    // ============================================================

    public static boolean isDate(Object value) {
        return value instanceof Instant || value instanceof Date;
    }

    /**
     * ISO-8601 날짜 문자열인지 확인.
     *
     * @param value 검사 대상
     * @return {@code 2024-01-01T00:00:00Z} 형식이면 true
     */
    public static boolean isValidDateString(Object value) {
        if (!isNonEmptyString(value)) {
            return false;
        }
        try {
            OffsetDateTime.parse((String) value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * 허용 목록 중 하나와 같은지 확인.
     *
     * @param value 검사 대상
     * @param allowed 허용 값
     * @return 허용 값과 equals이면 true
     */
    public static boolean isOneOf(Object value, Object... allowed) {
        for (Object candidate : allowed) {
            if (Objects.equals(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    // ============================================================
    // 조합
    // ============================================================

    public static Predicate<Object> and(Predicate<Object> first, Predicate<Object> second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        return value -> first.test(value) && second.test(value);
    }

    public static Predicate<Object> or(Predicate<Object> first, Predicate<Object> second) {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        return value -> first.test(value) || second.test(value);
    }

    public static Predicate<Object> not(Predicate<Object> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return value -> !predicate.test(value);
    }

    /**
     * null을 허용하는 조건으로 감쌉니다.
     *
     * @param predicate 값이 있을 때 적용할 조건
     * @return null이거나 조건을 만족하면 true
     */
    public static Predicate<Object> optional(Predicate<Object> predicate) {
        Objects.requireNonNull(predicate, "predicate cannot be null");
        return value -> value == null || predicate.test(value);
    }

    static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        }
        if (isIntegralType(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        return BigDecimal.valueOf(number.doubleValue());
    }

    private static boolean isIntegralType(Object value) {
        return value instanceof Integer
            || value instanceof Long
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger
            || value instanceof AtomicInteger
            || value instanceof AtomicLong;
    }

    private static int signum(Number number) {
        return toBigDecimal(number).signum();
    }
}
