package com.ryuqq.typeguard.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 비정형 문서(Map/List 트리) 복사 유틸리티.
 *
 * <p>저장소와 호출자 사이에서 값을 주고받을 때 사용하여
 * 어느 쪽의 변경도 다른 쪽에 전파되지 않도록 합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class Documents {

    private Documents() {
    }

    /**
     * 변경 불가능한 깊은 복사본을 만듭니다.
     *
     * <p>Map, List는 재귀적으로 복사되고 {@link Date}는 {@link Instant}로 바뀝니다.
     * {@link AtomicInteger} 같은 가변 숫자는 현재 값의 불변 박싱 타입으로 고정됩니다.
     * 삽입 순서와 null 값은 유지됩니다.</p>
     *
     * @param document 원본 문서
     * @return 변경 불가능한 복사본
     */
    public static Map<String, Object> freeze(Map<?, ?> document) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freezeValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    static Object freezeValue(Object value) {
        if (value instanceof Map) {
            return freeze((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(freezeValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Number) {
            return freezeNumber((Number) value);
        }
        return value;
    }

    private static Number freezeNumber(Number number) {
        if (number instanceof Integer
            || number instanceof Long
            || number instanceof Double
            || number instanceof Float
            || number instanceof Short
            || number instanceof Byte) {
            return number;
        }
        // BigDecimal, BigInteger는 서브클래스가 가변일 수 있음
        if (number instanceof BigDecimal) {
            return number.getClass() == BigDecimal.class ? number : new BigDecimal(number.toString());
        }
        if (number instanceof BigInteger) {
            return number.getClass() == BigInteger.class ? number : new BigInteger(number.toString());
        }
        if (number instanceof AtomicInteger) {
            return number.intValue();
        }
        double asDouble = number.doubleValue();
        long asLong = number.longValue();
        if (!Double.isNaN(asDouble) && !Double.isInfinite(asDouble) && asDouble == (double) asLong) {
            return asLong;
        }
        return asDouble;
    }
}
