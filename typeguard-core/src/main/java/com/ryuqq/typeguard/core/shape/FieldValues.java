package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.Documents;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * 검증을 통과한 필드 값 접근자.
 *
 * <p>{@link RecordShape}가 좁히기(narrowing) 함수에 넘겨주는 값입니다.
 * 선택 필드가 없으면 접근자는 null을 반환합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class FieldValues {

    private final String shapeName;
    private final Map<String, Object> values;

    FieldValues(String shapeName, Map<String, Object> values) {
        this.shapeName = shapeName;
        this.values = values;
    }

    public boolean has(String field) {
        return values.get(field) != null;
    }

    public String string(String field) {
        return (String) values.get(field);
    }

    public int intValue(String field) {
        return number(field).intValue();
    }

    public Number number(String field) {
        return (Number) values.get(field);
    }

    public boolean bool(String field) {
        return (Boolean) values.get(field);
    }

    /**
     * 날짜 필드를 {@link Instant}로 반환합니다.
     *
     * @param field 필드 이름
     * @return Instant (없으면 null)
     */
    public Instant instant(String field) {
        Object value = values.get(field);
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        return (Instant) value;
    }

    public List<String> strings(String field) {
        Object value = values.get(field);
        if (value == null) {
            return null;
        }
        List<String> copy = new ArrayList<>();
        for (Object item : (List<?>) value) {
            copy.add((String) item);
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * plain object 필드를 변경 불가능한 깊은 복사본으로 반환합니다.
     *
     * @param field 필드 이름
     * @return 복사본 (없으면 null)
     */
    public Map<String, Object> object(String field) {
        Object value = values.get(field);
        return value == null ? null : Documents.freeze((Map<?, ?>) value);
    }

    /**
     * 중첩 레코드 필드의 좁혀진 값을 반환합니다.
     *
     * @param field 필드 이름
     * @param type 기대 타입
     * @param <V> 기대 타입
     * @return 좁혀진 값 (없으면 null)
     */
    public <V> V get(String field, Class<V> type) {
        Object value = values.get(field);
        if (value == null) {
            return null;
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException(
                shapeName + "." + field + " is " + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "FieldValues{" + shapeName + ", fields=" + values.keySet() + '}';
    }
}
