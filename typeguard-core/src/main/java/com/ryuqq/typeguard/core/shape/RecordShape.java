package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.predicate.Predicates;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 필드 선언으로 조립되는 레코드 형태 검증기.
 *
 * <p>선언 순서대로 필드를 검사합니다. 필드가 없으면(키가 없거나 값이 null) 타입 검사 전에
 * 존재 여부를 먼저 판단하여 {@code "Missing or invalid <field> field"}를 보고하고,
 * 값이 있지만 형태가 틀리면 필드별 기대 메시지를 보고합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Shape&lt;Address&gt; shape = RecordShape.&lt;Address&gt;builder("Address")
 *     .required("street", Predicates::isNonEmptyString, "street must be a non-empty string")
 *     .required("city", Predicates::isNonEmptyString, "city must be a non-empty string")
 *     .build(values -&gt; new Address(values.string("street"), values.string("city"), ...));
 * </pre>
 *
 * <p>교차 필드 규칙({@link Builder#rule})은 모든 필드가 개별 검사를 통과한 뒤에만 평가됩니다.</p>
 *
 * @param <T> 좁혀진 타입
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class RecordShape<T> implements Shape<T> {

    static final String ROOT_FIELD = "root";
    static final String NOT_AN_OBJECT = "Value is not an object";

    private final String name;
    private final List<FieldRule> fields;
    private final List<CrossFieldRule> rules;
    private final Function<FieldValues, T> narrower;

    private RecordShape(Builder<T> builder, Function<FieldValues, T> narrower) {
        this.name = builder.name;
        this.fields = List.copyOf(builder.fields);
        this.rules = List.copyOf(builder.rules);
        this.narrower = narrower;
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean test(Object value) {
        return evaluate(value, true).valid();
    }

    @Override
    public ValidationResult<T> validate(Object value) {
        return evaluate(value, false);
    }

    /**
     * 선언된 필드 이름 목록 (선언 순서).
     *
     * @return 필드 이름
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        for (FieldRule field : fields) {
            names.add(field.name);
        }
        return names;
    }

    private ValidationResult<T> evaluate(Object value, boolean failFast) {
        if (!Predicates.isPlainObject(value)) {
            return ValidationResult.invalid(List.of(FieldError.of(ROOT_FIELD, NOT_AN_OBJECT, value)));
        }
        Map<?, ?> record = (Map<?, ?>) value;
        List<FieldError> errors = new ArrayList<>();
        Map<String, Object> narrowed = new LinkedHashMap<>();

        for (FieldRule field : fields) {
            FieldError error = field.check(record.get(field.name), narrowed);
            if (error != null) {
                errors.add(error);
                if (failFast) {
                    return ValidationResult.invalid(errors);
                }
            }
        }
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }

        FieldValues values = new FieldValues(name, narrowed);
        for (CrossFieldRule rule : rules) {
            if (!rule.condition.test(values)) {
                errors.add(FieldError.of(rule.field, rule.message, record.get(rule.field)));
                if (failFast) {
                    break;
                }
            }
        }
        if (!errors.isEmpty()) {
            return ValidationResult.invalid(errors);
        }
        return ValidationResult.valid(narrower.apply(values));
    }

    /**
     * RecordShape 빌더.
     *
     * @param <T> 좁혀진 타입
     */
    public static final class Builder<T> {

        private final String name;
        private final List<FieldRule> fields = new ArrayList<>();
        private final List<CrossFieldRule> rules = new ArrayList<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        /**
         * 다른 형태의 필드와 교차 필드 규칙을 선언 순서대로 물려받습니다.
         *
         * <p>이후 선언하는 필드가 물려받은 필드와 이름이 겹치면 거부됩니다.</p>
         *
         * @param base 물려받을 형태
         * @return this
         */
        public Builder<T> extend(RecordShape<?> base) {
            Objects.requireNonNull(base, "base cannot be null");
            for (FieldRule field : base.fields) {
                add(field);
            }
            rules.addAll(base.rules);
            return this;
        }

        public Builder<T> required(String field, Predicate<Object> predicate, String expectation) {
            return add(new FieldRule(field, true, Kind.SCALAR, predicate, null, expectation));
        }

        public Builder<T> optional(String field, Predicate<Object> predicate, String expectation) {
            return add(new FieldRule(field, false, Kind.SCALAR, predicate, null, expectation));
        }

        /**
         * 필수 배열 필드. 상세 모드에서는 실패한 원소마다 {@code field[index]} 하위 오류를 첨부합니다.
         */
        public Builder<T> requiredArray(String field, Predicate<Object> element, String expectation) {
            return add(new FieldRule(field, true, Kind.ARRAY, element, null, expectation));
        }

        public Builder<T> optionalArray(String field, Predicate<Object> element, String expectation) {
            return add(new FieldRule(field, false, Kind.ARRAY, element, null, expectation));
        }

        /**
         * 중첩 레코드 필드. 중첩 형태의 검증기를 재귀 호출합니다.
         */
        public Builder<T> requiredRecord(String field, Shape<?> shape, String expectation) {
            return add(new FieldRule(field, true, Kind.RECORD, null, shape, expectation));
        }

        public Builder<T> optionalRecord(String field, Shape<?> shape, String expectation) {
            return add(new FieldRule(field, false, Kind.RECORD, null, shape, expectation));
        }

        /**
         * 교차 필드 규칙. 위반 시 {@code field}에 대한 오류로 보고됩니다.
         */
        public Builder<T> rule(String field, Predicate<FieldValues> condition, String message) {
            Objects.requireNonNull(condition, "condition cannot be null");
            requireText(field, "field");
            requireText(message, "message");
            rules.add(new CrossFieldRule(field, condition, message));
            return this;
        }

        public RecordShape<T> build(Function<FieldValues, T> narrower) {
            Objects.requireNonNull(narrower, "narrower cannot be null");
            return new RecordShape<>(this, narrower);
        }

        private Builder<T> add(FieldRule rule) {
            for (FieldRule existing : fields) {
                if (existing.name.equals(rule.name)) {
                    throw new IllegalArgumentException("field already declared: " + rule.name);
                }
            }
            fields.add(rule);
            return this;
        }
    }

    private enum Kind {
        SCALAR,
        ARRAY,
        RECORD
    }

    private static final class FieldRule {

        private final String name;
        private final boolean required;
        private final Kind kind;
        private final Predicate<Object> predicate;
        private final Shape<?> shape;
        private final String expectation;

        FieldRule(String name, boolean required, Kind kind, Predicate<Object> predicate, Shape<?> shape,
                  String expectation) {
            requireText(name, "field");
            requireText(expectation, "expectation");
            if (kind == Kind.RECORD) {
                Objects.requireNonNull(shape, "shape cannot be null");
            } else {
                Objects.requireNonNull(predicate, "predicate cannot be null");
            }
            this.name = name;
            this.required = required;
            this.kind = kind;
            this.predicate = predicate;
            this.shape = shape;
            this.expectation = expectation;
        }

        /**
         * 값을 검사하고 통과하면 좁혀진 값을 기록합니다.
         *
         * @return 실패 시 FieldError, 통과 또는 선택 필드 부재 시 null
         */
        FieldError check(Object raw, Map<String, Object> narrowed) {
            if (raw == null) {
                return required
                    ? FieldError.of(name, "Missing or invalid " + name + " field", null)
                    : null;
            }
            switch (kind) {
                case SCALAR:
                    if (!predicate.test(raw)) {
                        return FieldError.of(name, expectation, raw);
                    }
                    narrowed.put(name, raw);
                    return null;
                case ARRAY:
                    return checkArray(raw, narrowed);
                case RECORD:
                    ValidationResult<?> nested = shape.validate(raw);
                    if (!nested.valid()) {
                        return new FieldError(name, expectation, raw, nested.errors());
                    }
                    narrowed.put(name, nested.data());
                    return null;
                default:
                    throw new IllegalStateException("Unhandled field kind: " + kind);
            }
        }

        private FieldError checkArray(Object raw, Map<String, Object> narrowed) {
            if (!Predicates.isArray(raw)) {
                return FieldError.of(name, expectation, raw);
            }
            List<FieldError> details = new ArrayList<>();
            List<?> items = (List<?>) raw;
            for (int i = 0; i < items.size(); i++) {
                Object item = items.get(i);
                if (!predicate.test(item)) {
                    details.add(FieldError.of(name + "[" + i + "]", "invalid array element", item));
                }
            }
            if (!details.isEmpty()) {
                return new FieldError(name, expectation, raw, details);
            }
            narrowed.put(name, raw);
            return null;
        }
    }

    private static final class CrossFieldRule {

        private final String field;
        private final Predicate<FieldValues> condition;
        private final String message;

        CrossFieldRule(String field, Predicate<FieldValues> condition, String message) {
            this.field = field;
            this.condition = condition;
            this.message = message;
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
