package com.ryuqq.typeguard.core.assertion;

/**
 * 신뢰 경계에서 단언(assertion)이 실패했음을 나타냅니다.
 *
 * <p>예상 가능한 실패가 아니라 호출 측 결함이므로 복구하지 않고 최상위 경계까지 전파합니다.</p>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public class TypeAssertionException extends RuntimeException {

    private final String fieldName;
    private final transient Object receivedValue;
    private final String expectedDescription;

    public TypeAssertionException(String fieldName, Object receivedValue, String expectedDescription) {
        this("Validation failed for field '" + fieldName + "': expected " + expectedDescription,
            fieldName, receivedValue, expectedDescription);
    }

    public TypeAssertionException(String message, String fieldName, Object receivedValue, String expectedDescription) {
        super(message);
        this.fieldName = fieldName;
        this.receivedValue = receivedValue;
        this.expectedDescription = expectedDescription;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Object getReceivedValue() {
        return receivedValue;
    }

    public String getExpectedDescription() {
        return expectedDescription;
    }
}
