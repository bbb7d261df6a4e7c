package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.Address;
import com.ryuqq.typeguard.core.predicate.Predicates;

/**
 * {@link Address} 형태. 모든 필드가 비어 있지 않은 문자열이어야 합니다.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class AddressShape {

    public static final Shape<Address> INSTANCE = RecordShape.<Address>builder("Address")
        .required("street", Predicates::isNonEmptyString, "street must be a non-empty string")
        .required("city", Predicates::isNonEmptyString, "city must be a non-empty string")
        .required("state", Predicates::isNonEmptyString, "state must be a non-empty string")
        .required("zipCode", Predicates::isNonEmptyString, "zipCode must be a non-empty string")
        .required("country", Predicates::isNonEmptyString, "country must be a non-empty string")
        .build(values -> new Address(
            values.string("street"),
            values.string("city"),
            values.string("state"),
            values.string("zipCode"),
            values.string("country")
        ));

    private AddressShape() {
    }

    public static boolean isAddress(Object value) {
        return INSTANCE.test(value);
    }
}
