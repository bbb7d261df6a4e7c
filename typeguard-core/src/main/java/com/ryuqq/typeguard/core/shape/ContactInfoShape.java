package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.Address;
import com.ryuqq.typeguard.core.model.ContactInfo;
import com.ryuqq.typeguard.core.predicate.Predicates;

/**
 * {@link ContactInfo} 형태.
 *
 * <ul>
 *   <li>email: 필수, 이메일 형식</li>
 *   <li>phone: 선택, 숫자 10개 이상의 전화번호 형식</li>
 *   <li>address: 선택, {@link AddressShape}</li>
 * </ul>
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public final class ContactInfoShape {

    public static final Shape<ContactInfo> INSTANCE = RecordShape.<ContactInfo>builder("ContactInfo")
        .required("email", Predicates::isEmail, "email must be a valid email address")
        .optional("phone", Predicates::isPhoneNumber, "phone must contain at least 10 digits")
        .optionalRecord("address", AddressShape.INSTANCE, "address must be a complete address")
        .build(values -> new ContactInfo(
            values.string("email"),
            values.string("phone"),
            values.get("address", Address.class)
        ));

    private ContactInfoShape() {
    }

    public static boolean isContactInfo(Object value) {
        return INSTANCE.test(value);
    }
}
