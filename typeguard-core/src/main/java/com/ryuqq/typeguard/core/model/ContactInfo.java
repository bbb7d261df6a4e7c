package com.ryuqq.typeguard.core.model;

/**
 * 연락처 정보.
 *
 * @param email 이메일 (필수)
 * @param phone 전화번호 (선택, null 가능)
 * @param address 주소 (선택, null 가능)
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record ContactInfo(
    String email,
    String phone,
    Address address
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException email이 null이거나 빈 문자열인 경우
     */
    public ContactInfo {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        // phone, address는 null 허용
    }

    public static ContactInfo of(String email) {
        return new ContactInfo(email, null, null);
    }
}
