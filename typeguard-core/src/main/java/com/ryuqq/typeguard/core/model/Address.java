package com.ryuqq.typeguard.core.model;

/**
 * 주소.
 *
 * <p>모든 필드는 필수이며 검증을 통과한 값으로만 생성됩니다 ({@code AddressShape}).</p>
 *
 * @param street 도로명
 * @param city 도시
 * @param state 주/도
 * @param zipCode 우편번호
 * @param country 국가
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
public record Address(
    String street,
    String city,
    String state,
    String zipCode,
    String country
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public Address {
        requireText(street, "street");
        requireText(city, "city");
        requireText(state, "state");
        requireText(zipCode, "zipCode");
        requireText(country, "country");
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
