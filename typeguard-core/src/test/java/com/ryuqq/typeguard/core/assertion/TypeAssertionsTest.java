package com.ryuqq.typeguard.core.assertion;

import com.ryuqq.typeguard.core.model.User;
import com.ryuqq.typeguard.core.predicate.Predicates;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TypeAssertions 테스트.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class TypeAssertionsTest {

    @Test
    void assertIsNonEmptyString_Valid_ReturnsNarrowedValue() {
        assertEquals("Ann", TypeAssertions.assertIsNonEmptyString("Ann", "name"));
        assertEquals(Integer.valueOf(5), TypeAssertions.assertIsPositiveNumber(5, "age"));
    }

    @Test
    void assertIsString_Invalid_ThrowsWithFieldAndExpectation() {
        // When
        TypeAssertionException exception = assertThrows(
            TypeAssertionException.class,
            () -> TypeAssertions.assertIsString(42, "name")
        );

        // Then
        assertEquals("name", exception.getFieldName());
        assertEquals(42, exception.getReceivedValue());
        assertEquals("string", exception.getExpectedDescription());
        assertEquals("Validation failed for field 'name': expected string", exception.getMessage());
    }

    @Test
    void assertDefined_Null_Throws() {
        TypeAssertionException exception = assertThrows(
            TypeAssertionException.class,
            () -> TypeAssertions.assertDefined(null, "contact")
        );
        assertEquals("contact is required but was null", exception.getMessage());
    }

    @Test
    void assertIsArrayOf_ReportsFirstFailingIndex() {
        TypeAssertionException exception = assertThrows(
            TypeAssertionException.class,
            () -> TypeAssertions.assertIsArrayOf(List.of("a", "", "b"), Predicates::isNonEmptyString, "tags")
        );
        assertEquals("tags[1]", exception.getFieldName());
    }

    @Test
    void assertHasTypedProperty_ReportsDottedPath() {
        Map<String, Object> contact = Map.of("email", "nope");

        assertEquals("nope", TypeAssertions.assertHasProperty(contact, "email", "contact").get("email"));
        TypeAssertionException exception = assertThrows(
            TypeAssertionException.class,
            () -> TypeAssertions.assertHasTypedProperty(contact, "email", Predicates::isEmail, "contact")
        );
        assertEquals("contact.email", exception.getFieldName());
        assertThrows(TypeAssertionException.class,
            () -> TypeAssertions.assertHasProperty(contact, "phone", "contact"));
    }

    @Test
    void assertIf_OnlyChecksWhenConditionHolds() {
        assertDoesNotThrow(() -> TypeAssertions.assertIf(false, "x", Predicates::isNumber, "must be a number"));
        TypeAssertionException exception = assertThrows(
            TypeAssertionException.class,
            () -> TypeAssertions.assertIf(true, "x", Predicates::isNumber, "must be a number")
        );
        assertEquals("must be a number", exception.getMessage());
    }

    @Test
    void assertIsUser_InvalidDocument_ListsErrors() {
        // Given
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        Map<String, Object> document = Map.of(
            "id", "user_1", "name", "Ann", "contact", Map.of("email", "a@b.com"), "age", 0,
            "isActive", true, "tags", List.of("x"), "createdAt", now, "updatedAt", now);

        // When
        TypeAssertionException exception = assertThrows(
            TypeAssertionException.class,
            () -> TypeAssertions.assertIsUser(document, "user")
        );

        // Then
        assertEquals("user", exception.getFieldName());
        assertTrue(exception.getExpectedDescription().contains("age must be a positive integer"));
    }

    @Test
    void assertIsUser_ValidDocument_ReturnsUser() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        Map<String, Object> document = Map.of(
            "id", "user_1", "name", "Ann", "contact", Map.of("email", "a@b.com"), "age", 30,
            "isActive", true, "tags", List.of("x"), "createdAt", now, "updatedAt", now);

        User user = TypeAssertions.assertIsUser(document, "user");

        assertEquals("user_1", user.id());
    }
}
