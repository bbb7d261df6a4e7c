package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.User;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * UserShape 테스트.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class UserShapeTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private static Map<String, Object> validDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", "user_1");
        document.put("name", "Ann");
        document.put("contact", Map.of("email", "a@b.com"));
        document.put("age", 30);
        document.put("isActive", true);
        document.put("tags", List.of("x"));
        document.put("createdAt", CREATED);
        document.put("updatedAt", CREATED);
        return document;
    }

    @Test
    void validateUser_ValidDocument_NarrowsToUser() {
        // When
        ValidationResult<User> result = UserShape.validateUser(validDocument());

        // Then
        assertTrue(result.valid());
        User user = result.data();
        assertEquals("user_1", user.id());
        assertEquals("a@b.com", user.contact().email());
        assertNull(user.contact().phone());
        assertNull(user.metadata());
        assertEquals(CREATED, user.createdAt());
    }

    @Test
    void validateUser_LegacyDate_IsAccepted() {
        // Given
        Map<String, Object> document = validDocument();
        document.put("updatedAt", Date.from(CREATED.plusSeconds(5)));

        // When
        ValidationResult<User> result = UserShape.validateUser(document);

        // Then
        assertTrue(result.valid());
        assertEquals(CREATED.plusSeconds(5), result.data().updatedAt());
    }

    @Test
    void validateUser_NullRequiredField_ReportsMissing() {
        // Given
        Map<String, Object> document = validDocument();
        document.put("name", null);

        // When
        ValidationResult<User> result = UserShape.validateUser(document);

        // Then
        assertFalse(result.valid());
        assertEquals(1, result.errors().size());
        assertEquals("Missing or invalid name field", result.errors().get(0).message());
    }

    @Test
    void validateUser_AgeOutOfIntRange_IsRejected() {
        Map<String, Object> document = validDocument();
        document.put("age", 3_000_000_000L);

        ValidationResult<User> result = UserShape.validateUser(document);

        assertEquals("age must be a positive integer", result.errors().get(0).message());
    }

    @Test
    void validateUser_UpdatedBeforeCreated_ReportsUpdatedAt() {
        Map<String, Object> document = validDocument();
        document.put("updatedAt", CREATED.minusSeconds(1));

        ValidationResult<User> result = UserShape.validateUser(document);

        assertFalse(result.valid());
        assertEquals("updatedAt", result.errors().get(0).field());
    }

    @Test
    void validateUser_InvalidNestedAddress_CarriesNestedDetails() {
        // Given
        Map<String, Object> document = validDocument();
        document.put("contact", Map.of(
            "email", "a@b.com",
            "address", Map.of("street", "1 Main St", "city", "Springfield")
        ));

        // When
        FieldError error = UserShape.validateUser(document).errors().get(0);

        // Then
        assertEquals("contact", error.field());
        FieldError address = error.details().get(0);
        assertEquals("address", address.field());
        assertEquals(3, address.details().size());
        assertEquals("state", address.details().get(0).field());
    }

    @Test
    void isUser_FailsFastOnFirstError() {
        Map<String, Object> document = validDocument();
        document.remove("id");

        assertFalse(UserShape.isUser(document));
        assertTrue(UserShape.isUser(validDocument()));
        assertFalse(UserShape.isUser("user_1"));
    }

    @Test
    void toDocument_RoundTripsThroughShape() {
        // Given
        User user = UserShape.validateUser(validDocument()).data();

        // When
        Map<String, Object> document = UserDocuments.toDocument(user);

        // Then
        assertEquals(validDocument(), document);
        assertEquals(user, UserShape.validateUser(document).data());
    }
}
