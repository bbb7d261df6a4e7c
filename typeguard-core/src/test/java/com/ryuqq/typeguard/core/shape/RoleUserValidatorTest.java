package com.ryuqq.typeguard.core.shape;

import com.ryuqq.typeguard.core.model.AdminUser;
import com.ryuqq.typeguard.core.model.RegularUser;
import com.ryuqq.typeguard.core.model.RoleUser;
import com.ryuqq.typeguard.core.model.Subscription;
import com.ryuqq.typeguard.core.model.UserRole;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdminUserShape, RegularUserShape, RoleUserValidator 테스트.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class RoleUserValidatorTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");

    private static Map<String, Object> userDocument(String role) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", "user_1");
        document.put("name", "Ann");
        document.put("contact", Map.of("email", "a@b.com"));
        document.put("age", 30);
        document.put("isActive", true);
        document.put("tags", List.of("x"));
        document.put("createdAt", CREATED);
        document.put("updatedAt", CREATED);
        document.put("role", role);
        return document;
    }

    private static Map<String, Object> adminDocument() {
        Map<String, Object> document = userDocument("admin");
        document.put("permissions", new ArrayList<>(List.of("users:read", "users:write")));
        return document;
    }

    private static List<String> fields(ValidationResult<?> result) {
        return result.errors().stream().map(FieldError::field).collect(Collectors.toList());
    }

    // ============================================================
    // 1. AdminUserShape
    // ============================================================

    @Test
    void validateAdminUser_ValidDocument_NarrowsToAdmin() {
        // Given
        Map<String, Object> document = adminDocument();
        document.put("lastLogin", Date.from(CREATED.plusSeconds(60)));

        // When
        ValidationResult<AdminUser> result = AdminUserShape.validateAdminUser(document);

        // Then
        assertTrue(result.valid());
        AdminUser admin = result.data();
        assertEquals("user_1", admin.user().id());
        assertEquals(List.of("users:read", "users:write"), admin.permissions());
        assertTrue(admin.hasPermission("users:write"));
        assertEquals(CREATED.plusSeconds(60), admin.lastLogin());
        assertEquals(UserRole.ADMIN, admin.role());
    }

    @Test
    void validateAdminUser_MissingPermissionsAndBadElement_ReportsBoth() {
        // Given
        Map<String, Object> missing = adminDocument();
        missing.remove("permissions");
        Map<String, Object> badElement = adminDocument();
        badElement.put("permissions", List.of("users:read", 7));

        // When
        ValidationResult<AdminUser> missingResult = AdminUserShape.validateAdminUser(missing);
        ValidationResult<AdminUser> badResult = AdminUserShape.validateAdminUser(badElement);

        // Then
        assertEquals("Missing or invalid permissions field", missingResult.errors().get(0).message());
        FieldError error = badResult.errors().get(0);
        assertEquals("permissions", error.field());
        assertEquals("permissions[1]", error.details().get(0).field());
    }

    @Test
    void validateAdminUser_InheritsUserFieldsAndRules() {
        // Given
        Map<String, Object> document = adminDocument();
        document.put("age", -1);
        document.put("updatedAt", CREATED.minusSeconds(1));

        // When
        ValidationResult<AdminUser> ageResult = AdminUserShape.validateAdminUser(document);
        document.put("age", 30);
        ValidationResult<AdminUser> ruleResult = AdminUserShape.validateAdminUser(document);

        // Then
        assertEquals(List.of("age"), fields(ageResult));
        assertEquals("updatedAt must not precede createdAt", ruleResult.errors().get(0).message());
    }

    @Test
    void isAdminUser_RegularRole_ReturnsFalse() {
        assertTrue(AdminUserShape.isAdminUser(adminDocument()));
        assertFalse(AdminUserShape.isAdminUser(userDocument("user")));
    }

    // ============================================================
    // 2. RegularUserShape
    // ============================================================

    @Test
    void validateRegularUser_SubscriptionIsOptional() {
        // Given
        Map<String, Object> premium = userDocument("user");
        premium.put("subscription", "premium");

        // When
        RegularUser withSubscription = RegularUserShape.validateRegularUser(premium).data();
        RegularUser withoutSubscription = RegularUserShape.validateRegularUser(userDocument("user")).data();

        // Then
        assertEquals(Subscription.PREMIUM, withSubscription.subscription());
        assertNull(withoutSubscription.subscription());
        assertEquals(UserRole.USER, withoutSubscription.role());
    }

    @Test
    void validateRegularUser_UnknownSubscription_IsRejected() {
        // Given
        Map<String, Object> document = userDocument("user");
        document.put("subscription", "gold");

        // When
        ValidationResult<RegularUser> result = RegularUserShape.validateRegularUser(document);

        // Then
        assertFalse(result.valid());
        assertEquals("subscription must be one of basic, premium, enterprise", result.errors().get(0).message());
        assertEquals("gold", result.errors().get(0).offendingValue());
    }

    // ============================================================
    // 3. RoleUserValidator
    // ============================================================

    @Test
    void validate_DispatchesOnRole() {
        // When
        RoleUser admin = RoleUserValidator.validate(adminDocument()).data();
        RoleUser regular = RoleUserValidator.validate(userDocument("user")).data();

        // Then
        assertInstanceOf(AdminUser.class, admin);
        assertInstanceOf(RegularUser.class, regular);
        assertEquals(admin.user(), regular.user());
    }

    @Test
    void validate_MissingOrUnknownRole_ReportsRoleOnly() {
        // Given
        Map<String, Object> missing = userDocument("user");
        missing.remove("role");
        missing.remove("name");

        // When
        ValidationResult<RoleUser> missingResult = RoleUserValidator.validate(missing);
        ValidationResult<RoleUser> unknownResult = RoleUserValidator.validate(userDocument("guest"));
        ValidationResult<RoleUser> nullRole = RoleUserValidator.validate(userDocument(null));
        Map<String, Object> numericRole = userDocument("user");
        numericRole.put("role", 1);
        ValidationResult<RoleUser> wrongType = RoleUserValidator.validate(numericRole);

        // Then
        assertEquals(List.of("role"), fields(missingResult));
        assertEquals("Missing or invalid role field", missingResult.errors().get(0).message());
        assertEquals("Unknown user role: guest", unknownResult.errors().get(0).message());
        assertEquals("Missing or invalid role field", nullRole.errors().get(0).message());
        assertEquals("role must be a string", wrongType.errors().get(0).message());
    }

    @Test
    void validate_RoleSpecificFailure_KeepsFieldErrors() {
        // Given
        Map<String, Object> document = adminDocument();
        document.remove("permissions");
        document.put("name", "");

        // When
        ValidationResult<RoleUser> result = RoleUserValidator.validate(document);

        // Then
        assertFalse(result.valid());
        assertEquals(List.of("name", "permissions"), fields(result));
        assertFalse(RoleUserValidator.isRoleUser(document));
    }

    @Test
    void validate_NonObject_ReportsRoot() {
        ValidationResult<RoleUser> result = RoleUserValidator.validate(List.of("admin"));

        assertEquals("root", result.errors().get(0).field());
        assertEquals("Value is not an object", result.errors().get(0).message());
    }

    @Test
    void toDocument_RoleUser_RevalidatesToSameValue() {
        // Given
        Map<String, Object> adminSource = adminDocument();
        adminSource.put("lastLogin", CREATED);
        Map<String, Object> regularSource = userDocument("user");
        regularSource.put("subscription", "enterprise");
        RoleUser admin = RoleUserValidator.validate(adminSource).data();
        RoleUser regular = RoleUserValidator.validate(regularSource).data();

        // When
        Map<String, Object> adminDocument = UserDocuments.toDocument(admin);
        Map<String, Object> regularDocument = UserDocuments.toDocument(regular);

        // Then
        assertEquals("admin", adminDocument.get("role"));
        assertEquals("enterprise", regularDocument.get("subscription"));
        assertEquals(admin, RoleUserValidator.validate(adminDocument).data());
        assertEquals(regular, RoleUserValidator.validate(regularDocument).data());
    }
}
