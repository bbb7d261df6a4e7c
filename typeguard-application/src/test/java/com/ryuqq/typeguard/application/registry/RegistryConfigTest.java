package com.ryuqq.typeguard.application.registry;

import com.ryuqq.typeguard.core.event.CreationSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * RegistryConfig 테스트.
 *
 * @author TypeGuard Team
 * @since 1.0.0
 */
class RegistryConfigTest {

    @Test
    void defaultConstructor_UsesDocumentedDefaults() {
        // When
        RegistryConfig config = new RegistryConfig();

        // Then
        assertEquals(100, config.eventCapacity());
        assertEquals(10, config.defaultPageSize());
        assertEquals(100, config.maxPageSize());
        assertEquals("api", config.actor());
        assertEquals(CreationSource.ADMIN, config.creationSource());
        assertEquals("API request", config.deleteReason());
    }

    @Test
    void withMethods_ChangeOnlyOneField() {
        // Given
        RegistryConfig config = new RegistryConfig();

        // When
        RegistryConfig changed = config.withActor("admin-console").withEventCapacity(5).withDeleteReason(null);

        // Then
        assertEquals("admin-console", changed.actor());
        assertEquals(5, changed.eventCapacity());
        assertNull(changed.deleteReason());
        assertEquals(config.defaultPageSize(), changed.defaultPageSize());
        assertEquals("api", config.actor());
    }

    @Test
    void constructor_DefaultPageSizeAboveMax_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RegistryConfig().withDefaultPageSize(101)
        );
        assertTrue(exception.getMessage().contains("defaultPageSize must be between 1 and 100"));
    }

    @Test
    void constructor_InvalidValues_ThrowException() {
        RegistryConfig config = new RegistryConfig();

        assertThrows(IllegalArgumentException.class, () -> config.withEventCapacity(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxPageSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.withActor(" "));
        assertThrows(IllegalArgumentException.class, () -> config.withCreationSource(null));
    }

    @Test
    void constructor_MaxPageSizeAboveCeiling_ThrowsException() {
        // Given
        RegistryConfig config = new RegistryConfig();

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> config.withMaxPageSize(101)
        );
        assertTrue(exception.getMessage().contains("maxPageSize must be between 1 and 100 (current: 101)"));
        assertEquals(100, config.withMaxPageSize(RegistryConfig.PAGE_SIZE_CEILING).maxPageSize());
    }
}
