package com.ryuqq.livesync.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EntityId Value Object 테스트.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
class EntityIdTest {

    @Test
    void of_ValidValue_CreatesEntityId() {
        // Given
        String value = "task-8f3a";

        // When
        EntityId id = EntityId.of(value);

        // Then
        assertEquals(value, id.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityId.of("  "));
    }

    @Test
    void of_ValueWithSlash_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityId.of("projects/p1")
        );
        assertTrue(exception.getMessage().contains("'/'"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(1501);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> EntityId.of(value));
    }

    @Test
    void compareTo_OrdersByStringValue() {
        // Given
        EntityId a = EntityId.of("a");
        EntityId b = EntityId.of("b");

        // When & Then
        assertTrue(a.compareTo(b) < 0);
        assertTrue(b.compareTo(a) > 0);
        assertEquals(0, a.compareTo(EntityId.of("a")));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        EntityId id1 = EntityId.of("task-1");
        EntityId id2 = EntityId.of("task-1");

        assertEquals(id1, id2);
        assertEquals(id1.hashCode(), id2.hashCode());
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("EntityId{task-1}", EntityId.of("task-1").toString());
    }
}
