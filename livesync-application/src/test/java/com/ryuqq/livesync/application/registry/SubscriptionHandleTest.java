package com.ryuqq.livesync.application.registry;

import com.ryuqq.livesync.core.model.SubscriptionKey;
import com.ryuqq.livesync.core.model.SubscriptionKind;
import com.ryuqq.livesync.core.model.SubscriptionPriority;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubscriptionHandle 테스트.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
class SubscriptionHandleTest {

    private static final SubscriptionKey KEY = SubscriptionKey.of("projects?~memberIds=s:u1");

    @Test
    void created_IsNeitherReusedNorRejected() {
        // When
        SubscriptionHandle handle = SubscriptionHandle.created(KEY, SubscriptionKind.PROJECT, SubscriptionPriority.HIGH);

        // Then
        assertEquals(KEY, handle.getKey());
        assertEquals(SubscriptionHandle.Status.CREATED, handle.getStatus());
        assertFalse(handle.isReused());
        assertFalse(handle.isRejected());
    }

    @Test
    void reused_IsReused() {
        SubscriptionHandle handle = SubscriptionHandle.reused(KEY, SubscriptionKind.PROJECT, SubscriptionPriority.HIGH);

        assertTrue(handle.isReused());
    }

    @Test
    void rejected_IsRejected() {
        SubscriptionHandle handle = SubscriptionHandle.rejected(KEY, SubscriptionKind.TASK, SubscriptionPriority.LOW);

        assertTrue(handle.isRejected());
        assertTrue(handle.toString().contains("REJECTED"));
    }

    @Test
    void created_NullKey_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> SubscriptionHandle.created(null, SubscriptionKind.TASK, SubscriptionPriority.LOW)
        );
        assertTrue(exception.getMessage().contains("key cannot be null"));
    }
}
