package com.ryuqq.livesync.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubscriptionKind 기본 우선순위 테이블 테스트.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
class SubscriptionKindTest {

    @Test
    void defaultPriority_MatchesTable() {
        assertEquals(SubscriptionPriority.HIGH, SubscriptionKind.PROJECT.defaultPriority());
        assertEquals(SubscriptionPriority.MEDIUM, SubscriptionKind.PHASE.defaultPriority());
        assertEquals(SubscriptionPriority.MEDIUM, SubscriptionKind.TASK_LIST.defaultPriority());
        assertEquals(SubscriptionPriority.LOW, SubscriptionKind.TASK.defaultPriority());
        assertEquals(SubscriptionPriority.LOW, SubscriptionKind.SUBTASK.defaultPriority());
        assertEquals(SubscriptionPriority.MEDIUM, SubscriptionKind.FAMILY.defaultPriority());
        assertEquals(SubscriptionPriority.MEDIUM, SubscriptionKind.USER.defaultPriority());
    }

    @Test
    void isEvictable_OnlyLow() {
        assertTrue(SubscriptionPriority.LOW.isEvictable());
        assertFalse(SubscriptionPriority.MEDIUM.isEvictable());
        assertFalse(SubscriptionPriority.HIGH.isEvictable());
    }
}
