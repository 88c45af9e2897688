package com.ryuqq.livesync.testkit.contract;

import com.ryuqq.livesync.core.model.EntityId;
import com.ryuqq.livesync.core.model.SyncEntity;

import java.util.Map;

/**
 * Minimal ordered entity used by the contract tests.
 *
 * @param id the entity ID
 * @param order the sort position
 * @param title the display title
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record TestTask(EntityId id, int order, String title) implements SyncEntity {

    public TestTask {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (title == null) {
            throw new IllegalArgumentException("title cannot be null");
        }
    }

    public static TestTask of(String id, int order, String title) {
        return new TestTask(EntityId.of(id), order, title);
    }

    public TestTask withTitle(String title) {
        return new TestTask(id, order, title);
    }

    public TestTask withOrder(int order) {
        return new TestTask(id, order, title);
    }

    /**
     * Fields as stored in the remote store.
     */
    public Map<String, Object> fields() {
        return Map.of("order", order, "title", title);
    }
}
