package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.EntityId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Undecoded document as delivered by a change feed.
 *
 * <p>The field map is copied and made unmodifiable on construction so that
 * the same snapshot can be decoded by several subscribers safely.</p>
 *
 * @param id the document ID
 * @param fields the document fields (copied, unmodifiable)
 * @param hasPendingWrites true if the document reflects uncommitted local writes
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record RawDocument(
    EntityId id,
    Map<String, Object> fields,
    boolean hasPendingWrites
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if id or fields is null
     */
    public RawDocument {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Reads a field value.
     *
     * @param name the field name
     * @return the value, or null if absent
     */
    public Object get(String name) {
        return fields.get(name);
    }
}
