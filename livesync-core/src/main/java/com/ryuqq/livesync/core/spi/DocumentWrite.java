package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.EntityId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single write in a {@link RemoteStore#commit(java.util.List)} batch.
 *
 * <p><strong>Types:</strong></p>
 * <ul>
 *   <li>SET: merges the given fields into the document, creating it if absent</li>
 *   <li>DELETE: removes the document (fields are ignored and empty)</li>
 * </ul>
 *
 * @param collectionPath the collection holding the document
 * @param entityId the document ID
 * @param type the write type
 * @param fields the fields to merge (empty for DELETE)
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public record DocumentWrite(
    String collectionPath,
    EntityId entityId,
    Type type,
    Map<String, Object> fields
) {

    /**
     * Write type.
     */
    public enum Type {
        SET,
        DELETE
    }

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if any component is invalid
     */
    public DocumentWrite {
        if (collectionPath == null || collectionPath.isBlank()) {
            throw new IllegalArgumentException("collectionPath cannot be null or blank");
        }
        if (entityId == null) {
            throw new IllegalArgumentException("entityId cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (type == Type.DELETE) {
            fields = Collections.emptyMap();
        } else {
            if (fields == null) {
                throw new IllegalArgumentException("fields cannot be null for SET");
            }
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    /**
     * Creates a merge write.
     */
    public static DocumentWrite set(String collectionPath, EntityId entityId, Map<String, Object> fields) {
        return new DocumentWrite(collectionPath, entityId, Type.SET, fields);
    }

    /**
     * Creates a delete write.
     */
    public static DocumentWrite delete(String collectionPath, EntityId entityId) {
        return new DocumentWrite(collectionPath, entityId, Type.DELETE, null);
    }
}
