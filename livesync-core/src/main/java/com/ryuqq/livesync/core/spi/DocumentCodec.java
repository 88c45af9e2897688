package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.SyncEntity;

import java.util.Map;

/**
 * Converts between raw documents and typed entities.
 *
 * <p>Codecs are supplied per subscriber, so two subscribers of the same feed
 * may decode the same snapshot into different entity types.</p>
 *
 * @param <T> the entity type
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public interface DocumentCodec<T extends SyncEntity> {

    /**
     * Decodes a raw document.
     *
     * @param document the raw document
     * @return the entity, whose id must equal {@code document.id()}
     * @throws DocumentDecodeException if a required field is missing or has the wrong type
     */
    T decode(RawDocument document);

    /**
     * Encodes an entity into the fields written by a SET write.
     *
     * @param entity the entity
     * @return the document fields
     */
    Map<String, Object> encode(T entity);
}
