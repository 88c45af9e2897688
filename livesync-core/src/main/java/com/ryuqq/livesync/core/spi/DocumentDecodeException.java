package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.EntityId;

/**
 * Thrown by a {@link DocumentCodec} when a document cannot be converted.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
public class DocumentDecodeException extends RuntimeException {

    private final EntityId documentId;

    public DocumentDecodeException(EntityId documentId, String message) {
        super(message);
        this.documentId = documentId;
    }

    public DocumentDecodeException(EntityId documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    /**
     * Returns the ID of the document that failed to decode.
     *
     * @return the document ID (may be null if unknown)
     */
    public EntityId getDocumentId() {
        return documentId;
    }
}
