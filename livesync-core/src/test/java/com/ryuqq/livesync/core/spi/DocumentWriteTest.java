package com.ryuqq.livesync.core.spi;

import com.ryuqq.livesync.core.model.EntityId;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DocumentWrite / RawDocument 테스트.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
class DocumentWriteTest {

    @Test
    void delete_HasEmptyFields() {
        // When
        DocumentWrite write = DocumentWrite.delete("tasks", EntityId.of("t1"));

        // Then
        assertEquals(DocumentWrite.Type.DELETE, write.type());
        assertTrue(write.fields().isEmpty());
    }

    @Test
    void set_NullFields_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> DocumentWrite.set("tasks", EntityId.of("t1"), null));
    }

    @Test
    void set_FieldsAreCopied() {
        // Given
        Map<String, Object> fields = new HashMap<>();
        fields.put("title", "a");
        DocumentWrite write = DocumentWrite.set("tasks", EntityId.of("t1"), fields);

        // When
        fields.put("title", "b");

        // Then
        assertEquals("a", write.fields().get("title"));
    }

    @Test
    void rawDocument_FieldsAreUnmodifiable() {
        // Given
        RawDocument doc = new RawDocument(EntityId.of("t1"), Map.of("order", 1), false);

        // When & Then
        assertEquals(1, doc.get("order"));
        assertThrows(UnsupportedOperationException.class, () -> doc.fields().put("x", 1));
    }

    @Test
    void remoteStoreException_NullReason_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RemoteStoreException(null, "boom"));
    }
}
