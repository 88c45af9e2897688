package com.ryuqq.livesync.core.model;

import org.junit.jupiter.api.Test;

import java.util.SortedMap;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryDescriptor 테스트.
 *
 * @author LiveSync Team
 * @since 1.0.0
 */
class QueryDescriptorTest {

    // ============================================================
    // 키 정규화
    // ============================================================

    @Test
    void toKey_FilterOrderDoesNotMatter() {
        // Given
        QueryDescriptor q1 = QueryDescriptor.collection("tasks")
            .whereEqualTo("status", "open")
            .whereEqualTo("assignee", "u1");
        QueryDescriptor q2 = QueryDescriptor.collection("tasks")
            .whereEqualTo("assignee", "u1")
            .whereEqualTo("status", "open");

        // When & Then
        assertEquals(q1.toKey(), q2.toKey());
        assertEquals(q1, q2);
    }

    @Test
    void toKey_TasksFactory_UsesHierarchicalPathAndOrder() {
        // When
        SubscriptionKey key = QueryDescriptor.tasks("p1", "ph1", "l1").toKey();

        // Then
        assertEquals("projects/p1/phases/ph1/lists/l1/tasks#order", key.getValue());
    }

    @Test
    void toKey_ProjectsForMember_UsesArrayContainsMarker() {
        // When
        SubscriptionKey key = QueryDescriptor.projectsForMember("u1").toKey();

        // Then
        assertEquals("projects?~memberIds=s:u1", key.getValue());
    }

    @Test
    void toKey_MixedFilters_EqualityBeforeArrayContains() {
        // Given
        QueryDescriptor query = QueryDescriptor.collection("families")
            .whereArrayContains("memberIds", "u1")
            .whereEqualTo("archived", false)
            .orderBy("name");

        // When & Then
        assertEquals("families?archived=b:false&~memberIds=s:u1#name", query.toKey().getValue());
    }

    @Test
    void toKey_DocumentQuery_AppendsDocumentIdWithMarker() {
        // When
        SubscriptionKey key = QueryDescriptor.document("projects", "p1").toKey();

        // Then
        assertEquals("projects@p1", key.getValue());
        assertTrue(QueryDescriptor.document("projects", "p1").isDocument());
    }

    @Test
    void toKey_DifferentOrderBy_ProducesDifferentKeys() {
        QueryDescriptor byOrder = QueryDescriptor.collection("tasks").orderBy("order");
        QueryDescriptor byDue = QueryDescriptor.collection("tasks").orderBy("dueDate");

        assertNotEquals(byOrder.toKey(), byDue.toKey());
    }

    @Test
    void toKey_SeparatorInValue_DoesNotCollideWithSecondFilter() {
        // Given
        QueryDescriptor single = QueryDescriptor.collection("tasks")
            .whereEqualTo("status", "x&tag=y");
        QueryDescriptor two = QueryDescriptor.collection("tasks")
            .whereEqualTo("status", "x")
            .whereEqualTo("tag", "y");

        // When & Then
        assertNotEquals(single.toKey(), two.toKey());
        assertEquals("tasks?status=s:x%26tag%3Dy", single.toKey().getValue());
    }

    @Test
    void toKey_NumberAndString_ProduceDifferentKeys() {
        // Given
        QueryDescriptor number = QueryDescriptor.collection("tasks").whereEqualTo("order", 1);
        QueryDescriptor text = QueryDescriptor.collection("tasks").whereEqualTo("order", "1");
        QueryDescriptor bool = QueryDescriptor.collection("tasks").whereEqualTo("order", true);
        QueryDescriptor boolText = QueryDescriptor.collection("tasks").whereEqualTo("order", "true");

        // When & Then
        assertNotEquals(number.toKey(), text.toKey());
        assertNotEquals(bool.toKey(), boolText.toKey());
    }

    @Test
    void toKey_EqualNumbersOfDifferentTypes_ShareKey() {
        // Given: 원격 필터는 숫자를 값으로 비교
        QueryDescriptor intValue = QueryDescriptor.collection("tasks").whereEqualTo("order", 1);
        QueryDescriptor longValue = QueryDescriptor.collection("tasks").whereEqualTo("order", 1L);
        QueryDescriptor doubleValue = QueryDescriptor.collection("tasks").whereEqualTo("order", 1.0);

        // When & Then
        assertEquals(intValue.toKey(), longValue.toKey());
        assertEquals(intValue.toKey(), doubleValue.toKey());
        assertEquals("tasks?order=n:1", doubleValue.toKey().getValue());
        assertNotEquals(intValue.toKey(),
            QueryDescriptor.collection("tasks").whereEqualTo("order", 1.5).toKey());
    }

    @Test
    void toKey_DocumentQuery_DoesNotCollideWithNestedCollection() {
        // Given
        QueryDescriptor document = QueryDescriptor.document("a/b", "c");
        QueryDescriptor collection = QueryDescriptor.collection("a/b/c");

        // When & Then
        assertNotEquals(document.toKey(), collection.toKey());
        assertEquals("a/b@c", document.toKey().getValue());
        assertEquals("a/b/c", collection.toKey().getValue());
    }

    @Test
    void toKey_ReservedCharactersInFieldAndDocumentId_AreEncoded() {
        // Given
        QueryDescriptor arrayField = QueryDescriptor.collection("tasks").whereArrayContains("tags", "x");
        QueryDescriptor tildeField = QueryDescriptor.collection("tasks").whereEqualTo("~tags", "x");

        // When & Then
        assertNotEquals(arrayField.toKey(), tildeField.toKey());
        assertEquals("tasks?%7Etags=s:x", tildeField.toKey().getValue());
        assertEquals("projects@p%231", QueryDescriptor.document("projects", "p#1").toKey().getValue());
    }

    // ============================================================
    // 유효성 검증
    // ============================================================

    @Test
    void collection_BlankPath_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> QueryDescriptor.collection(" ")
        );
        assertTrue(exception.getMessage().contains("collectionPath cannot be null or blank"));
    }

    @Test
    void collection_LeadingSlash_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> QueryDescriptor.collection("/tasks"));
    }

    @Test
    void whereEqualTo_NullValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> QueryDescriptor.collection("tasks").whereEqualTo("status", null));
    }

    @Test
    void document_WithOrderBy_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> QueryDescriptor.document("projects", "p1").orderBy("order"));
    }

    @Test
    void constructor_FiltersAreCopied() {
        // Given
        SortedMap<String, Object> source = new TreeMap<>();
        source.put("status", "open");
        QueryDescriptor query = new QueryDescriptor("tasks", null, source, null, null);

        // When
        source.put("assignee", "u2");

        // Then
        assertEquals(1, query.equalityFilters().size());
        assertThrows(UnsupportedOperationException.class, () -> query.equalityFilters().put("x", "y"));
    }
}
