package com.cloudcrud.repository.impl;

import com.cloudcrud.exception.StoreException;
import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldDescriptor;
import com.cloudcrud.model.FieldType;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.TableDefinition;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory document store
 */
class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
    }

    @Test
    void testInsertAssignsIdAndTimestamps() {
        DataRecord record = store.insert("Task", Map.of("title", FieldValue.of("A")));

        assertNotNull(record.getObjectId());
        assertTrue(record.getObjectId().matches("[A-Za-z0-9]{10}"));
        assertNotNull(record.getCreatedAt());
        assertEquals(record.getCreatedAt(), record.getUpdatedAt());
        assertEquals("Task", record.getClassName());

        Optional<DataRecord> fetched = store.getById("Task", record.getObjectId());
        assertTrue(fetched.isPresent());
        assertEquals(FieldValue.of("A"), fetched.get().getFields().get("title"));
    }

    @Test
    void testInsertCreatesClassAndInfersSchema() {
        store.insert("Task", Map.of("title", FieldValue.of("A"), "done", FieldValue.of(false)));

        TableDefinition definition = store.getClassFields("Task").orElseThrow();
        assertEquals(FieldType.STRING, definition.getFields().get("title").getFieldType());
        assertEquals(FieldType.BOOLEAN, definition.getFields().get("done").getFieldType());
    }

    @Test
    void testReturnedRecordsAreCopies() {
        DataRecord record = store.insert("Task", Map.of("title", FieldValue.of("A")));
        record.getFields().put("title", FieldValue.of("changed"));

        assertEquals(FieldValue.of("A"), store.getById("Task", record.getObjectId()).get().getFields().get("title"));
    }

    @Test
    void testQueryWindowKeepsCreationOrder() {
        for (int i = 0; i < 5; i++) {
            store.insert("Item", Map.of("n", FieldValue.of(i)));
        }

        List<DataRecord> page = store.queryWithPredicates("Item", Collections.emptyList(), 2, 1);

        assertEquals(2, page.size());
        assertEquals(FieldValue.of(1), page.get(0).getFields().get("n"));
        assertEquals(FieldValue.of(2), page.get(1).getFields().get("n"));
        assertTrue(store.queryWithPredicates("Item", Collections.emptyList(), 10, 10).isEmpty());
    }

    @Test
    void testQueryAndCountApplyAllPredicates() {
        for (int i = 0; i < 10; i++) {
            store.insert("Item", Map.of("n", FieldValue.of(i)));
        }
        List<FilterCondition> predicates = List.of(
                FilterCondition.of("n", FilterCondition.Operator.GREATER_EQUAL, FieldValue.of(3)),
                FilterCondition.of("n", FilterCondition.Operator.LESS_THAN, FieldValue.of(7)));

        assertEquals(4, store.count("Item", predicates));
        assertEquals(4, store.queryWithPredicates("Item", predicates, Integer.MAX_VALUE, 0).size());
        assertEquals(10, store.count("Item", Collections.emptyList()));
    }

    @Test
    void testUnknownClassReadsAsEmpty() {
        assertTrue(store.queryWithPredicates("Ghost", Collections.emptyList(), 10, 0).isEmpty());
        assertEquals(0, store.count("Ghost", Collections.emptyList()));
        assertFalse(store.getById("Ghost", "x").isPresent());
        assertFalse(store.delete("Ghost", "x"));
        assertFalse(store.getClassFields("Ghost").isPresent());
    }

    @Test
    void testUpdateReplacesFieldsAndRefreshesUpdatedAt() throws InterruptedException {
        DataRecord record = store.insert("Task", Map.of("title", FieldValue.of("A")));
        Thread.sleep(5);

        DataRecord changed = record.mergedWith(Map.of("done", FieldValue.of(true)));
        DataRecord saved = store.update(changed).orElseThrow();

        assertEquals(record.getCreatedAt(), saved.getCreatedAt());
        assertTrue(saved.getUpdatedAt().isAfter(record.getUpdatedAt()));
        assertEquals(FieldValue.of(true), store.getById("Task", record.getObjectId()).get().getFields().get("done"));
    }

    @Test
    void testUpdateOfMissingRecordIsEmpty() {
        store.insert("Task", Map.of("title", FieldValue.of("A")));
        DataRecord ghost = DataRecord.builder().className("Task").objectId("missing000").build();

        assertFalse(store.update(ghost).isPresent());
    }

    @Test
    void testTypeConflictIsRejected() {
        store.insert("Task", Map.of("done", FieldValue.of(false)));

        StoreException e = assertThrows(StoreException.class,
                () -> store.insert("Task", Map.of("done", FieldValue.of("no"))));
        assertTrue(e.getMessage().contains("schema mismatch"));
        assertEquals(1, store.count("Task", Collections.emptyList()));
    }

    @Test
    void testBulkInsertKeepsInputOrder() {
        List<Map<String, FieldValue>> entries = List.of(
                Map.of("n", FieldValue.of(1)),
                Map.of("n", FieldValue.of(2)),
                Map.of("n", FieldValue.of(3)));

        List<DataRecord> saved = store.bulkInsert("Item", entries);

        assertEquals(3, saved.size());
        for (int i = 0; i < 3; i++) {
            DataRecord fetched = store.getById("Item", saved.get(i).getObjectId()).orElseThrow();
            assertEquals(FieldValue.of(i + 1), fetched.getFields().get("n"));
        }
        Set<String> ids = saved.stream().map(DataRecord::getObjectId).collect(Collectors.toSet());
        assertEquals(3, new HashSet<>(ids).size());
    }

    @Test
    void testBulkInsertWithBadEntryWritesNothing() {
        List<Map<String, FieldValue>> entries = List.of(
                Map.of("n", FieldValue.of(1)),
                Map.of("n", FieldValue.of("two")));

        assertThrows(StoreException.class, () -> store.bulkInsert("Item", entries));
        assertEquals(0, store.count("Item", Collections.emptyList()));
        assertFalse(store.getClassFields("Item").isPresent());
    }

    @Test
    void testBadEntryInBulkInsertIntoExistingClassKeepsSchema() {
        store.insert("Item", Map.of("label", FieldValue.of("first")));
        List<Map<String, FieldValue>> entries = List.of(
                Map.of("n", FieldValue.of(1)),
                Map.of("n", FieldValue.of("two")));

        assertThrows(StoreException.class, () -> store.bulkInsert("Item", entries));
        assertEquals(1, store.count("Item", Collections.emptyList()));
        assertFalse(store.getClassFields("Item").orElseThrow().getFields().containsKey("n"));
    }

    @Test
    void testRejectedFirstWriteCreatesNoClass() {
        StoreException builtIn = assertThrows(StoreException.class,
                () -> store.insert("Ghost", Map.of("objectId", FieldValue.of("x"))));
        assertEquals("Field objectId cannot be modified", builtIn.getMessage());

        StoreException badName = assertThrows(StoreException.class,
                () -> store.bulkInsert("Ghost2", List.of(Map.of("a-b", FieldValue.of(1)))));
        assertEquals("Invalid field name: a-b", badName.getMessage());

        assertThrows(StoreException.class,
                () -> store.declareClass("Ghost3", Map.of("createdAt", FieldDescriptor.of(FieldType.DATE))));

        assertFalse(store.getClassFields("Ghost").isPresent());
        assertFalse(store.getClassFields("Ghost2").isPresent());
        assertFalse(store.getClassFields("Ghost3").isPresent());
        assertTrue(store.listClasses().isEmpty());
    }

    @Test
    void testDeclareClassWithoutRecords() {
        TableDefinition definition = store.declareClass("Post",
                Map.of("title", FieldDescriptor.of(FieldType.STRING)));

        assertTrue(definition.getFields().containsKey("title"));
        assertEquals(0, store.count("Post", Collections.emptyList()));
        assertEquals(List.of("Post"), store.listClasses().stream().map(TableDefinition::getClassName).toList());
    }

    @Test
    void testPurgeClass() {
        store.insert("Task", Map.of("title", FieldValue.of("A")));

        assertTrue(store.purgeClass("Task"));
        assertFalse(store.getClassFields("Task").isPresent());
        assertFalse(store.purgeClass("Task"));
    }

    @Test
    void testPurgeRefusedWhileReferenced() {
        store.insert("Post", Map.of("title", FieldValue.of("Hello")));
        store.insert("Comment", Map.of("post", FieldValue.pointer("Post", "p1")));

        StoreException e = assertThrows(StoreException.class, () -> store.purgeClass("Post"));
        assertEquals("Class Post is referenced by Comment.post", e.getMessage());
        assertTrue(store.getClassFields("Post").isPresent());
    }
}
