package com.cloudcrud.repository.impl;

import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.FilterCondition.Operator;
import com.cloudcrud.model.TableDefinition;

import org.bson.BsonDocument;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for translating records, schemas and predicates to MongoDB documents
 */
class MongoDocumentMapperTest {

    private final MongoDocumentMapper mapper = new MongoDocumentMapper();

    @Test
    void testRecordRoundTrip() {
        Instant now = Instant.parse("2024-03-01T12:00:00.123Z");
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("title", FieldValue.of("A"));
        fields.put("price", FieldValue.of(new BigDecimal("9.99")));
        fields.put("due", FieldValue.date(now));
        fields.put("owner", FieldValue.pointer("User", "u1"));
        fields.put("tags", FieldValue.of(List.of("x", 1)));
        fields.put("meta", FieldValue.of(Map.of("k", "v")));

        DataRecord record = DataRecord.builder()
                .className("Task")
                .objectId("abcdefghij")
                .createdAt(now)
                .updatedAt(now)
                .fields(fields)
                .build();

        Document document = mapper.toDocument(record);
        assertEquals("abcdefghij", document.get("_id"));
        assertEquals(Date.from(now), document.get("_created_at"));
        assertEquals("Pointer", ((Document) document.get("owner")).get("__type"));

        DataRecord restored = mapper.toRecord("Task", document);
        assertEquals(record.getObjectId(), restored.getObjectId());
        assertEquals(now, restored.getCreatedAt());
        assertEquals(fields, restored.getFields());
    }

    @Test
    void testSchemaRoundTrip() {
        TableDefinition definition = TableDefinition.create("Comment");
        definition.absorb(Map.of("post", FieldValue.pointer("Post", "p1"), "body", FieldValue.of("hi")));

        Document document = mapper.toSchemaDocument(definition);
        TableDefinition restored = mapper.toTableDefinition(document);

        assertEquals("Comment", restored.getClassName());
        assertEquals(definition.getFields(), restored.getFields());
    }

    @Test
    void testEmptyPredicatesMatchEverything() {
        assertEquals(new BsonDocument(), mapper.toFilter(List.of()).toBsonDocument());
    }

    @Test
    void testPredicatesTranslateToConjunction() {
        List<FilterCondition> predicates = List.of(
                FilterCondition.of("age", Operator.GREATER_EQUAL, FieldValue.of(18)),
                FilterCondition.of("age", Operator.LESS_EQUAL, FieldValue.of(65)),
                FilterCondition.of("objectId", Operator.EQUALS, FieldValue.of("abc")));

        BsonDocument filter = mapper.toFilter(predicates).toBsonDocument();

        assertEquals(BsonDocument.parse(
                "{\"$and\": [{\"age\": {\"$gte\": 18}}, {\"age\": {\"$lte\": 65}}, {\"_id\": \"abc\"}]}"), filter);
    }

    @Test
    void testNotEqualsExcludesMissingFields() {
        BsonDocument filter = mapper.toFilter(List.of(
                FilterCondition.of("status", Operator.NOT_EQUALS, FieldValue.of("closed")))).toBsonDocument();

        assertEquals(BsonDocument.parse(
                "{\"$and\": [{\"status\": {\"$ne\": null}}, {\"status\": {\"$ne\": \"closed\"}}]}"), filter);
    }

    @Test
    void testInTranslation() {
        BsonDocument filter = mapper.toFilter(List.of(
                FilterCondition.containedIn("status", List.of("open", "pending")))).toBsonDocument();

        assertEquals(BsonDocument.parse("{\"status\": {\"$in\": [\"open\", \"pending\"]}}"), filter);
    }

    @Test
    void testBuiltInFieldNames() {
        assertEquals("_id", mapper.storedFieldName("objectId"));
        assertEquals("_created_at", mapper.storedFieldName("createdAt"));
        assertEquals("_updated_at", mapper.storedFieldName("updatedAt"));
        assertEquals("title", mapper.storedFieldName("title"));
    }
}
