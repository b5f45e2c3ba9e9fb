package com.cloudcrud.repository.impl;

import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldDescriptor;
import com.cloudcrud.model.FieldType;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.TableDefinition;
import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.*;

/**
 * Translates records, schemas and predicates to and from their MongoDB form.
 *
 * <p>Records are stored with the id in {@code _id} and the timestamps in
 * {@code _created_at} / {@code _updated_at}; pointers are embedded as
 * {@code {__type: "Pointer", className, objectId}} documents.
 */
public class MongoDocumentMapper {

    static final String ID = "_id";
    static final String CREATED_AT = "_created_at";
    static final String UPDATED_AT = "_updated_at";
    static final String SCHEMA_FIELDS = "fields";

    private static final String TYPE_KEY = "__type";

    // Record conversion

    public Document toDocument(DataRecord record) {
        Document document = new Document(ID, record.getObjectId())
                .append(CREATED_AT, toDate(record.getCreatedAt()))
                .append(UPDATED_AT, toDate(record.getUpdatedAt()));
        record.getFields().forEach((name, value) -> document.append(name, toBson(value)));
        return document;
    }

    public DataRecord toRecord(String className, Document document) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            String name = entry.getKey();
            if (!ID.equals(name) && !CREATED_AT.equals(name) && !UPDATED_AT.equals(name)) {
                fields.put(name, fromBson(entry.getValue()));
            }
        }
        return DataRecord.builder()
                .className(className)
                .objectId(document.getString(ID))
                .createdAt(toInstant(document.getDate(CREATED_AT)))
                .updatedAt(toInstant(document.getDate(UPDATED_AT)))
                .fields(fields)
                .build();
    }

    public Object toBson(FieldValue value) {
        switch (value.getType()) {
            case NULL:
                return null;
            case NUMBER:
                return toBsonNumber(value.asNumber());
            case DATE:
                return Date.from(value.asDate());
            case POINTER:
                return new Document(TYPE_KEY, "Pointer")
                        .append("className", value.asPointer().getClassName())
                        .append("objectId", value.asPointer().getObjectId());
            case ARRAY: {
                List<Object> elements = new ArrayList<>();
                for (FieldValue element : value.asArray()) {
                    elements.add(toBson(element));
                }
                return elements;
            }
            case OBJECT: {
                Document nested = new Document();
                value.asObject().forEach((k, v) -> nested.append(k, toBson(v)));
                return nested;
            }
            case STRING:
                return value.asString();
            case BOOLEAN:
                return value.asBoolean();
            default:
                throw new IllegalArgumentException("Unhandled field type: " + value.getType());
        }
    }

    public FieldValue fromBson(Object bson) {
        if (bson == null) {
            return FieldValue.NULL;
        }
        if (bson instanceof Decimal128) {
            return FieldValue.number(((Decimal128) bson).bigDecimalValue());
        }
        if (bson instanceof Date) {
            return FieldValue.date(((Date) bson).toInstant());
        }
        if (bson instanceof Document) {
            Document document = (Document) bson;
            if ("Pointer".equals(document.get(TYPE_KEY))) {
                return FieldValue.pointer(document.getString("className"), document.getString("objectId"));
            }
            Map<String, FieldValue> entries = new LinkedHashMap<>();
            document.forEach((k, v) -> entries.put(k, fromBson(v)));
            return FieldValue.object(entries);
        }
        if (bson instanceof List) {
            List<FieldValue> elements = new ArrayList<>();
            for (Object element : (List<?>) bson) {
                elements.add(fromBson(element));
            }
            return FieldValue.array(elements);
        }
        return FieldValue.of(bson);
    }

    // Schema conversion

    public Document toSchemaDocument(TableDefinition definition) {
        Document fields = new Document();
        definition.getFields().forEach((name, descriptor) -> {
            Document field = new Document("type", descriptor.getType());
            if (descriptor.getTargetClass() != null) {
                field.append("targetClass", descriptor.getTargetClass());
            }
            fields.append(name, field);
        });
        return new Document(ID, definition.getClassName()).append(SCHEMA_FIELDS, fields);
    }

    public TableDefinition toTableDefinition(Document document) {
        Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        Document stored = document.get(SCHEMA_FIELDS, Document.class);
        if (stored != null) {
            stored.forEach((name, raw) -> {
                Document field = (Document) raw;
                fields.put(name, FieldDescriptor.builder()
                        .fieldType(typeOf(field.getString("type")))
                        .targetClass(field.getString("targetClass"))
                        .build());
            });
        }
        return TableDefinition.builder()
                .className(document.getString(ID))
                .fields(fields)
                .build();
    }

    // Predicate translation

    public Bson toFilter(List<FilterCondition> predicates) {
        if (predicates == null || predicates.isEmpty()) {
            return new Document();
        }
        List<Bson> clauses = new ArrayList<>(predicates.size());
        for (FilterCondition predicate : predicates) {
            clauses.add(toClause(predicate));
        }
        return clauses.size() == 1 ? clauses.get(0) : Filters.and(clauses);
    }

    private Bson toClause(FilterCondition predicate) {
        String field = storedFieldName(predicate.getKey());
        Object operand = predicate.getValue() != null ? toBson(predicate.getValue()) : null;

        switch (predicate.getOperator()) {
            case EQUALS:
                return Filters.eq(field, operand);
            case NOT_EQUALS:
                // A missing or null field never satisfies an inequality
                if (operand == null) {
                    return Filters.ne(field, null);
                }
                return Filters.and(Filters.ne(field, null), Filters.ne(field, operand));
            case GREATER_THAN:
                return Filters.gt(field, operand);
            case GREATER_EQUAL:
                return Filters.gte(field, operand);
            case LESS_THAN:
                return Filters.lt(field, operand);
            case LESS_EQUAL:
                return Filters.lte(field, operand);
            case IN: {
                List<Object> values = new ArrayList<>();
                if (predicate.getValues() != null) {
                    for (FieldValue value : predicate.getValues()) {
                        values.add(toBson(value));
                    }
                }
                return Filters.in(field, values);
            }
            default:
                throw new IllegalArgumentException("Unhandled operator: " + predicate.getOperator());
        }
    }

    String storedFieldName(String field) {
        switch (field) {
            case DataRecord.OBJECT_ID:
                return ID;
            case DataRecord.CREATED_AT:
                return CREATED_AT;
            case DataRecord.UPDATED_AT:
                return UPDATED_AT;
            default:
                return field;
        }
    }

    private Object toBsonNumber(Number number) {
        if (number instanceof BigDecimal) {
            return new Decimal128((BigDecimal) number);
        }
        if (number instanceof BigInteger) {
            return new Decimal128(new BigDecimal((BigInteger) number));
        }
        if (number instanceof Float) {
            return number.doubleValue();
        }
        if (number instanceof Short || number instanceof Byte) {
            return number.intValue();
        }
        return number;
    }

    private FieldType typeOf(String displayName) {
        for (FieldType type : FieldType.values()) {
            if (type.getDisplayName().equals(displayName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown schema type: " + displayName);
    }

    private static Date toDate(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
