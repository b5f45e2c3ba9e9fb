package com.cloudcrud.repository.impl;

import com.cloudcrud.exception.StoreException;
import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldDescriptor;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.TableDefinition;
import com.cloudcrud.repository.DocumentStore;
import com.cloudcrud.repository.ObjectIds;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Document store backed by MongoDB. One collection per class, plus the
 * {@code _SCHEMA} collection holding each class's field types.
 */
@Repository
@ConditionalOnProperty(name = "cloudcrud.store.type", havingValue = "mongodb")
public class MongoDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoDocumentStore.class);

    static final String SCHEMA_COLLECTION = "_SCHEMA";

    private static final Bson DEFAULT_ORDER = Sorts.ascending(MongoDocumentMapper.CREATED_AT, MongoDocumentMapper.ID);

    @Autowired
    private MongoDatabase database;

    private final MongoDocumentMapper mapper = new MongoDocumentMapper();

    @Override
    public DataRecord insert(String className, Map<String, FieldValue> fields) {
        return execute(() -> {
            absorbSchema(className, List.of(fields));
            DataRecord record = newRecord(className, fields, now());
            records(className).insertOne(mapper.toDocument(record));
            logger.debug("Inserted {}/{}", className, record.getObjectId());
            return record;
        });
    }

    @Override
    public Optional<DataRecord> getById(String className, String objectId) {
        return execute(() -> {
            Document document = records(className).find(Filters.eq(MongoDocumentMapper.ID, objectId)).first();
            return Optional.ofNullable(document).map(d -> mapper.toRecord(className, d));
        });
    }

    @Override
    public List<DataRecord> queryWithPredicates(String className, List<FilterCondition> predicates,
                                                int limit, int skip) {
        if (limit == 0) {
            return new ArrayList<>();
        }
        return execute(() -> {
            List<DataRecord> results = new ArrayList<>();
            records(className).find(mapper.toFilter(predicates))
                    .sort(DEFAULT_ORDER)
                    .skip(skip)
                    .limit(limit == Integer.MAX_VALUE ? 0 : limit)
                    .forEach(document -> results.add(mapper.toRecord(className, document)));
            return results;
        });
    }

    @Override
    public Optional<DataRecord> update(DataRecord record) {
        return execute(() -> {
            absorbSchema(record.getClassName(), List.of(record.getFields()));
            DataRecord saved = record.toBuilder().updatedAt(now()).build();
            long matched = records(record.getClassName())
                    .replaceOne(Filters.eq(MongoDocumentMapper.ID, record.getObjectId()), mapper.toDocument(saved))
                    .getMatchedCount();
            return matched == 0 ? Optional.<DataRecord>empty() : Optional.of(saved);
        });
    }

    @Override
    public boolean delete(String className, String objectId) {
        return execute(() -> records(className)
                .deleteOne(Filters.eq(MongoDocumentMapper.ID, objectId))
                .getDeletedCount() > 0);
    }

    @Override
    public List<DataRecord> bulkInsert(String className, List<Map<String, FieldValue>> entries) {
        if (entries.isEmpty()) {
            return new ArrayList<>();
        }
        return execute(() -> {
            absorbSchema(className, entries);
            Instant now = now();
            List<DataRecord> saved = new ArrayList<>(entries.size());
            List<Document> documents = new ArrayList<>(entries.size());
            for (Map<String, FieldValue> entry : entries) {
                DataRecord record = newRecord(className, entry, now);
                saved.add(record);
                documents.add(mapper.toDocument(record));
            }
            records(className).insertMany(documents, new InsertManyOptions().ordered(true));
            logger.debug("Bulk inserted {} records into {}", saved.size(), className);
            return saved;
        });
    }

    @Override
    public long count(String className, List<FilterCondition> predicates) {
        return execute(() -> records(className).countDocuments(mapper.toFilter(predicates)));
    }

    @Override
    public List<TableDefinition> listClasses() {
        return execute(() -> {
            List<TableDefinition> definitions = new ArrayList<>();
            schemas().find().sort(Sorts.ascending(MongoDocumentMapper.ID))
                    .forEach(document -> definitions.add(mapper.toTableDefinition(document)));
            return definitions;
        });
    }

    @Override
    public Optional<TableDefinition> getClassFields(String className) {
        return execute(() -> loadSchema(className));
    }

    @Override
    public TableDefinition declareClass(String className, Map<String, FieldDescriptor> fields) {
        TableDefinition.validateClassName(className);
        return execute(() -> {
            TableDefinition definition = loadSchema(className).orElseGet(() -> TableDefinition.create(className));
            definition.declare(fields);
            saveSchema(definition);
            return definition;
        });
    }

    @Override
    public boolean purgeClass(String className) {
        return execute(() -> {
            if (loadSchema(className).isEmpty()) {
                return false;
            }
            for (TableDefinition other : listClasses()) {
                if (other.getClassName().equals(className)) {
                    continue;
                }
                List<String> referencing = other.fieldsReferencing(className);
                if (!referencing.isEmpty()) {
                    throw new StoreException("Class " + className + " is referenced by "
                            + other.getClassName() + "." + referencing.get(0));
                }
            }
            records(className).drop();
            schemas().deleteOne(Filters.eq(MongoDocumentMapper.ID, className));
            logger.info("Purged class {}", className);
            return true;
        });
    }

    /**
     * Check the writes against the stored schema and persist any new fields before the data
     */
    private void absorbSchema(String className, List<Map<String, FieldValue>> writes) {
        TableDefinition.validateClassName(className);
        Optional<TableDefinition> stored = loadSchema(className);
        TableDefinition definition = stored.orElseGet(() -> TableDefinition.create(className));
        boolean changed = stored.isEmpty();
        for (Map<String, FieldValue> write : writes) {
            changed |= definition.absorb(write);
        }
        if (changed) {
            saveSchema(definition);
        }
    }

    private Optional<TableDefinition> loadSchema(String className) {
        Document document = schemas().find(Filters.eq(MongoDocumentMapper.ID, className)).first();
        return Optional.ofNullable(document).map(mapper::toTableDefinition);
    }

    private void saveSchema(TableDefinition definition) {
        schemas().replaceOne(Filters.eq(MongoDocumentMapper.ID, definition.getClassName()),
                mapper.toSchemaDocument(definition), new ReplaceOptions().upsert(true));
    }

    private DataRecord newRecord(String className, Map<String, FieldValue> fields, Instant now) {
        return DataRecord.builder()
                .className(className)
                .objectId(ObjectIds.newObjectId())
                .createdAt(now)
                .updatedAt(now)
                .fields(new LinkedHashMap<>(fields))
                .build();
    }

    private MongoCollection<Document> records(String className) {
        return database.getCollection(className);
    }

    private MongoCollection<Document> schemas() {
        return database.getCollection(SCHEMA_COLLECTION);
    }

    private <T> T execute(Supplier<T> action) {
        try {
            return action.get();
        } catch (MongoException e) {
            logger.error("MongoDB operation failed", e);
            throw new StoreException(e.getMessage(), e);
        }
    }

    private Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
