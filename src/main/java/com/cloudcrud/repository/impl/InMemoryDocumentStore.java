package com.cloudcrud.repository.impl;

import com.cloudcrud.exception.StoreException;
import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldDescriptor;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.TableDefinition;
import com.cloudcrud.repository.DocumentStore;
import com.cloudcrud.repository.ObjectIds;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Document store kept in process memory. Each class holds its schema and its records
 * in creation order; operations on one class are serialized on that class.
 */
@Repository
@ConditionalOnProperty(name = "cloudcrud.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, ClassCollection> collections = new ConcurrentHashMap<>();

    private static final class ClassCollection {
        private final TableDefinition definition;
        private final Map<String, DataRecord> records = new LinkedHashMap<>();
        private final Set<String> issuedIds = new HashSet<>();

        private ClassCollection(String className) {
            this.definition = TableDefinition.create(className);
        }

        private String nextObjectId() {
            String id;
            do {
                id = ObjectIds.newObjectId();
            } while (!issuedIds.add(id));
            return id;
        }

        private DataRecord newRecord(Map<String, FieldValue> fields, Instant now) {
            return DataRecord.builder()
                    .className(definition.getClassName())
                    .objectId(nextObjectId())
                    .createdAt(now)
                    .updatedAt(now)
                    .fields(new LinkedHashMap<>(fields))
                    .build();
        }
    }

    @Override
    public DataRecord insert(String className, Map<String, FieldValue> fields) {
        ClassCollection collection = collectionFor(className, scratch -> scratch.absorb(fields));
        synchronized (collection) {
            collection.definition.absorb(fields);
            DataRecord record = collection.newRecord(fields, now());
            collection.records.put(record.getObjectId(), record);
            logger.debug("Inserted {}/{}", className, record.getObjectId());
            return copyOf(record);
        }
    }

    @Override
    public Optional<DataRecord> getById(String className, String objectId) {
        ClassCollection collection = collections.get(className);
        if (collection == null) {
            return Optional.empty();
        }
        synchronized (collection) {
            return Optional.ofNullable(collection.records.get(objectId)).map(this::copyOf);
        }
    }

    @Override
    public List<DataRecord> queryWithPredicates(String className, List<FilterCondition> predicates,
                                                int limit, int skip) {
        ClassCollection collection = collections.get(className);
        if (collection == null) {
            return Collections.emptyList();
        }
        synchronized (collection) {
            return collection.records.values().stream()
                    .filter(record -> matchesAll(record, predicates))
                    .skip(skip)
                    .limit(limit)
                    .map(this::copyOf)
                    .collect(Collectors.toList());
        }
    }

    @Override
    public Optional<DataRecord> update(DataRecord record) {
        ClassCollection collection = collections.get(record.getClassName());
        if (collection == null) {
            return Optional.empty();
        }
        synchronized (collection) {
            DataRecord existing = collection.records.get(record.getObjectId());
            if (existing == null) {
                return Optional.empty();
            }
            collection.definition.absorb(record.getFields());
            DataRecord saved = existing.toBuilder()
                    .fields(new LinkedHashMap<>(record.getFields()))
                    .updatedAt(now())
                    .build();
            collection.records.put(saved.getObjectId(), saved);
            logger.debug("Updated {}/{}", record.getClassName(), record.getObjectId());
            return Optional.of(copyOf(saved));
        }
    }

    @Override
    public boolean delete(String className, String objectId) {
        ClassCollection collection = collections.get(className);
        if (collection == null) {
            return false;
        }
        synchronized (collection) {
            return collection.records.remove(objectId) != null;
        }
    }

    @Override
    public List<DataRecord> bulkInsert(String className, List<Map<String, FieldValue>> entries) {
        if (entries.isEmpty()) {
            return Collections.emptyList();
        }

        ClassCollection collection = collectionFor(className, scratch -> entries.forEach(scratch::absorb));
        synchronized (collection) {
            // Check every entry against a scratch schema so a bad entry leaves nothing behind
            TableDefinition scratch = collection.definition.copy();
            for (Map<String, FieldValue> entry : entries) {
                scratch.absorb(entry);
            }
            collection.definition.setFields(scratch.getFields());

            Instant now = now();
            List<DataRecord> saved = new ArrayList<>(entries.size());
            for (Map<String, FieldValue> entry : entries) {
                DataRecord record = collection.newRecord(entry, now);
                collection.records.put(record.getObjectId(), record);
                saved.add(copyOf(record));
            }
            logger.debug("Bulk inserted {} records into {}", saved.size(), className);
            return saved;
        }
    }

    @Override
    public long count(String className, List<FilterCondition> predicates) {
        ClassCollection collection = collections.get(className);
        if (collection == null) {
            return 0;
        }
        synchronized (collection) {
            return collection.records.values().stream()
                    .filter(record -> matchesAll(record, predicates))
                    .count();
        }
    }

    @Override
    public List<TableDefinition> listClasses() {
        return collections.values().stream()
                .map(this::definitionOf)
                .sorted(Comparator.comparing(TableDefinition::getClassName))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<TableDefinition> getClassFields(String className) {
        ClassCollection collection = collections.get(className);
        return collection == null ? Optional.empty() : Optional.of(definitionOf(collection));
    }

    @Override
    public TableDefinition declareClass(String className, Map<String, FieldDescriptor> fields) {
        ClassCollection collection = collectionFor(className, scratch -> scratch.declare(fields));
        synchronized (collection) {
            collection.definition.declare(fields);
            return collection.definition.copy();
        }
    }

    @Override
    public boolean purgeClass(String className) {
        if (!collections.containsKey(className)) {
            return false;
        }

        for (ClassCollection other : collections.values()) {
            if (other.definition.getClassName().equals(className)) {
                continue;
            }
            List<String> referencing = definitionOf(other).fieldsReferencing(className);
            if (!referencing.isEmpty()) {
                throw new StoreException("Class " + className + " is referenced by "
                        + other.definition.getClassName() + "." + referencing.get(0));
            }
        }

        ClassCollection removed = collections.remove(className);
        if (removed == null) {
            return false;
        }
        logger.info("Purged class {} with {} records", className, removed.records.size());
        return true;
    }

    /**
     * Drop every class
     */
    public void clear() {
        collections.clear();
    }

    /**
     * Collection of an existing class, or a newly registered one once the write passes
     * against an empty schema. A rejected first write leaves no class behind.
     */
    private ClassCollection collectionFor(String className, Consumer<TableDefinition> firstWriteCheck) {
        ClassCollection existing = collections.get(className);
        if (existing != null) {
            return existing;
        }
        firstWriteCheck.accept(TableDefinition.create(className));
        return collections.computeIfAbsent(className, ClassCollection::new);
    }

    private TableDefinition definitionOf(ClassCollection collection) {
        synchronized (collection) {
            return collection.definition.copy();
        }
    }

    private boolean matchesAll(DataRecord record, List<FilterCondition> predicates) {
        for (FilterCondition predicate : predicates) {
            if (!predicate.matches(record)) {
                return false;
            }
        }
        return true;
    }

    private DataRecord copyOf(DataRecord record) {
        return record.toBuilder().fields(new LinkedHashMap<>(record.getFields())).build();
    }

    private Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }
}
