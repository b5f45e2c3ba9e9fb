package com.cloudcrud.service.impl;

import com.cloudcrud.aspect.Timed;
import com.cloudcrud.config.CloudCrudProperties;
import com.cloudcrud.exception.NotFoundException;
import com.cloudcrud.exception.ValidationException;
import com.cloudcrud.filter.FilterCompiler;
import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.TableDefinition;
import com.cloudcrud.repository.DocumentStore;
import com.cloudcrud.service.RecordService;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Record access layer. Holds no state between calls: every read goes to the store and
 * every write is a single store call, with no locking, retry or rollback.
 */
@Service
@Slf4j
public class RecordServiceImpl implements RecordService {

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private FilterCompiler filterCompiler;

    @Autowired
    private CloudCrudProperties properties;

    @Override
    @Timed("createRecord")
    public DataRecord create(String className, Map<String, ?> data) {
        if (className == null || data == null) {
            throw new ValidationException("className and data are required");
        }
        return documentStore.insert(className, FieldValue.ofFields(data));
    }

    @Override
    @Timed("readTable")
    public List<DataRecord> read(String className, Map<String, ?> filters, Integer limit, Integer skip) {
        int pageSize = limit != null ? limit : properties.getQuery().getDefaultLimit();
        int offset = skip != null ? skip : 0;
        if (pageSize < 0 || offset < 0) {
            throw new ValidationException("limit and skip must not be negative");
        }
        Integer maxLimit = properties.getQuery().getMaxLimit();
        if (maxLimit != null && pageSize > maxLimit) {
            log.debug("Capping page size {} to {}", pageSize, maxLimit);
            pageSize = maxLimit;
        }

        List<FilterCondition> predicates = filterCompiler.compile(filters);
        if (filtersOutsideSchema(className, predicates)) {
            return new ArrayList<>();
        }
        List<DataRecord> page = documentStore.queryWithPredicates(className, predicates, pageSize, offset);
        log.debug("Read {} record(s) from {} with {} predicate(s)", page.size(), className, predicates.size());
        return page;
    }

    @Override
    @Timed("updateRecord")
    public DataRecord update(String className, String objectId, Map<String, ?> data) {
        DataRecord existing = documentStore.getById(className, objectId)
                .orElseThrow(() -> notFound(className, objectId));

        DataRecord merged = existing.mergedWith(FieldValue.ofFields(data));
        return documentStore.update(merged)
                .orElseThrow(() -> notFound(className, objectId));
    }

    @Override
    @Timed("deleteRecord")
    public void delete(String className, String objectId) {
        documentStore.getById(className, objectId)
                .orElseThrow(() -> notFound(className, objectId));

        if (!documentStore.delete(className, objectId)) {
            throw notFound(className, objectId);
        }
    }

    @Override
    @Timed(value = "batchCreateRecords", logLevel = Timed.LogLevel.INFO)
    public List<DataRecord> batchCreate(String className, List<? extends Map<String, ?>> records) {
        List<Map<String, FieldValue>> entries = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            if (record == null) {
                throw new ValidationException("records must not contain null entries");
            }
            entries.add(FieldValue.ofFields(record));
        }
        return documentStore.bulkInsert(className, entries);
    }

    @Override
    @Timed("countRecords")
    public long count(String className, Map<String, ?> filters) {
        List<FilterCondition> predicates = filterCompiler.compile(filters);
        if (filtersOutsideSchema(className, predicates)) {
            return 0;
        }
        return documentStore.count(className, predicates);
    }

    /**
     * A predicate on a field the class schema does not know never matches
     */
    private boolean filtersOutsideSchema(String className, List<FilterCondition> predicates) {
        if (predicates.isEmpty()) {
            return false;
        }
        Optional<TableDefinition> definition = documentStore.getClassFields(className);
        if (definition.isEmpty()) {
            return true;
        }
        for (FilterCondition predicate : predicates) {
            if (!definition.get().getFields().containsKey(predicate.getKey())) {
                log.debug("Field {} is not in the schema of {}; nothing matches", predicate.getKey(), className);
                return true;
            }
        }
        return false;
    }

    private NotFoundException notFound(String className, String objectId) {
        return new NotFoundException("Object not found: " + className + "/" + objectId);
    }
}
