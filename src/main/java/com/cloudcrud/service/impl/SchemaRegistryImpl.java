package com.cloudcrud.service.impl;

import com.cloudcrud.aspect.Timed;
import com.cloudcrud.config.CloudCrudProperties;
import com.cloudcrud.exception.NotFoundException;
import com.cloudcrud.model.FieldDescriptor;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.TableDefinition;
import com.cloudcrud.repository.DocumentStore;
import com.cloudcrud.service.SchemaRegistry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Class lifecycle on top of the document store's schema operations.
 *
 * <p>Creating a table only declares metadata. With
 * {@code cloudcrud.schema.legacy-seed-record} enabled, a table created with initial
 * fields also gets one record carrying those values, which is how the schema used to be
 * materialized.
 */
@Service
@Slf4j
public class SchemaRegistryImpl implements SchemaRegistry {

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private CloudCrudProperties properties;

    @Override
    @Timed("createTable")
    public TableDefinition createTable(String className, Map<String, ?> initialFields) {
        Map<String, FieldValue> values = initialFields != null
                ? FieldValue.ofFields(initialFields)
                : Collections.emptyMap();

        Map<String, FieldDescriptor> declared = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            FieldDescriptor descriptor = FieldDescriptor.infer(value);
            if (descriptor != null) {
                declared.put(name, descriptor);
            }
        });

        TableDefinition definition = documentStore.declareClass(className, declared);
        log.info("Declared class {} with {} field(s)", className, definition.getFields().size());

        if (properties.getSchema().isLegacySeedRecord() && !values.isEmpty()) {
            String seedId = documentStore.insert(className, values).getObjectId();
            log.info("Inserted seed record {}/{}", className, seedId);
        }
        return definition;
    }

    @Override
    public List<TableDefinition> listTables() {
        return documentStore.listClasses();
    }

    @Override
    public TableDefinition getTableSchema(String className) {
        return documentStore.getClassFields(className)
                .orElseThrow(() -> new NotFoundException("Class " + className + " does not exist"));
    }

    @Override
    @Timed(value = "deleteTable", logLevel = Timed.LogLevel.INFO)
    public void deleteTable(String className) {
        if (!documentStore.purgeClass(className)) {
            throw new NotFoundException("Class " + className + " does not exist");
        }
    }
}
