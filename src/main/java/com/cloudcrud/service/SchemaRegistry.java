package com.cloudcrud.service;

import com.cloudcrud.model.TableDefinition;

import java.util.List;
import java.util.Map;

/**
 * Lifecycle of classes (tables) in the document store
 */
public interface SchemaRegistry {

    /**
     * Declare a class and the types inferred from the initial field values
     */
    TableDefinition createTable(String className, Map<String, ?> initialFields);

    /**
     * All classes with their field names
     */
    List<TableDefinition> listTables();

    /**
     * Field types of a class
     */
    TableDefinition getTableSchema(String className);

    /**
     * Drop all records and the definition of a class
     */
    void deleteTable(String className);
}
