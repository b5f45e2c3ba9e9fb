package com.cloudcrud.repository;

import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.FieldDescriptor;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.TableDefinition;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability interface of the document store that owns every record and class schema.
 * Writes infer and extend the class schema; implementations report failures as
 * {@link com.cloudcrud.exception.StoreException}.
 */
public interface DocumentStore {

    /**
     * Persist a new record, creating the class on first write
     */
    DataRecord insert(String className, Map<String, FieldValue> fields);

    /**
     * Get a record by class and id
     */
    Optional<DataRecord> getById(String className, String objectId);

    /**
     * Records matching every predicate, in creation order, windowed by skip and limit
     */
    List<DataRecord> queryWithPredicates(String className, List<FilterCondition> predicates, int limit, int skip);

    /**
     * Replace the stored fields of an existing record
     *
     * @return the saved record, or empty if it no longer exists
     */
    Optional<DataRecord> update(DataRecord record);

    /**
     * Remove a record
     *
     * @return false if there was nothing to remove
     */
    boolean delete(String className, String objectId);

    /**
     * Persist several records as one bulk write; the result is in input order
     */
    List<DataRecord> bulkInsert(String className, List<Map<String, FieldValue>> entries);

    /**
     * Number of records matching every predicate
     */
    long count(String className, List<FilterCondition> predicates);

    /**
     * Schemas of all classes
     */
    List<TableDefinition> listClasses();

    /**
     * Schema of one class
     */
    Optional<TableDefinition> getClassFields(String className);

    /**
     * Create the class if needed and record the declared field types, without writing any record
     */
    TableDefinition declareClass(String className, Map<String, FieldDescriptor> fields);

    /**
     * Drop all records and the schema of a class
     *
     * @return false if the class does not exist
     * @throws com.cloudcrud.exception.StoreException if another class holds pointers to it
     */
    boolean purgeClass(String className);
}
