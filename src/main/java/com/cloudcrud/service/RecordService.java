package com.cloudcrud.service;

import com.cloudcrud.model.DataRecord;

import java.util.List;
import java.util.Map;

/**
 * Record level operations on a named class
 */
public interface RecordService {

    /**
     * Create a record from the given field values
     */
    DataRecord create(String className, Map<String, ?> data);

    /**
     * Read one page of the records matching a filter specification
     *
     * @param limit page size, null for the configured default
     * @param skip  number of matches to skip, null for none
     */
    List<DataRecord> read(String className, Map<String, ?> filters, Integer limit, Integer skip);

    /**
     * Merge field values over an existing record
     */
    DataRecord update(String className, String objectId, Map<String, ?> data);

    /**
     * Remove a record
     */
    void delete(String className, String objectId);

    /**
     * Create several records in one bulk write; the result follows input order
     */
    List<DataRecord> batchCreate(String className, List<? extends Map<String, ?>> records);

    /**
     * Number of records matching a filter specification
     */
    long count(String className, Map<String, ?> filters);
}
