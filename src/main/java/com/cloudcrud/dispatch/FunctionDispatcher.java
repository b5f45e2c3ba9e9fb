package com.cloudcrud.dispatch;

import com.cloudcrud.aspect.Timed;
import com.cloudcrud.config.CloudCrudProperties;
import com.cloudcrud.exception.CloudFunctionException;
import com.cloudcrud.exception.ErrorKind;
import com.cloudcrud.exception.NotFoundException;
import com.cloudcrud.exception.StoreException;
import com.cloudcrud.exception.ValidationException;
import com.cloudcrud.model.DataRecord;
import com.cloudcrud.model.TableDefinition;
import com.cloudcrud.model.result.ResponseEnvelope;
import com.cloudcrud.model.result.TableSummary;
import com.cloudcrud.service.RecordService;
import com.cloudcrud.service.SchemaRegistry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for cloud functions called by name.
 *
 * <p>Checks the parameters before touching the store, routes the call to the
 * schema registry or the record service, and wraps the result in a
 * {@link ResponseEnvelope}. Failures are re-raised with the function's message prefix,
 * keeping their kind.
 */
@Component
@Slf4j
public class FunctionDispatcher {

    // Optional parameters checked for their JSON kind whenever they are present
    private static final List<String> OPTIONAL_OBJECTS = List.of("schema", "filters");
    private static final List<String> OPTIONAL_INTEGERS = List.of("limit", "skip");

    @Autowired
    private SchemaRegistry schemaRegistry;

    @Autowired
    private RecordService recordService;

    @Autowired
    private CloudCrudProperties properties;

    /**
     * Run a cloud function
     *
     * @param functionName name the function is registered under
     * @param params       decoded JSON parameters, may be null
     * @throws CloudFunctionException on any failure
     */
    @Timed
    public ResponseEnvelope execute(String functionName, Map<String, Object> params) {
        CloudFunction function = CloudFunction.byName(functionName)
                .orElseThrow(() -> {
                    log.warn("Rejected call to unknown function '{}'", functionName);
                    return new NotFoundException("Invalid function: \"" + functionName + "\"");
                });
        Map<String, Object> args = params != null ? params : Collections.emptyMap();

        try {
            validate(function, args);
        } catch (ValidationException e) {
            log.warn("{} rejected: {}", function.getFunctionName(), e.getMessage());
            throw e;
        }

        log.debug("Executing {}", function.getFunctionName());
        try {
            return dispatch(function, args);
        } catch (CloudFunctionException e) {
            CloudFunctionException wrapped = e.withPrefix(function.getErrorPrefix());
            logFailure(wrapped);
            throw wrapped;
        } catch (RuntimeException e) {
            StoreException wrapped = new StoreException(function.getErrorPrefix() + e.getMessage(), e);
            logFailure(wrapped);
            throw wrapped;
        }
    }

    private ResponseEnvelope dispatch(CloudFunction function, Map<String, Object> args) {
        switch (function) {
            case CREATE_TABLE:
                return createTable(args);
            case LIST_TABLES:
                return listTables();
            case GET_TABLE_SCHEMA:
                return getTableSchema(args);
            case DELETE_TABLE:
                return deleteTable(args);
            case CREATE_RECORD:
                return createRecord(args);
            case READ_TABLE:
                return readTable(args);
            case UPDATE_RECORD:
                return updateRecord(args);
            case DELETE_RECORD:
                return deleteRecord(args);
            case BATCH_CREATE_RECORDS:
                return batchCreateRecords(args);
            case COUNT_RECORDS:
                return countRecords(args);
            case GET_SERVER_INFO:
                return serverInfo();
            case HEALTH_CHECK:
                return healthCheck();
            default:
                throw new IllegalStateException("Unhandled function: " + function);
        }
    }

    // ==================== TABLE MANAGEMENT ====================

    private ResponseEnvelope createTable(Map<String, Object> args) {
        String className = text(args, "className");
        schemaRegistry.createTable(className, object(args, "schema"));
        return ResponseEnvelope.success("Table '" + className + "' created successfully")
                .with("className", className);
    }

    private ResponseEnvelope listTables() {
        List<TableSummary> tables = schemaRegistry.listTables().stream()
                .map(definition -> new TableSummary(definition.getClassName(), definition.getFieldNames()))
                .collect(Collectors.toList());
        return ResponseEnvelope.success()
                .with("tables", tables)
                .with("count", tables.size());
    }

    private ResponseEnvelope getTableSchema(Map<String, Object> args) {
        TableDefinition definition = schemaRegistry.getTableSchema(text(args, "className"));
        return ResponseEnvelope.success()
                .with("className", definition.getClassName())
                .with("fields", definition.getFields());
    }

    private ResponseEnvelope deleteTable(Map<String, Object> args) {
        String className = text(args, "className");
        schemaRegistry.deleteTable(className);
        return ResponseEnvelope.success("Table '" + className + "' deleted successfully");
    }

    // ==================== RECORD OPERATIONS ====================

    private ResponseEnvelope createRecord(Map<String, Object> args) {
        DataRecord record = recordService.create(text(args, "className"), object(args, "data"));
        return ResponseEnvelope.success("Record created successfully")
                .with("objectId", record.getObjectId())
                .with("data", record);
    }

    private ResponseEnvelope readTable(Map<String, Object> args) {
        String className = text(args, "className");
        List<DataRecord> records = recordService.read(className, object(args, "filters"),
                optionalInteger(args, "limit"), optionalInteger(args, "skip"));
        return ResponseEnvelope.success()
                .with("className", className)
                .with("count", records.size())
                .with("data", records);
    }

    private ResponseEnvelope updateRecord(Map<String, Object> args) {
        DataRecord record = recordService.update(text(args, "className"), text(args, "objectId"),
                object(args, "data"));
        return ResponseEnvelope.success("Record updated successfully")
                .with("objectId", record.getObjectId())
                .with("data", record);
    }

    private ResponseEnvelope deleteRecord(Map<String, Object> args) {
        String objectId = text(args, "objectId");
        recordService.delete(text(args, "className"), objectId);
        return ResponseEnvelope.success("Record deleted successfully")
                .with("objectId", objectId);
    }

    private ResponseEnvelope batchCreateRecords(Map<String, Object> args) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Object entry : (List<?>) args.get("records")) {
            entries.add(castObject(entry));
        }

        List<DataRecord> created = recordService.batchCreate(text(args, "className"), entries);
        List<String> objectIds = created.stream().map(DataRecord::getObjectId).collect(Collectors.toList());
        return ResponseEnvelope.success(created.size() + " records created successfully")
                .with("count", created.size())
                .with("objectIds", objectIds);
    }

    private ResponseEnvelope countRecords(Map<String, Object> args) {
        String className = text(args, "className");
        long count = recordService.count(className, object(args, "filters"));
        return ResponseEnvelope.success()
                .with("className", className)
                .with("count", count);
    }

    // ==================== UTILITY FUNCTIONS ====================

    private ResponseEnvelope serverInfo() {
        CloudCrudProperties.Server server = properties.getServer();
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("liveQueries", server.isLiveQueries());
        features.put("redisCache", server.isRedisCache());
        features.put("dashboard", server.isDashboard());
        features.put("publicAccess", server.isPublicAccess());

        return ResponseEnvelope.success()
                .with("serverVersion", server.getVersion())
                .with("timestamp", timestamp())
                .with("features", features);
    }

    private ResponseEnvelope healthCheck() {
        return ResponseEnvelope.success()
                .with("status", "healthy")
                .with("timestamp", timestamp());
    }

    // ==================== PARAMETERS ====================

    private void validate(CloudFunction function, Map<String, Object> args) {
        List<CloudFunction.Param> required = function.getRequiredParams();
        boolean complete = required.stream().allMatch(param -> isPresent(param, args.get(param.getName())));
        if (!complete) {
            throw new ValidationException(requiredMessage(required));
        }

        for (CloudFunction.Param param : required) {
            if (param.getKind() == CloudFunction.Param.Kind.TEXT && !(args.get(param.getName()) instanceof String)) {
                throw new ValidationException(param.getName() + " must be a string");
            }
            if (param.getKind() == CloudFunction.Param.Kind.OBJECT && !(args.get(param.getName()) instanceof Map)) {
                throw new ValidationException(param.getName() + " must be an object");
            }
        }

        for (String name : OPTIONAL_OBJECTS) {
            Object value = args.get(name);
            if (value != null && !(value instanceof Map)) {
                throw new ValidationException(name + " must be an object");
            }
        }
        for (String name : OPTIONAL_INTEGERS) {
            Object value = args.get(name);
            if (value != null && !(value instanceof Integer || value instanceof Long || value instanceof Short)) {
                throw new ValidationException(name + " must be an integer");
            }
        }
        if (function == CloudFunction.BATCH_CREATE_RECORDS) {
            for (Object entry : (List<?>) args.get("records")) {
                if (entry != null && !(entry instanceof Map)) {
                    throw new ValidationException("records must contain only objects");
                }
            }
        }
    }

    private boolean isPresent(CloudFunction.Param param, Object value) {
        if (value == null) {
            return false;
        }
        if (param.getKind() == CloudFunction.Param.Kind.ARRAY) {
            return value instanceof List;
        }
        return !(value instanceof String) || !((String) value).isEmpty();
    }

    /**
     * "a is required", "a and b are required", "a, b, and c are required"
     */
    static String requiredMessage(List<CloudFunction.Param> required) {
        List<String> names = required.stream().map(CloudFunction.Param::describe).collect(Collectors.toList());
        if (names.size() == 1) {
            return names.get(0) + " is required";
        }
        if (names.size() == 2) {
            return names.get(0) + " and " + names.get(1) + " are required";
        }
        String head = String.join(", ", names.subList(0, names.size() - 1));
        return head + ", and " + names.get(names.size() - 1) + " are required";
    }

    private String text(Map<String, Object> args, String name) {
        return (String) args.get(name);
    }

    private Map<String, Object> object(Map<String, Object> args, String name) {
        return castObject(args.get(name));
    }

    private Integer optionalInteger(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return null;
        }
        long number = ((Number) value).longValue();
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, number));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> castObject(Object value) {
        return (Map<String, Object>) value;
    }

    private String timestamp() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS).toString();
    }

    private void logFailure(CloudFunctionException failure) {
        if (failure.getKind() == ErrorKind.STORE) {
            log.error("{}", failure.getMessage(), failure.getCause());
        } else {
            log.warn("{}", failure.getMessage());
        }
    }
}
