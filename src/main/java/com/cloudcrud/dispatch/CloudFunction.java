package com.cloudcrud.dispatch;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Named operations callable through the dispatcher, with the parameters each one requires
 * and the prefix put in front of its failure messages
 */
public enum CloudFunction {

    CREATE_TABLE("createTable", "Failed to create table: ", Param.text("className")),
    LIST_TABLES("listTables", "Failed to list tables: "),
    GET_TABLE_SCHEMA("getTableSchema", "Failed to get schema: ", Param.text("className")),
    DELETE_TABLE("deleteTable", "Failed to delete table: ", Param.text("className")),
    CREATE_RECORD("createRecord", "Failed to create record: ",
            Param.text("className"), Param.object("data")),
    READ_TABLE("readTable", "Failed to read records: ", Param.text("className")),
    UPDATE_RECORD("updateRecord", "Failed to update record: ",
            Param.text("className"), Param.text("objectId"), Param.object("data")),
    DELETE_RECORD("deleteRecord", "Failed to delete record: ",
            Param.text("className"), Param.text("objectId")),
    BATCH_CREATE_RECORDS("batchCreateRecords", "Failed to batch create records: ",
            Param.text("className"), Param.array("records")),
    COUNT_RECORDS("countRecords", "Failed to count records: ", Param.text("className")),
    GET_SERVER_INFO("getServerInfo", ""),
    HEALTH_CHECK("healthCheck", "");

    /**
     * A required parameter and the JSON kind it must have
     */
    public static final class Param {

        public enum Kind {
            TEXT, OBJECT, ARRAY
        }

        private final String name;
        private final Kind kind;

        private Param(String name, Kind kind) {
            this.name = name;
            this.kind = kind;
        }

        static Param text(String name) {
            return new Param(name, Kind.TEXT);
        }

        static Param object(String name) {
            return new Param(name, Kind.OBJECT);
        }

        static Param array(String name) {
            return new Param(name, Kind.ARRAY);
        }

        public String getName() {
            return name;
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * How the parameter is named in "... are required" messages
         */
        public String describe() {
            return kind == Kind.ARRAY ? name + " array" : name;
        }
    }

    private final String functionName;
    private final String errorPrefix;
    private final List<Param> requiredParams;

    CloudFunction(String functionName, String errorPrefix, Param... requiredParams) {
        this.functionName = functionName;
        this.errorPrefix = errorPrefix;
        this.requiredParams = List.of(requiredParams);
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getErrorPrefix() {
        return errorPrefix;
    }

    public List<Param> getRequiredParams() {
        return requiredParams;
    }

    public static Optional<CloudFunction> byName(String name) {
        return Arrays.stream(values())
                .filter(function -> function.functionName.equals(name))
                .findFirst();
    }
}
