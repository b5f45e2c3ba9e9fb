package com.cloudcrud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One document of a class. Serializes flat: user fields next to objectId,
 * createdAt, updatedAt and the ACL.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"objectId", "createdAt", "updatedAt"})
public class DataRecord {

    public static final String OBJECT_ID = "objectId";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";
    public static final String ACL = "ACL";

    @JsonIgnore
    private String className;

    private String objectId;
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    @Builder.Default
    private Map<String, FieldValue> fields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, FieldValue> getFields() {
        return fields;
    }

    /**
     * Records are always publicly readable and writable in this deployment
     */
    @JsonProperty(ACL)
    public Map<String, Map<String, Boolean>> getAcl() {
        return Map.of("*", Map.of("read", true, "write", true));
    }

    /**
     * Value of a user or built-in field, or null when the record has no such field
     */
    public FieldValue getFieldValue(String name) {
        switch (name) {
            case OBJECT_ID:
                return objectId != null ? FieldValue.string(objectId) : null;
            case CREATED_AT:
                return createdAt != null ? FieldValue.date(createdAt) : null;
            case UPDATED_AT:
                return updatedAt != null ? FieldValue.date(updatedAt) : null;
            default:
                return fields.get(name);
        }
    }

    /**
     * Copy of this record with the given values laid over its fields; untouched fields are kept
     */
    public DataRecord mergedWith(Map<String, FieldValue> changes) {
        Map<String, FieldValue> merged = new LinkedHashMap<>(fields);
        merged.putAll(changes);
        return toBuilder().fields(merged).build();
    }

    /**
     * User fields as plain JSON values
     */
    public Map<String, Object> fieldsAsJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        fields.forEach((name, value) -> json.put(name, value.toJson()));
        return json;
    }
}
