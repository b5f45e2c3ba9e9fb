package com.cloudcrud.model;

import com.cloudcrud.exception.StoreException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Schema of a class: its name and the inferred type of each field
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TableDefinition {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    public static final Set<String> BUILT_IN_FIELDS = Set.of(
            DataRecord.OBJECT_ID, DataRecord.CREATED_AT, DataRecord.UPDATED_AT, DataRecord.ACL);

    private String className;

    @Builder.Default
    private Map<String, FieldDescriptor> fields = new LinkedHashMap<>();

    /**
     * New class carrying only the built-in fields
     */
    public static TableDefinition create(String className) {
        validateClassName(className);
        Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        fields.put(DataRecord.OBJECT_ID, FieldDescriptor.of(FieldType.STRING));
        fields.put(DataRecord.CREATED_AT, FieldDescriptor.of(FieldType.DATE));
        fields.put(DataRecord.UPDATED_AT, FieldDescriptor.of(FieldType.DATE));
        fields.put(DataRecord.ACL, FieldDescriptor.of(FieldType.OBJECT));
        return TableDefinition.builder().className(className).fields(fields).build();
    }

    public static void validateClassName(String className) {
        if (className == null || !NAME_PATTERN.matcher(className).matches()) {
            throw new StoreException("Invalid class name: " + className);
        }
    }

    public List<String> getFieldNames() {
        return new ArrayList<>(fields.keySet());
    }

    /**
     * Check a write against this schema and record the types of fields it introduces.
     * Nothing is recorded when any value conflicts.
     *
     * @return true if the schema changed
     * @throws StoreException on invalid field names or type conflicts
     */
    public boolean absorb(Map<String, FieldValue> values) {
        Map<String, FieldDescriptor> additions = new LinkedHashMap<>();
        for (Map.Entry<String, FieldValue> entry : values.entrySet()) {
            String name = entry.getKey();
            if (BUILT_IN_FIELDS.contains(name)) {
                throw new StoreException("Field " + name + " cannot be modified");
            }
            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new StoreException("Invalid field name: " + name);
            }
            FieldDescriptor inferred = FieldDescriptor.infer(entry.getValue());
            if (inferred != null) {
                checkAndCollect(name, inferred, additions);
            }
        }
        fields.putAll(additions);
        return !additions.isEmpty();
    }

    /**
     * Declare field types explicitly, with the same conflict rules as {@link #absorb(Map)}
     */
    public boolean declare(Map<String, FieldDescriptor> declared) {
        Map<String, FieldDescriptor> additions = new LinkedHashMap<>();
        declared.forEach((name, descriptor) -> {
            if (BUILT_IN_FIELDS.contains(name)) {
                throw new StoreException("Field " + name + " cannot be modified");
            }
            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new StoreException("Invalid field name: " + name);
            }
            checkAndCollect(name, descriptor, additions);
        });
        fields.putAll(additions);
        return !additions.isEmpty();
    }

    private void checkAndCollect(String name, FieldDescriptor incoming, Map<String, FieldDescriptor> additions) {
        FieldDescriptor existing = fields.containsKey(name) ? fields.get(name) : additions.get(name);
        if (existing == null) {
            additions.put(name, incoming);
        } else if (!existing.equals(incoming)) {
            throw new StoreException("schema mismatch for " + className + "." + name
                    + "; expected " + existing.describe() + " but got " + incoming.describe());
        }
    }

    /**
     * Pointer fields of this class that target the given class
     */
    public List<String> fieldsReferencing(String targetClass) {
        List<String> referencing = new ArrayList<>();
        fields.forEach((name, descriptor) -> {
            if (descriptor.getFieldType() == FieldType.POINTER && targetClass.equals(descriptor.getTargetClass())) {
                referencing.add(name);
            }
        });
        return referencing;
    }

    public TableDefinition copy() {
        return TableDefinition.builder()
                .className(className)
                .fields(new LinkedHashMap<>(fields))
                .build();
    }
}
