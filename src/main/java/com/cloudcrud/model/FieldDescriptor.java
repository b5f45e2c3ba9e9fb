package com.cloudcrud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Type descriptor of one field in a class schema
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDescriptor {

    @JsonIgnore
    private FieldType fieldType;

    // Only set for pointers
    private String targetClass;

    @JsonProperty("type")
    public String getType() {
        return fieldType != null ? fieldType.getDisplayName() : null;
    }

    public static FieldDescriptor of(FieldType type) {
        return FieldDescriptor.builder().fieldType(type).build();
    }

    public static FieldDescriptor pointer(String targetClass) {
        return FieldDescriptor.builder()
                .fieldType(FieldType.POINTER)
                .targetClass(targetClass)
                .build();
    }

    /**
     * Descriptor inferred from a value, or null for NULL values which do not fix a type
     */
    public static FieldDescriptor infer(FieldValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.getType() == FieldType.POINTER) {
            return pointer(value.asPointer().getClassName());
        }
        return of(value.getType());
    }

    /**
     * Render as "Pointer<User>" / "String" for error messages
     */
    public String describe() {
        if (fieldType == FieldType.POINTER) {
            return "Pointer<" + targetClass + ">";
        }
        return getType();
    }
}
