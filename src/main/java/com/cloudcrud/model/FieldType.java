package com.cloudcrud.model;

/**
 * Type tags for dynamically typed record values.
 * The display name is what schema listings report for a field.
 */
public enum FieldType {
    STRING("String"),
    NUMBER("Number"),
    BOOLEAN("Boolean"),
    DATE("Date"),
    POINTER("Pointer"),
    ARRAY("Array"),
    OBJECT("Object"),
    NULL("Null");

    private final String displayName;

    FieldType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
