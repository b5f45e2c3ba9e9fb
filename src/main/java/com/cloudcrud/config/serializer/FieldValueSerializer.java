package com.cloudcrud.config.serializer;

import com.cloudcrud.model.FieldValue;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Custom Jackson serializer writing field values in their JSON wire form,
 * with dates and pointers as {@code __type} objects
 */
public class FieldValueSerializer extends JsonSerializer<FieldValue> {

    @Override
    public void serialize(FieldValue value, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (value == null || value.isNull()) {
            gen.writeNull();
            return;
        }
        gen.writeObject(value.toJson());
    }
}
