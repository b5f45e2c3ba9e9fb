package com.cloudcrud.model;

import com.cloudcrud.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Tagged value of a record field.
 *
 * <p>Decodes the JSON shapes callers send: strings, numbers, booleans, arrays,
 * nested objects, and the {@code __type} encoded dates and pointers:
 * <pre>
 * {"__type": "Date", "iso": "2024-05-01T10:00:00.000Z"}
 * {"__type": "Pointer", "className": "User", "objectId": "k2Zx9aP01q"}
 * </pre>
 */
public final class FieldValue {

    public static final FieldValue NULL = new FieldValue(FieldType.NULL, null);

    private static final String TYPE_KEY = "__type";

    private final FieldType type;
    private final Object value;

    private FieldValue(FieldType type, Object value) {
        this.type = type;
        this.value = value;
    }

    /**
     * Reference to another record
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pointer {
        private String className;
        private String objectId;
    }

    public static FieldValue string(String value) {
        return new FieldValue(FieldType.STRING, Objects.requireNonNull(value));
    }

    public static FieldValue number(Number value) {
        return new FieldValue(FieldType.NUMBER, Objects.requireNonNull(value));
    }

    public static FieldValue bool(boolean value) {
        return new FieldValue(FieldType.BOOLEAN, value);
    }

    public static FieldValue date(Instant value) {
        return new FieldValue(FieldType.DATE, Objects.requireNonNull(value));
    }

    public static FieldValue pointer(String className, String objectId) {
        return new FieldValue(FieldType.POINTER, new Pointer(className, objectId));
    }

    public static FieldValue array(List<FieldValue> elements) {
        return new FieldValue(FieldType.ARRAY, List.copyOf(elements));
    }

    public static FieldValue object(Map<String, FieldValue> entries) {
        return new FieldValue(FieldType.OBJECT, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    /**
     * Convert a decoded JSON value (or a plain Java value) into a tagged value
     *
     * @throws ValidationException for values that have no field representation
     */
    public static FieldValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof FieldValue) {
            return (FieldValue) raw;
        }
        if (raw instanceof String) {
            return string((String) raw);
        }
        if (raw instanceof Number) {
            return number((Number) raw);
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        if (raw instanceof Instant) {
            return date((Instant) raw);
        }
        if (raw instanceof Date) {
            return date(((Date) raw).toInstant());
        }
        if (raw instanceof Pointer) {
            Pointer p = (Pointer) raw;
            return pointer(p.getClassName(), p.getObjectId());
        }
        if (raw instanceof Collection) {
            Collection<?> collection = (Collection<?>) raw;
            List<FieldValue> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return array(elements);
        }
        if (raw instanceof Map) {
            return ofMap((Map<?, ?>) raw);
        }
        throw new ValidationException("Unsupported value type: " + raw.getClass().getSimpleName());
    }

    /**
     * Convert every entry of a decoded JSON object
     */
    public static Map<String, FieldValue> ofFields(Map<String, ?> raw) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        raw.forEach((key, value) -> fields.put(key, of(value)));
        return fields;
    }

    /**
     * Whether a decoded JSON object is a {@code __type} encoded literal rather than a plain mapping
     */
    public static boolean isEncodedLiteral(Map<?, ?> map) {
        return map.get(TYPE_KEY) instanceof String;
    }

    private static FieldValue ofMap(Map<?, ?> map) {
        if (isEncodedLiteral(map)) {
            String encodedType = (String) map.get(TYPE_KEY);
            switch (encodedType) {
                case "Date":
                    Object iso = map.get("iso");
                    if (!(iso instanceof String)) {
                        throw new ValidationException("Date value requires an 'iso' string");
                    }
                    try {
                        return date(Instant.parse((String) iso));
                    } catch (DateTimeParseException e) {
                        throw new ValidationException("Invalid date: " + iso, e);
                    }
                case "Pointer":
                    Object className = map.get("className");
                    Object objectId = map.get("objectId");
                    if (!(className instanceof String) || !(objectId instanceof String)) {
                        throw new ValidationException("Pointer value requires 'className' and 'objectId'");
                    }
                    return pointer((String) className, (String) objectId);
                default:
                    throw new ValidationException("Unsupported __type: " + encodedType);
            }
        }

        Map<String, FieldValue> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            entries.put(String.valueOf(entry.getKey()), of(entry.getValue()));
        }
        return object(entries);
    }

    public FieldType getType() {
        return type;
    }

    public boolean isNull() {
        return type == FieldType.NULL;
    }

    public String asString() {
        return (String) value;
    }

    public Number asNumber() {
        return (Number) value;
    }

    public boolean asBoolean() {
        return (Boolean) value;
    }

    public Instant asDate() {
        return (Instant) value;
    }

    public Pointer asPointer() {
        return (Pointer) value;
    }

    @SuppressWarnings("unchecked")
    public List<FieldValue> asArray() {
        return (List<FieldValue>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, FieldValue> asObject() {
        return (Map<String, FieldValue>) value;
    }

    /**
     * Order this value against another one. Numbers compare numerically, strings
     * lexicographically, dates chronologically and booleans false-before-true;
     * values of different types are not comparable.
     */
    public OptionalInt compareWith(FieldValue other) {
        if (other == null || type != other.type) {
            return OptionalInt.empty();
        }
        switch (type) {
            case NUMBER:
                return OptionalInt.of(decimal(asNumber()).compareTo(decimal(other.asNumber())));
            case STRING:
                return OptionalInt.of(asString().compareTo(other.asString()));
            case DATE:
                return OptionalInt.of(asDate().compareTo(other.asDate()));
            case BOOLEAN:
                return OptionalInt.of(Boolean.compare(asBoolean(), other.asBoolean()));
            default:
                return OptionalInt.empty();
        }
    }

    /**
     * Plain JSON-compatible representation, the inverse of {@link #of(Object)}
     */
    public Object toJson() {
        switch (type) {
            case NULL:
                return null;
            case DATE: {
                Map<String, Object> encoded = new LinkedHashMap<>();
                encoded.put(TYPE_KEY, "Date");
                encoded.put("iso", asDate().toString());
                return encoded;
            }
            case POINTER: {
                Map<String, Object> encoded = new LinkedHashMap<>();
                encoded.put(TYPE_KEY, "Pointer");
                encoded.put("className", asPointer().getClassName());
                encoded.put("objectId", asPointer().getObjectId());
                return encoded;
            }
            case ARRAY:
                return asArray().stream().map(FieldValue::toJson).toList();
            case OBJECT: {
                Map<String, Object> plain = new LinkedHashMap<>();
                asObject().forEach((k, v) -> plain.put(k, v.toJson()));
                return plain;
            }
            default:
                return value;
        }
    }

    private static BigDecimal decimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        return new BigDecimal(number.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue)) {
            return false;
        }
        FieldValue other = (FieldValue) o;
        if (type != other.type) {
            return false;
        }
        if (type == FieldType.NUMBER) {
            return decimal(asNumber()).compareTo(decimal(other.asNumber())) == 0;
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (type == FieldType.NUMBER) {
            return decimal(asNumber()).stripTrailingZeros().hashCode();
        }
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type.getDisplayName() + "(" + value + ")";
    }
}
