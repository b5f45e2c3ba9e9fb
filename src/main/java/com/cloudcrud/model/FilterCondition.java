package com.cloudcrud.model;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.OptionalInt;
import java.util.function.IntPredicate;

/**
 * Single predicate on one record field. A query is the conjunction of a list of these.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FilterCondition {

    public enum Operator {
        EQUALS("$eq"),
        GREATER_THAN("$gt"),
        LESS_THAN("$lt"),
        GREATER_EQUAL("$gte"),
        LESS_EQUAL("$lte"),
        NOT_EQUALS("$ne"),
        IN("$in");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private String key;                    // Field to filter on
    private Operator operator;             // Comparison operator
    private FieldValue value;              // Operand for single-value operators
    private List<FieldValue> values;       // Operand set for IN

    /**
     * Check if the record satisfies this predicate. A record without the field only
     * satisfies equality with null.
     */
    public boolean matches(DataRecord record) {
        if (record == null) {
            return false;
        }

        FieldValue actual = record.getFieldValue(key);
        if (actual == null || actual.isNull()) {
            return operator == Operator.EQUALS && (value == null || value.isNull());
        }

        switch (operator) {
            case EQUALS:
                return valueMatches(actual, value);

            case NOT_EQUALS:
                return !valueMatches(actual, value);

            case GREATER_THAN:
                return compare(actual, value, c -> c > 0);

            case GREATER_EQUAL:
                return compare(actual, value, c -> c >= 0);

            case LESS_THAN:
                return compare(actual, value, c -> c < 0);

            case LESS_EQUAL:
                return compare(actual, value, c -> c <= 0);

            case IN:
                return values != null && values.stream().anyMatch(v -> valueMatches(actual, v));

            default:
                return false;
        }
    }

    /**
     * Equality with document-store semantics: an array field matches a scalar operand it contains
     */
    private boolean valueMatches(FieldValue actual, FieldValue expected) {
        if (expected == null) {
            return false;
        }
        if (actual.equals(expected)) {
            return true;
        }
        return actual.getType() == FieldType.ARRAY
                && expected.getType() != FieldType.ARRAY
                && actual.asArray().contains(expected);
    }

    private boolean compare(FieldValue actual, FieldValue operand, IntPredicate test) {
        OptionalInt result = actual.compareWith(operand);
        return result.isPresent() && test.test(result.getAsInt());
    }

    // Builder helper methods for common conditions

    public static FilterCondition of(String key, Operator operator, FieldValue value) {
        return FilterCondition.builder()
                .key(key)
                .operator(operator)
                .value(value)
                .build();
    }

    public static FilterCondition equalTo(String key, Object value) {
        return of(key, Operator.EQUALS, FieldValue.of(value));
    }

    public static FilterCondition greaterThan(String key, Object value) {
        return of(key, Operator.GREATER_THAN, FieldValue.of(value));
    }

    public static FilterCondition containedIn(String key, List<?> values) {
        return FilterCondition.builder()
                .key(key)
                .operator(Operator.IN)
                .values(values.stream().map(FieldValue::of).toList())
                .build();
    }
}
