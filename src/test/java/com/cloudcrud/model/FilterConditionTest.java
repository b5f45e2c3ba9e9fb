package com.cloudcrud.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterCondition matching
 */
public class FilterConditionTest {

    private DataRecord testRecord;

    @BeforeEach
    public void setUp() {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("category", FieldValue.of("restaurant"));
        fields.put("rating", FieldValue.of(4.5));
        fields.put("price_range", FieldValue.of(25));
        fields.put("open", FieldValue.of(true));
        fields.put("tags", FieldValue.of(List.of("italian", "pizza")));
        fields.put("closedReason", FieldValue.NULL);

        testRecord = DataRecord.builder()
                .className("Place")
                .objectId("rec0000001")
                .createdAt(Instant.parse("2024-01-01T00:00:00Z"))
                .updatedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .fields(fields)
                .build();
    }

    @Test
    public void testEqualsFilter() {
        assertTrue(FilterCondition.equalTo("category", "restaurant").matches(testRecord));
        assertFalse(FilterCondition.equalTo("category", "cafe").matches(testRecord));
        assertFalse(FilterCondition.equalTo("nonexistent", "value").matches(testRecord));
        assertTrue(FilterCondition.equalTo("price_range", 25.0).matches(testRecord));
    }

    @Test
    public void testEqualsOnBuiltInFields() {
        assertTrue(FilterCondition.equalTo("objectId", "rec0000001").matches(testRecord));
        assertFalse(FilterCondition.equalTo("objectId", "other").matches(testRecord));
        assertTrue(FilterCondition.greaterThan("createdAt", Instant.parse("2023-12-31T00:00:00Z"))
                .matches(testRecord));
    }

    @Test
    public void testNumericComparisons() {
        assertTrue(FilterCondition.greaterThan("rating", 4.0).matches(testRecord));
        assertFalse(FilterCondition.greaterThan("rating", 5.0).matches(testRecord));
        assertFalse(FilterCondition.greaterThan("rating", 4.5).matches(testRecord));

        FilterCondition lt = FilterCondition.of("price_range", FilterCondition.Operator.LESS_THAN, FieldValue.of(30));
        assertTrue(lt.matches(testRecord));

        FilterCondition ge = FilterCondition.of("rating", FilterCondition.Operator.GREATER_EQUAL, FieldValue.of(4.5));
        assertTrue(ge.matches(testRecord));

        FilterCondition le = FilterCondition.of("price_range", FilterCondition.Operator.LESS_EQUAL, FieldValue.of(24));
        assertFalse(le.matches(testRecord));
    }

    @Test
    public void testComparisonAgainstOtherTypeNeverMatches() {
        assertFalse(FilterCondition.greaterThan("category", 1).matches(testRecord));
        assertFalse(FilterCondition.greaterThan("rating", "1").matches(testRecord));
    }

    @Test
    public void testMissingFieldNeverMatchesComparisons() {
        for (FilterCondition.Operator operator : Arrays.asList(
                FilterCondition.Operator.GREATER_THAN,
                FilterCondition.Operator.LESS_THAN,
                FilterCondition.Operator.GREATER_EQUAL,
                FilterCondition.Operator.LESS_EQUAL,
                FilterCondition.Operator.NOT_EQUALS)) {
            assertFalse(FilterCondition.of("missing", operator, FieldValue.of(1)).matches(testRecord), operator.name());
        }
        assertFalse(FilterCondition.containedIn("missing", List.of(1, 2)).matches(testRecord));
    }

    @Test
    public void testNotEquals() {
        FilterCondition ne = FilterCondition.of("category", FilterCondition.Operator.NOT_EQUALS, FieldValue.of("cafe"));
        assertTrue(ne.matches(testRecord));

        FilterCondition neSame = FilterCondition.of("category", FilterCondition.Operator.NOT_EQUALS,
                FieldValue.of("restaurant"));
        assertFalse(neSame.matches(testRecord));
    }

    @Test
    public void testInFilter() {
        assertTrue(FilterCondition.containedIn("category", List.of("restaurant", "bar")).matches(testRecord));
        assertFalse(FilterCondition.containedIn("category", List.of("cafe", "bar")).matches(testRecord));
        assertFalse(FilterCondition.containedIn("category", List.of()).matches(testRecord));
    }

    @Test
    public void testArrayFieldMatchesContainedValue() {
        assertTrue(FilterCondition.equalTo("tags", "pizza").matches(testRecord));
        assertFalse(FilterCondition.equalTo("tags", "sushi").matches(testRecord));
        assertTrue(FilterCondition.equalTo("tags", List.of("italian", "pizza")).matches(testRecord));
        assertTrue(FilterCondition.containedIn("tags", List.of("sushi", "italian")).matches(testRecord));
    }

    @Test
    public void testEqualsNullMatchesMissingOrNullFields() {
        assertTrue(FilterCondition.equalTo("missing", null).matches(testRecord));
        assertTrue(FilterCondition.equalTo("closedReason", null).matches(testRecord));
        assertFalse(FilterCondition.equalTo("category", null).matches(testRecord));
    }

    @Test
    public void testNullRecord() {
        assertFalse(FilterCondition.equalTo("category", "restaurant").matches(null));
    }
}
