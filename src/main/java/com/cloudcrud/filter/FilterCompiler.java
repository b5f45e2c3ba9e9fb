package com.cloudcrud.filter;

import com.cloudcrud.exception.ValidationException;
import com.cloudcrud.model.FieldValue;
import com.cloudcrud.model.FilterCondition;
import com.cloudcrud.model.FilterCondition.Operator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Compiles a JSON filter specification into the list of predicates to AND together.
 *
 * <p>Each entry maps a field name either to a literal, compiled to an equality
 * predicate, or to an operator object such as {@code {"$gte": 10, "$lte": 20}},
 * compiled to one predicate per recognized operator. Recognized operators are read
 * in the fixed order $gt, $lt, $gte, $lte, $ne, $in. Any other key in an operator
 * object is skipped, or rejected when strict operator checking is enabled.
 */
@Component
@Slf4j
public class FilterCompiler {

    private static final List<Operator> OPERATOR_ORDER = List.of(
            Operator.GREATER_THAN,
            Operator.LESS_THAN,
            Operator.GREATER_EQUAL,
            Operator.LESS_EQUAL,
            Operator.NOT_EQUALS,
            Operator.IN
    );

    @Value("${cloudcrud.filters.reject-unknown-operators:false}")
    private boolean rejectUnknownOperators;

    public FilterCompiler() {
    }

    public FilterCompiler(boolean rejectUnknownOperators) {
        this.rejectUnknownOperators = rejectUnknownOperators;
    }

    /**
     * Compile a filter specification; null or empty compiles to no predicates (match everything)
     */
    public List<FilterCondition> compile(Map<String, ?> filterSpec) {
        if (filterSpec == null || filterSpec.isEmpty()) {
            return Collections.emptyList();
        }

        List<FilterCondition> predicates = new ArrayList<>();
        for (Map.Entry<String, ?> entry : filterSpec.entrySet()) {
            String field = entry.getKey();
            Object spec = entry.getValue();

            if (isOperatorObject(spec)) {
                compileOperators(field, (Map<?, ?>) spec, predicates);
            } else {
                predicates.add(FilterCondition.of(field, Operator.EQUALS, FieldValue.of(spec)));
            }
        }

        log.debug("Compiled filter on {} field(s) into {} predicate(s)", filterSpec.size(), predicates.size());
        return predicates;
    }

    private boolean isOperatorObject(Object spec) {
        return spec instanceof Map && !FieldValue.isEncodedLiteral((Map<?, ?>) spec);
    }

    private void compileOperators(String field, Map<?, ?> operators, List<FilterCondition> predicates) {
        if (rejectUnknownOperators) {
            for (Object key : operators.keySet()) {
                if (OPERATOR_ORDER.stream().noneMatch(op -> op.getSymbol().equals(key))) {
                    throw new ValidationException(
                            "Unsupported filter operator '" + key + "' on field '" + field + "'");
                }
            }
        }

        for (Operator operator : OPERATOR_ORDER) {
            if (!operators.containsKey(operator.getSymbol())) {
                continue;
            }
            Object operand = operators.get(operator.getSymbol());
            if (operator == Operator.IN) {
                predicates.add(FilterCondition.builder()
                        .key(field)
                        .operator(Operator.IN)
                        .values(operandSet(operand))
                        .build());
            } else {
                predicates.add(FilterCondition.of(field, operator, FieldValue.of(operand)));
            }
        }
    }

    private List<FieldValue> operandSet(Object operand) {
        if (operand == null) {
            return Collections.emptyList();
        }
        if (operand instanceof Collection) {
            List<FieldValue> values = new ArrayList<>();
            for (Object element : (Collection<?>) operand) {
                values.add(FieldValue.of(element));
            }
            return values;
        }
        return List.of(FieldValue.of(operand));
    }
}
