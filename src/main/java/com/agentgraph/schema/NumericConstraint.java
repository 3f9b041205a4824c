package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Inclusive {@code minimum} / {@code maximum} bounds, applied to numeric values only.
 */
@Getter
public class NumericConstraint implements Constraint {

    private final BigDecimal minimum;
    private final BigDecimal maximum;

    public NumericConstraint(BigDecimal minimum, BigDecimal maximum) {
        this.minimum = minimum;
        this.maximum = maximum;
    }

    @Override
    public void check(JsonNode value, String path, List<Violation> violations) {
        if (value == null || !value.isNumber()) {
            return;
        }
        BigDecimal actual = value.decimalValue();
        if (minimum != null && actual.compareTo(minimum) < 0) {
            violations.add(new Violation(path, String.format("%s must be >= %s, got %s",
                    path, JsonKinds.formatNumber(minimum), JsonKinds.formatNumber(actual))));
        }
        if (maximum != null && actual.compareTo(maximum) > 0) {
            violations.add(new Violation(path, String.format("%s must be <= %s, got %s",
                    path, JsonKinds.formatNumber(maximum), JsonKinds.formatNumber(actual))));
        }
    }
}
