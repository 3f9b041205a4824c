package com.agentgraph.schema;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Length bounds, {@code pattern} and the {@code date-time} format, applied to strings only.
 */
@Getter
public class StringConstraint implements Constraint {

    private final Integer minLength;
    private final Integer maxLength;
    private final Pattern pattern;
    private final boolean dateTime;

    public StringConstraint(Integer minLength, Integer maxLength, Pattern pattern, boolean dateTime) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.pattern = pattern;
        this.dateTime = dateTime;
    }

    @Override
    public void check(JsonNode value, String path, List<Violation> violations) {
        if (value == null || !value.isTextual()) {
            return;
        }
        String text = value.textValue();
        if (minLength != null && text.length() < minLength) {
            violations.add(new Violation(path, String.format("%s must have length >= %d, got %d",
                    path, minLength, text.length())));
        }
        if (maxLength != null && text.length() > maxLength) {
            violations.add(new Violation(path, String.format("%s must have length <= %d, got %d",
                    path, maxLength, text.length())));
        }
        if (pattern != null && !pattern.matcher(text).find()) {
            violations.add(new Violation(path, String.format("%s must match pattern %s, got %s",
                    path, pattern.pattern(), value)));
        }
        if (dateTime && !DateTimes.isParseable(text)) {
            violations.add(new Violation(path, String.format("%s must be a valid date-time string, got %s",
                    path, value)));
        }
    }
}
