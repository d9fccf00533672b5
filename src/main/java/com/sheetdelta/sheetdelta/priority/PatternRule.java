package com.sheetdelta.sheetdelta.priority;

import java.util.Objects;

/**
 * Maps every change whose path matches {@code pattern} to {@code priority}.
 */
public record PatternRule(FieldPattern pattern, Priority priority) {

    public PatternRule {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(priority, "priority");
    }

    public static PatternRule of(String pattern, Priority priority) {
        return new PatternRule(FieldPattern.compile(pattern), priority);
    }

    public int specificity() {
        return pattern.specificity();
    }
}
