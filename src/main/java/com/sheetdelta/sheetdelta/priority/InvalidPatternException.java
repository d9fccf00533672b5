package com.sheetdelta.sheetdelta.priority;

/**
 * Raised while loading a ruleset when a field pattern has malformed wildcard or bracket syntax.
 */
public class InvalidPatternException extends IllegalArgumentException {

    private final String pattern;

    public InvalidPatternException(String pattern, String reason) {
        super("Invalid field pattern '%s': %s".formatted(pattern, reason));
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
