package com.sheetdelta.sheetdelta.priority;

import com.fasterxml.jackson.annotation.JsonValue;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;

import java.util.List;

/**
 * Field path with single-segment wildcards.
 * <p>
 * {@code *} matches exactly one segment of any kind and {@code [*]} matches exactly one list-element
 * segment. There is no multi-segment wildcard, so a pattern only ever matches paths of its own length.
 */
public final class FieldPattern {

    public static final String WILDCARD = "*";
    public static final String LIST_WILDCARD = "[*]";

    private final String text;
    private final List<String> segments;
    private final int specificity;

    private FieldPattern(String text, List<String> segments) {
        this.text = text;
        this.segments = segments;
        this.specificity = (int) segments.stream().filter(segment -> !isWildcard(segment)).count();
    }

    /**
     * Parses and validates a pattern; malformed syntax is rejected with {@link InvalidPatternException}.
     */
    public static FieldPattern compile(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidPatternException(String.valueOf(text), "pattern is blank");
        }
        String trimmed = text.trim();
        List<String> segments;
        try {
            segments = FieldPath.parse(trimmed).segments();
        } catch (IllegalArgumentException ex) {
            throw new InvalidPatternException(trimmed, ex.getMessage());
        }
        for (String segment : segments) {
            if (segment.contains(WILDCARD) && !isWildcard(segment)) {
                throw new InvalidPatternException(trimmed, "wildcard must fill a whole segment, found '" + segment + "'");
            }
        }
        return new FieldPattern(trimmed, List.copyOf(segments));
    }

    public boolean matches(FieldPath path) {
        List<String> pathSegments = path.segments();
        return pathSegments.size() == segments.size() && matchesFrom(pathSegments, 0);
    }

    /**
     * Whether the pattern matches the path segments starting at {@code offset} and running to the end.
     */
    public boolean matchesSuffix(FieldPath path, int offset) {
        List<String> pathSegments = path.segments();
        return offset >= 0 && pathSegments.size() - offset == segments.size() && matchesFrom(pathSegments, offset);
    }

    private boolean matchesFrom(List<String> pathSegments, int offset) {
        for (int i = 0; i < segments.size(); i++) {
            if (!segmentMatches(segments.get(i), pathSegments.get(offset + i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean segmentMatches(String patternSegment, String pathSegment) {
        if (WILDCARD.equals(patternSegment)) {
            return true;
        }
        if (LIST_WILDCARD.equals(patternSegment)) {
            return FieldPath.isListSegment(pathSegment);
        }
        return patternSegment.equals(pathSegment);
    }

    private static boolean isWildcard(String segment) {
        return WILDCARD.equals(segment) || LIST_WILDCARD.equals(segment);
    }

    /**
     * Number of literal (non-wildcard) segments; the more literal segments, the more specific the pattern.
     */
    public int specificity() {
        return specificity;
    }

    public int length() {
        return segments.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldPattern other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return text;
    }
}
