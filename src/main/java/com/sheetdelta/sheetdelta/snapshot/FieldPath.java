package com.sheetdelta.sheetdelta.snapshot;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized address of one value inside a snapshot.
 * <p>
 * Map keys are joined with {@code .}; list elements are bracket segments, either positional
 * ({@code [3]}) or identity based ({@code [id=dagger-1]}). Each bracket selector is a segment of its
 * own, so {@code inventory[id=dagger-1].quantity} has the segments
 * {@code inventory}, {@code [id=dagger-1]} and {@code quantity}.
 */
public final class FieldPath implements Comparable<FieldPath> {

    private static final FieldPath ROOT = new FieldPath(List.of());

    private final List<String> segments;
    private final String rendered;

    private FieldPath(List<String> segments) {
        this.segments = segments;
        this.rendered = render(segments);
    }

    public static FieldPath root() {
        return ROOT;
    }

    /**
     * Builds a path from plain map keys, e.g. {@code FieldPath.of("combat", "hit_points", "maximum")}.
     */
    public static FieldPath of(String... keys) {
        FieldPath path = ROOT;
        for (String key : keys) {
            path = path.child(key);
        }
        return path;
    }

    /**
     * Parses the rendered form of a path. The empty string is the root path.
     */
    public static FieldPath parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_NULL);
        }
        if (text.isEmpty()) {
            return ROOT;
        }
        return new FieldPath(Collections.unmodifiableList(tokenize(text)));
    }

    public FieldPath child(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException(SnapshotConstants.MSG_EMPTY_KEY.formatted(rendered));
        }
        if (!isValidKey(key)) {
            throw new IllegalArgumentException(SnapshotConstants.MSG_AMBIGUOUS_KEY.formatted(key, rendered));
        }
        return append(key);
    }

    /**
     * Whether a map key renders as exactly one segment.
     */
    public static boolean isValidKey(String key) {
        return !key.isEmpty() && key.indexOf('.') < 0 && key.indexOf('[') < 0 && key.indexOf(']') < 0;
    }

    public FieldPath index(int position) {
        if (position < 0) {
            throw new IllegalArgumentException(SnapshotConstants.MSG_NEGATIVE_INDEX.formatted(position, rendered));
        }
        return append("[" + position + "]");
    }

    public FieldPath identity(String identityKey, String identityValue) {
        return append("[" + identityKey + "=" + identityValue + "]");
    }

    public List<String> segments() {
        return segments;
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    /**
     * Returns the enclosing path; the root is its own parent.
     */
    public FieldPath parent() {
        if (segments.size() <= 1) {
            return ROOT;
        }
        return new FieldPath(segments.subList(0, segments.size() - 1));
    }

    /**
     * Last segment, or the empty string for the root.
     */
    public String leaf() {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * Last plain map key of the path, skipping trailing list selectors.
     */
    public String leafKey() {
        for (int i = segments.size() - 1; i >= 0; i--) {
            if (!isListSegment(segments.get(i))) {
                return segments.get(i);
            }
        }
        return "";
    }

    /**
     * Top-level key used to group changes, e.g. {@code combat} for {@code combat.hit_points.maximum}.
     */
    public String category() {
        if (segments.isEmpty() || isListSegment(segments.get(0))) {
            return "";
        }
        return segments.get(0);
    }

    public boolean startsWith(FieldPath prefix) {
        return prefix.segments.size() <= segments.size()
                && segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    public FieldPath subPath(int fromInclusive, int toExclusive) {
        return new FieldPath(List.copyOf(segments.subList(fromInclusive, toExclusive)));
    }

    public static boolean isListSegment(String segment) {
        return segment.startsWith("[") && segment.endsWith("]");
    }

    /**
     * Name carried by a segment: the key itself, the identity value of {@code [id=x]}, or the index of {@code [n]}.
     */
    public static String segmentName(String segment) {
        if (!isListSegment(segment)) {
            return segment;
        }
        String inner = segment.substring(1, segment.length() - 1);
        int eq = inner.indexOf('=');
        return eq < 0 ? inner : inner.substring(eq + 1);
    }

    /**
     * Splits a rendered path into segments, rejecting empty segments and unbalanced brackets.
     */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder key = new StringBuilder();
        boolean afterDot = false;
        boolean afterBracket = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '[') {
                if (key.length() > 0) {
                    tokens.add(key.toString());
                    key.setLength(0);
                } else if (tokens.isEmpty() || afterDot) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_EMPTY_SEGMENT.formatted(text));
                }
                int close = text.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_UNBALANCED.formatted(text));
                }
                String inner = text.substring(i + 1, close);
                if (inner.isEmpty() || inner.indexOf('[') >= 0) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_UNBALANCED.formatted(text));
                }
                tokens.add("[" + inner + "]");
                i = close + 1;
                afterDot = false;
                afterBracket = true;
                continue;
            }
            if (c == ']') {
                throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_UNBALANCED.formatted(text));
            }
            if (c == '.') {
                if (key.length() > 0) {
                    tokens.add(key.toString());
                    key.setLength(0);
                } else if (!afterBracket) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_EMPTY_SEGMENT.formatted(text));
                }
                afterDot = true;
                afterBracket = false;
                i++;
                continue;
            }
            if (afterBracket) {
                throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_EMPTY_SEGMENT.formatted(text));
            }
            key.append(c);
            afterDot = false;
            i++;
        }
        if (key.length() > 0) {
            tokens.add(key.toString());
        } else if (afterDot) {
            throw new IllegalArgumentException(SnapshotConstants.MSG_PATH_EMPTY_SEGMENT.formatted(text));
        }
        return tokens;
    }

    private FieldPath append(String segment) {
        List<String> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new FieldPath(Collections.unmodifiableList(next));
    }

    private static String render(List<String> segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (sb.length() > 0 && !isListSegment(segment)) {
                sb.append('.');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(FieldPath other) {
        return rendered.compareTo(other.rendered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FieldPath other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return rendered;
    }
}
