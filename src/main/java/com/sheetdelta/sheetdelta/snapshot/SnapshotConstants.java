package com.sheetdelta.sheetdelta.snapshot;

/**
 * Shared constants for snapshot addressing and diffing.
 */
public final class SnapshotConstants {

    private SnapshotConstants() {
    }

    public static final String DEFAULT_LIST_IDENTITY_KEY = "id";

    /**
     * Tolerance applied when at least one side of a numeric comparison is floating point.
     */
    public static final double FLOAT_EPSILON = 0.001;

    public static final String MSG_PATH_NULL = "Field path must not be null";
    public static final String MSG_EMPTY_KEY = "Empty map key below path: '%s'";
    public static final String MSG_NEGATIVE_INDEX = "Negative list index %d below path: '%s'";
    public static final String MSG_PATH_EMPTY_SEGMENT = "Field path has an empty segment: '%s'";
    public static final String MSG_PATH_UNBALANCED = "Field path has unbalanced or empty brackets: '%s'";
    public static final String MSG_UNSUPPORTED_VALUE = "Unsupported value of type %s at path '%s'";
    public static final String MSG_AMBIGUOUS_KEY = "Map key '%s' contains a path separator or bracket at path '%s'";
    public static final String MSG_NON_STRING_KEY = "Non-string map key %s at path '%s'";
    public static final String MSG_ILLEGAL_MODIFIED = "Modified change at '%s' must carry differing values";
    public static final String MSG_ILLEGAL_ADDED = "Added change at '%s' must not carry an old value";
    public static final String MSG_ILLEGAL_REMOVED = "Removed change at '%s' must not carry a new value";
}
