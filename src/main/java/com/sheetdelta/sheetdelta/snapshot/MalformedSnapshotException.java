package com.sheetdelta.sheetdelta.snapshot;

/**
 * Raised when a snapshot holds a value that is neither a map, a list nor a scalar.
 */
public class MalformedSnapshotException extends IllegalArgumentException {

    private final FieldPath path;

    public MalformedSnapshotException(FieldPath path, String message) {
        super(message);
        this.path = path;
    }

    public FieldPath path() {
        return path;
    }
}
