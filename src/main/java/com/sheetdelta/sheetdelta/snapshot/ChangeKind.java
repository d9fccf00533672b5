package com.sheetdelta.sheetdelta.snapshot;

/**
 * Kind of one atomic difference. Declaration order is the tie-break order for changes sharing a path.
 */
public enum ChangeKind {
    REMOVED,
    MODIFIED,
    ADDED
}
