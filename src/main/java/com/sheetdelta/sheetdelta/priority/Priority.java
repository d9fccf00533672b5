package com.sheetdelta.sheetdelta.priority;

/**
 * Importance tier of a change, lowest first.
 */
public enum Priority {
    IGNORED,
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Ignored changes are kept for audit but never reach notification-facing views.
     */
    public boolean isNotifiable() {
        return this != IGNORED;
    }

    public boolean isAtLeast(Priority other) {
        return compareTo(other) >= 0;
    }
}
