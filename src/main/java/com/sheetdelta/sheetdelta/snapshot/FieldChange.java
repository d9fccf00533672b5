package com.sheetdelta.sheetdelta.snapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * One atomic difference between two snapshots.
 * <p>
 * An absent value is represented by {@code null}; the kind tells absence apart from an explicit
 * null scalar, which is why {@code ADDED} never has an old value and {@code REMOVED} never has a new one.
 */
public record FieldChange(
        FieldPath path,
        ChangeKind kind,
        Object oldValue,
        Object newValue
) {

    public FieldChange {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case MODIFIED -> {
                if (Objects.equals(oldValue, newValue)) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_ILLEGAL_MODIFIED.formatted(path));
                }
            }
            case ADDED -> {
                if (oldValue != null) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_ILLEGAL_ADDED.formatted(path));
                }
            }
            case REMOVED -> {
                if (newValue != null) {
                    throw new IllegalArgumentException(SnapshotConstants.MSG_ILLEGAL_REMOVED.formatted(path));
                }
            }
        }
    }

    public static FieldChange added(FieldPath path, Object newValue) {
        return new FieldChange(path, ChangeKind.ADDED, null, newValue);
    }

    public static FieldChange removed(FieldPath path, Object oldValue) {
        return new FieldChange(path, ChangeKind.REMOVED, oldValue, null);
    }

    public static FieldChange modified(FieldPath path, Object oldValue, Object newValue) {
        return new FieldChange(path, ChangeKind.MODIFIED, oldValue, newValue);
    }

    /**
     * New minus old value when this is a modification between two numbers.
     */
    public Optional<Double> numericDelta() {
        if (kind == ChangeKind.MODIFIED && oldValue instanceof Number before && newValue instanceof Number after) {
            return Optional.of(after.doubleValue() - before.doubleValue());
        }
        return Optional.empty();
    }

    public boolean increased() {
        return numericDelta().map(delta -> delta > 0).orElse(false);
    }

    public boolean decreased() {
        return numericDelta().map(delta -> delta < 0).orElse(false);
    }

    public String category() {
        return path.category();
    }
}
