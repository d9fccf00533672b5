package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausationLink;
import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.Objects;

/**
 * A classified change with its explanation; {@code link} is {@code null} for an orphan.
 */
public record ChangeEntry(
        FieldChange change,
        Priority priority,
        CausationLink link,
        boolean orphan
) {

    public ChangeEntry {
        Objects.requireNonNull(change, "change");
        Objects.requireNonNull(priority, "priority");
        if (orphan != (link == null)) {
            throw new IllegalArgumentException("An entry is an orphan exactly when it has no causation link: " + change.path());
        }
    }

    public static ChangeEntry of(FieldChange change, Priority priority, CausationLink link) {
        return new ChangeEntry(change, priority, link, link == null);
    }
}
