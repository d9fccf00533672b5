package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausationLink;
import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Joins classified changes with their causation links into the final, ordered {@link ChangeSet}.
 */
public class ChangeSetAssembler {

    static final Comparator<ChangeEntry> ENTRY_ORDER = Comparator
            .comparing(ChangeEntry::priority, Comparator.reverseOrder())
            .thenComparing(entry -> entry.change().path())
            .thenComparing(entry -> entry.change().kind());

    /**
     * Builds the change set, failing if two changes share both path and kind.
     */
    public ChangeSet assemble(
            List<FieldChange> changes,
            Function<FieldChange, Priority> classifyFn,
            List<CausationLink> links
    ) {
        Set<ChangeKey> seen = new HashSet<>();
        for (FieldChange change : changes) {
            if (!seen.add(ChangeKey.of(change))) {
                throw new IllegalStateException(
                        ChangeDetectionConstants.MSG_DUPLICATE_CHANGE.formatted(change.kind(), change.path()));
            }
        }

        Map<ChangeKey, CausationLink> linkByEffect = new HashMap<>();
        for (CausationLink link : links) {
            linkByEffect.put(ChangeKey.of(link.effect()), link);
        }

        List<ChangeEntry> entries = new ArrayList<>(changes.size());
        for (FieldChange change : changes) {
            Priority priority = classifyFn.apply(change);
            entries.add(ChangeEntry.of(change, priority, linkByEffect.get(ChangeKey.of(change))));
        }
        entries.sort(ENTRY_ORDER);
        return new ChangeSet(entries);
    }

    private record ChangeKey(FieldPath path, ChangeKind kind) {

        static ChangeKey of(FieldChange change) {
            return new ChangeKey(change.path(), change.kind());
        }
    }
}
