package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * View of the change set handed to a rule while it explains one effect.
 * <p>
 * The excluded set holds the effect itself and every change whose explanation chain already leads to the
 * effect; picking any of them as a cause would close a cycle.
 */
public final class CausalContext {

    private final List<FieldChange> changes;
    private final FieldChange effect;
    private final Set<FieldChange> excluded;

    CausalContext(List<FieldChange> changes, FieldChange effect, Set<FieldChange> excluded) {
        this.changes = changes;
        this.effect = effect;
        this.excluded = excluded;
    }

    /**
     * Every change of the invocation, in evaluation order.
     */
    public List<FieldChange> changes() {
        return changes;
    }

    public FieldChange effect() {
        return effect;
    }

    public boolean isExcluded(FieldChange change) {
        return excluded.contains(change);
    }

    /**
     * Changes that may legally be chosen as the cause of the current effect, in evaluation order.
     */
    public List<FieldChange> candidates() {
        List<FieldChange> candidates = new ArrayList<>(changes.size());
        for (FieldChange change : changes) {
            if (!excluded.contains(change)) {
                candidates.add(change);
            }
        }
        return Collections.unmodifiableList(candidates);
    }
}
