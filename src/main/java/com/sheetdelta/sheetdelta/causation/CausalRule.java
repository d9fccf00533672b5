package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.Optional;

/**
 * Named, stateless predicate that explains one change by another change of the same change set.
 * <p>
 * Implementations must be pure functions of their arguments: they are shared across concurrent
 * invocations and may not cache anything between calls.
 */
public interface CausalRule {

    String name();

    /**
     * Looks for a cause of {@code effect} among {@link CausalContext#candidates()}.
     */
    Optional<CausalMatch> explain(FieldChange effect, CausalContext context);
}
