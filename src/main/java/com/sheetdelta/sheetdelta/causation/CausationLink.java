package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;

/**
 * Explanation of {@code effect} by {@code cause}. {@code depth} counts hops from the unexplained root
 * change of the chain; {@code cascadeTruncated} marks links where the cascade search stopped.
 */
public record CausationLink(
        FieldChange effect,
        FieldChange cause,
        String ruleName,
        double confidence,
        int depth,
        boolean cascadeTruncated
) {
}
