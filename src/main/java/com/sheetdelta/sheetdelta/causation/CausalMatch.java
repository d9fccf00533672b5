package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.Objects;

/**
 * A cause proposed by a {@link CausalRule} together with the rule's confidence in it.
 */
public record CausalMatch(FieldChange cause, double confidence) {

    public CausalMatch {
        Objects.requireNonNull(cause, "cause");
        requireConfidence(confidence);
    }

    /**
     * Returns the confidence if it lies within {@code [0, 1]}.
     */
    public static double requireConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1], was " + confidence);
        }
        return confidence;
    }
}
