package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.priority.FieldPattern;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;

import java.util.Objects;
import java.util.Optional;

/**
 * A numeric increase at a path matching {@code cause} explains a numeric increase at a path matching
 * {@code effect}.
 * <p>
 * Unscoped, both patterns address whole paths: {@code character_info.level} explains
 * {@code combat.hit_points.maximum}. Scoped, both are suffixes below a shared scope {@code S}, so with
 * {@code level} and {@code hit_points.maximum} a level-up of {@code classes[id=fighter].level} explains
 * {@code classes[id=fighter].hit_points.maximum} but not the wizard's.
 */
public class NumericIncreaseRule implements CausalRule {

    private final String name;
    private final FieldPattern cause;
    private final FieldPattern effect;
    private final boolean scoped;
    private final double confidence;

    public NumericIncreaseRule(String name, FieldPattern cause, FieldPattern effect, boolean scoped, double confidence) {
        this.name = Objects.requireNonNull(name, "name");
        this.cause = Objects.requireNonNull(cause, "cause");
        this.effect = Objects.requireNonNull(effect, "effect");
        this.scoped = scoped;
        this.confidence = CausalMatch.requireConfidence(confidence);
    }

    /**
     * Rule over whole paths.
     */
    public static NumericIncreaseRule absolute(String name, FieldPattern cause, FieldPattern effect, double confidence) {
        return new NumericIncreaseRule(name, cause, effect, false, confidence);
    }

    /**
     * Rule over suffixes sharing one scope.
     */
    public static NumericIncreaseRule scoped(String name, FieldPattern causeSuffix, FieldPattern effectSuffix, double confidence) {
        return new NumericIncreaseRule(name, causeSuffix, effectSuffix, true, confidence);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CausalMatch> explain(FieldChange change, CausalContext context) {
        if (!change.increased()) {
            return Optional.empty();
        }
        int scopeLength = scoped ? change.path().depth() - effect.length() : 0;
        if (!effect.matchesSuffix(change.path(), scopeLength)) {
            return Optional.empty();
        }
        FieldPath scope = change.path().subPath(0, scopeLength);

        for (FieldChange candidate : context.candidates()) {
            if (candidate.increased()
                    && candidate.path().startsWith(scope)
                    && cause.matchesSuffix(candidate.path(), scopeLength)) {
                return Optional.of(new CausalMatch(candidate, confidence));
            }
        }
        return Optional.empty();
    }
}
