package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.priority.FieldPattern;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative rule: a change matching the trigger pattern explains changes matching any affected pattern.
 * An empty kind set accepts triggers of every kind; the first matching trigger in path order is chosen.
 */
public class PathPatternCausalRule implements CausalRule {

    private final String name;
    private final FieldPattern trigger;
    private final List<FieldPattern> affected;
    private final Set<ChangeKind> triggerKinds;
    private final double confidence;

    public PathPatternCausalRule(
            String name,
            FieldPattern trigger,
            List<FieldPattern> affected,
            Set<ChangeKind> triggerKinds,
            double confidence
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.trigger = Objects.requireNonNull(trigger, "trigger");
        this.affected = List.copyOf(affected);
        this.triggerKinds = triggerKinds == null || triggerKinds.isEmpty()
                ? EnumSet.allOf(ChangeKind.class)
                : EnumSet.copyOf(triggerKinds);
        this.confidence = CausalMatch.requireConfidence(confidence);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CausalMatch> explain(FieldChange effect, CausalContext context) {
        boolean isAffected = affected.stream().anyMatch(pattern -> pattern.matches(effect.path()));
        if (!isAffected) {
            return Optional.empty();
        }
        for (FieldChange candidate : context.candidates()) {
            if (triggerKinds.contains(candidate.kind()) && trigger.matches(candidate.path())) {
                return Optional.of(new CausalMatch(candidate, confidence));
            }
        }
        return Optional.empty();
    }
}
