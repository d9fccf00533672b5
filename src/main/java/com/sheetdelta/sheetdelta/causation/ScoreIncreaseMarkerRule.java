package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An added entry (feat, item, feature) whose value carries the score-increase marker explains a raised
 * score at a path whose last key names the marked ability, e.g. {@code grants_score_increase: "cha"}
 * explains {@code abilities.cha: 16 -> 18}. The marker may hold one ability or a list of them.
 */
public class ScoreIncreaseMarkerRule implements CausalRule {

    private final String name;
    private final String markerKey;
    private final double confidence;

    public ScoreIncreaseMarkerRule(String name, String markerKey, double confidence) {
        this.name = Objects.requireNonNull(name, "name");
        this.markerKey = Objects.requireNonNull(markerKey, "markerKey");
        this.confidence = CausalMatch.requireConfidence(confidence);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<CausalMatch> explain(FieldChange effect, CausalContext context) {
        if (effect.kind() != ChangeKind.MODIFIED || !effect.increased()) {
            return Optional.empty();
        }
        String ability = effect.path().leafKey();
        if (ability.isEmpty()) {
            return Optional.empty();
        }

        for (FieldChange candidate : context.candidates()) {
            if (candidate.kind() == ChangeKind.ADDED
                    && candidate.newValue() instanceof Map<?, ?> added
                    && grants(added.get(markerKey), ability)) {
                return Optional.of(new CausalMatch(candidate, confidence));
            }
        }
        return Optional.empty();
    }

    private boolean grants(Object marker, String ability) {
        if (marker instanceof String single) {
            return single.equalsIgnoreCase(ability);
        }
        if (marker instanceof List<?> several) {
            for (Object entry : several) {
                if (entry instanceof String value && value.equalsIgnoreCase(ability)) {
                    return true;
                }
            }
        }
        return false;
    }
}
