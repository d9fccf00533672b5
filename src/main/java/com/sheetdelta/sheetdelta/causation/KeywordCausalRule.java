package com.sheetdelta.sheetdelta.causation;

import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rule family matched on path fragments: a change whose rendered path contains any trigger keyword
 * explains changes whose path contains any affected keyword. Keywords are case-insensitive substrings,
 * so {@code skill} covers {@code skills.stealth} and {@code saving_throws.dex.skill_bonus} alike.
 */
public class KeywordCausalRule implements CausalRule {

    private final String name;
    private final List<String> triggers;
    private final List<String> affected;
    private final Set<ChangeKind> triggerKinds;
    private final double confidence;

    public KeywordCausalRule(
            String name,
            List<String> triggers,
            List<String> affected,
            Set<ChangeKind> triggerKinds,
            double confidence
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.triggers = normalize(triggers);
        this.affected = normalize(affected);
        if (this.triggers.isEmpty() || this.affected.isEmpty()) {
            throw new IllegalArgumentException("Keyword rule '" + name + "' needs trigger and affected keywords");
        }
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
        if (!containsAny(effect.path(), affected)) {
            return Optional.empty();
        }
        for (FieldChange candidate : context.candidates()) {
            if (triggerKinds.contains(candidate.kind()) && containsAny(candidate.path(), triggers)) {
                return Optional.of(new CausalMatch(candidate, confidence));
            }
        }
        return Optional.empty();
    }

    private static boolean containsAny(FieldPath path, List<String> keywords) {
        String rendered = path.toString().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (rendered.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(List<String> keywords) {
        return Objects.requireNonNull(keywords, "keywords").stream()
                .filter(Objects::nonNull)
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .filter(keyword -> !keyword.isEmpty())
                .toList();
    }
}
