package com.sheetdelta.sheetdelta.priority;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assigns a priority to a change from an ordered list of pattern rules.
 * <p>
 * The matching rule with the highest specificity wins; among equally specific rules the one declared
 * first wins, so rule order is part of a ruleset's contract.
 */
public class PriorityClassifier {

    public Priority classify(FieldChange change, List<PatternRule> rules, Priority defaultPriority) {
        Objects.requireNonNull(change, "change");
        return classify(change.path(), rules, defaultPriority);
    }

    public Priority classify(FieldPath path, List<PatternRule> rules, Priority defaultPriority) {
        Objects.requireNonNull(defaultPriority, "defaultPriority");
        return bestMatch(path, rules).map(PatternRule::priority).orElse(defaultPriority);
    }

    /**
     * Returns the winning rule for a path, if any rule matches.
     */
    public Optional<PatternRule> bestMatch(FieldPath path, List<PatternRule> rules) {
        PatternRule best = null;
        for (PatternRule rule : rules) {
            if (!rule.pattern().matches(path)) {
                continue;
            }
            // strictly greater keeps the earlier rule on ties
            if (best == null || rule.specificity() > best.specificity()) {
                best = rule;
            }
        }
        return Optional.ofNullable(best);
    }
}
