package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausalRule;
import com.sheetdelta.sheetdelta.priority.PatternRule;
import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.SnapshotConstants;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable ruleset passed into every computation. Rule order is significant for both lists.
 */
public record EngineConfig(
        List<PatternRule> patternRules,
        Priority defaultPriority,
        List<CausalRule> causalRules,
        int maxCascadeDepth,
        double minConfidence,
        String listIdentityKey
) {

    public EngineConfig {
        patternRules = List.copyOf(Objects.requireNonNull(patternRules, "patternRules"));
        Objects.requireNonNull(defaultPriority, "defaultPriority");
        causalRules = List.copyOf(Objects.requireNonNull(causalRules, "causalRules"));
        if (maxCascadeDepth < 1) {
            throw new IllegalArgumentException(ChangeDetectionConstants.MSG_INVALID_DEPTH.formatted(maxCascadeDepth));
        }
        if (Double.isNaN(minConfidence) || minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException(ChangeDetectionConstants.MSG_INVALID_CONFIDENCE.formatted(minConfidence));
        }
        if (listIdentityKey == null || listIdentityKey.isBlank()) {
            listIdentityKey = SnapshotConstants.DEFAULT_LIST_IDENTITY_KEY;
        }
        Set<String> names = new HashSet<>();
        for (CausalRule rule : causalRules) {
            if (!names.add(rule.name())) {
                throw new IllegalArgumentException(ChangeDetectionConstants.MSG_DUPLICATE_RULE_NAME.formatted(rule.name()));
            }
        }
    }

    /**
     * Config with only pattern rules and the default cascade settings.
     */
    public static EngineConfig of(List<PatternRule> patternRules, Priority defaultPriority) {
        return new EngineConfig(
                patternRules,
                defaultPriority,
                List.of(),
                ChangeDetectionConstants.DEFAULT_MAX_CASCADE_DEPTH,
                ChangeDetectionConstants.DEFAULT_MIN_CONFIDENCE,
                SnapshotConstants.DEFAULT_LIST_IDENTITY_KEY
        );
    }

    public EngineConfig withCausalRules(List<CausalRule> rules, int maxDepth, double threshold) {
        return new EngineConfig(patternRules, defaultPriority, rules, maxDepth, threshold, listIdentityKey);
    }
}
