package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.priority.Priority;

import java.util.List;
import java.util.Map;

public final class ChangeSetModels {

    private ChangeSetModels() {
    }

    public record ComputeRequest(Map<String, Object> previous, Map<String, Object> current) {
    }

    public record PatternRuleResponse(String pattern, Priority priority, int specificity) {
    }

    public record RulesetResponse(
            List<PatternRuleResponse> patternRules,
            Priority defaultPriority,
            List<String> causalRules,
            int maxCascadeDepth,
            double minConfidence,
            String listIdentityKey
    ) {
    }
}
