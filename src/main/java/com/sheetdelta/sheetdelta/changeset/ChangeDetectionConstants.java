package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.priority.Priority;

/**
 * Shared defaults and messages for change detection.
 */
public final class ChangeDetectionConstants {

    private ChangeDetectionConstants() {
    }

    public static final Priority DEFAULT_PRIORITY = Priority.LOW;
    public static final int DEFAULT_MAX_CASCADE_DEPTH = 3;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

    public static final String RULE_LEVEL_HIT_POINTS = "level_hit_points";
    public static final String RULE_SCORE_INCREASE = "score_increase_marker";
    public static final String RULE_FEATURE_RESOURCE = "feature_resource";

    public static final String DEFAULT_LEVEL_PATH = "character_info.level";
    public static final String DEFAULT_HIT_POINTS_PATH = "combat.hit_points.maximum";
    public static final double DEFAULT_LEVEL_HIT_POINTS_CONFIDENCE = 0.95;
    public static final String DEFAULT_SCORE_INCREASE_MARKER = "grants_score_increase";
    public static final double DEFAULT_SCORE_INCREASE_CONFIDENCE = 0.85;
    public static final String DEFAULT_FEATURE_ROOT = "class_features";
    public static final String DEFAULT_RESOURCE_ROOT = "resources";
    public static final double DEFAULT_FEATURE_RESOURCE_CONFIDENCE = 0.8;
    public static final double DEFAULT_PATTERN_RULE_CONFIDENCE = 0.7;
    public static final double DEFAULT_KEYWORD_RULE_CONFIDENCE = 0.8;

    public static final String MSG_DUPLICATE_CHANGE = "Duplicate %s change emitted for path '%s'";
    public static final String MSG_INVALID_DEPTH = "maxCascadeDepth must be at least 1, was %d";
    public static final String MSG_INVALID_CONFIDENCE = "minConfidence must be within [0, 1], was %s";
    public static final String MSG_DUPLICATE_RULE_NAME = "Causal rule name declared twice: %s";
    public static final String MSG_RULE_NAME_REQUIRED = "Causal rule at index %d needs a name";
    public static final String MSG_RULE_AFFECTED_REQUIRED = "Causal rule '%s' needs at least one affected pattern";
    public static final String MSG_PRIORITY_REQUIRED = "Pattern rule '%s' needs a priority";
    public static final String MSG_SNAPSHOT_REQUIRED = "Both previous and current snapshots are required";
}
