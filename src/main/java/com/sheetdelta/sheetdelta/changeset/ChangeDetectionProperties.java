package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.SnapshotConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized ruleset bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "changes")
public class ChangeDetectionProperties {

    private Priority defaultPriority = ChangeDetectionConstants.DEFAULT_PRIORITY;
    private int maxCascadeDepth = ChangeDetectionConstants.DEFAULT_MAX_CASCADE_DEPTH;
    private double minConfidence = ChangeDetectionConstants.DEFAULT_MIN_CONFIDENCE;
    private String listIdentityKey = SnapshotConstants.DEFAULT_LIST_IDENTITY_KEY;
    private List<Pattern> patterns = new ArrayList<>();
    private LevelHitPoints levelHitPoints = new LevelHitPoints();
    private ScoreIncrease scoreIncrease = new ScoreIncrease();
    private FeatureResource featureResource = new FeatureResource();
    private List<KeywordRuleEntry> keywordRules = new ArrayList<>();
    private List<CausalRuleEntry> causalRules = new ArrayList<>();

    public Priority getDefaultPriority() {
        return defaultPriority;
    }

    public void setDefaultPriority(Priority defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public int getMaxCascadeDepth() {
        return maxCascadeDepth;
    }

    public void setMaxCascadeDepth(int maxCascadeDepth) {
        this.maxCascadeDepth = maxCascadeDepth;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public String getListIdentityKey() {
        return listIdentityKey;
    }

    public void setListIdentityKey(String listIdentityKey) {
        this.listIdentityKey = listIdentityKey;
    }

    public List<Pattern> getPatterns() {
        return patterns;
    }

    public void setPatterns(List<Pattern> patterns) {
        this.patterns = patterns;
    }

    public LevelHitPoints getLevelHitPoints() {
        return levelHitPoints;
    }

    public void setLevelHitPoints(LevelHitPoints levelHitPoints) {
        this.levelHitPoints = levelHitPoints;
    }

    public ScoreIncrease getScoreIncrease() {
        return scoreIncrease;
    }

    public void setScoreIncrease(ScoreIncrease scoreIncrease) {
        this.scoreIncrease = scoreIncrease;
    }

    public FeatureResource getFeatureResource() {
        return featureResource;
    }

    public void setFeatureResource(FeatureResource featureResource) {
        this.featureResource = featureResource;
    }

    public List<KeywordRuleEntry> getKeywordRules() {
        return keywordRules;
    }

    public void setKeywordRules(List<KeywordRuleEntry> keywordRules) {
        this.keywordRules = keywordRules;
    }

    public List<CausalRuleEntry> getCausalRules() {
        return causalRules;
    }

    public void setCausalRules(List<CausalRuleEntry> causalRules) {
        this.causalRules = causalRules;
    }

    /**
     * One {@code changes.patterns[n]} entry.
     */
    public static class Pattern {

        private String pattern;
        private Priority priority;

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public Priority getPriority() {
            return priority;
        }

        public void setPriority(Priority priority) {
            this.priority = priority;
        }
    }

    public static class LevelHitPoints {

        private boolean enabled = true;
        private String cause = ChangeDetectionConstants.DEFAULT_LEVEL_PATH;
        private String effect = ChangeDetectionConstants.DEFAULT_HIT_POINTS_PATH;
        private boolean scoped;
        private double confidence = ChangeDetectionConstants.DEFAULT_LEVEL_HIT_POINTS_CONFIDENCE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCause() {
            return cause;
        }

        public void setCause(String cause) {
            this.cause = cause;
        }

        public String getEffect() {
            return effect;
        }

        public void setEffect(String effect) {
            this.effect = effect;
        }

        /**
         * When set, cause and effect are suffixes below a shared scope instead of whole paths.
         */
        public boolean isScoped() {
            return scoped;
        }

        public void setScoped(boolean scoped) {
            this.scoped = scoped;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }
    }

    public static class ScoreIncrease {

        private boolean enabled = true;
        private String markerKey = ChangeDetectionConstants.DEFAULT_SCORE_INCREASE_MARKER;
        private double confidence = ChangeDetectionConstants.DEFAULT_SCORE_INCREASE_CONFIDENCE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMarkerKey() {
            return markerKey;
        }

        public void setMarkerKey(String markerKey) {
            this.markerKey = markerKey;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }
    }

    public static class FeatureResource {

        private boolean enabled = true;
        private String featureRoot = ChangeDetectionConstants.DEFAULT_FEATURE_ROOT;
        private String resourceRoot = ChangeDetectionConstants.DEFAULT_RESOURCE_ROOT;
        private double confidence = ChangeDetectionConstants.DEFAULT_FEATURE_RESOURCE_CONFIDENCE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFeatureRoot() {
            return featureRoot;
        }

        public void setFeatureRoot(String featureRoot) {
            this.featureRoot = featureRoot;
        }

        public String getResourceRoot() {
            return resourceRoot;
        }

        public void setResourceRoot(String resourceRoot) {
            this.resourceRoot = resourceRoot;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }
    }

    /**
     * Declarative causal rule: changes at {@code trigger} explain changes at any {@code affected} pattern.
     */
    public static class CausalRuleEntry {

        private String name;
        private String trigger;
        private List<String> affected = new ArrayList<>();
        private List<ChangeKind> triggerKinds = new ArrayList<>();
        private double confidence = ChangeDetectionConstants.DEFAULT_PATTERN_RULE_CONFIDENCE;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTrigger() {
            return trigger;
        }

        public void setTrigger(String trigger) {
            this.trigger = trigger;
        }

        public List<String> getAffected() {
            return affected;
        }

        public void setAffected(List<String> affected) {
            this.affected = affected;
        }

        public List<ChangeKind> getTriggerKinds() {
            return triggerKinds;
        }

        public void setTriggerKinds(List<ChangeKind> triggerKinds) {
            this.triggerKinds = triggerKinds;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }
    }

    /**
     * Rule family matched on path fragments, e.g. triggers {@code inventory} affecting {@code armor_class}.
     */
    public static class KeywordRuleEntry {

        private String name;
        private List<String> triggers = new ArrayList<>();
        private List<String> affected = new ArrayList<>();
        private List<ChangeKind> triggerKinds = new ArrayList<>();
        private double confidence = ChangeDetectionConstants.DEFAULT_KEYWORD_RULE_CONFIDENCE;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getTriggers() {
            return triggers;
        }

        public void setTriggers(List<String> triggers) {
            this.triggers = triggers;
        }

        public List<String> getAffected() {
            return affected;
        }

        public void setAffected(List<String> affected) {
            this.affected = affected;
        }

        public List<ChangeKind> getTriggerKinds() {
            return triggerKinds;
        }

        public void setTriggerKinds(List<ChangeKind> triggerKinds) {
            this.triggerKinds = triggerKinds;
        }

        public double getConfidence() {
            return confidence;
        }

        public void setConfidence(double confidence) {
            this.confidence = confidence;
        }
    }
}
