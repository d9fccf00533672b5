package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausalRule;
import com.sheetdelta.sheetdelta.causation.FeatureResourceRule;
import com.sheetdelta.sheetdelta.causation.KeywordCausalRule;
import com.sheetdelta.sheetdelta.causation.NumericIncreaseRule;
import com.sheetdelta.sheetdelta.causation.PathPatternCausalRule;
import com.sheetdelta.sheetdelta.causation.ScoreIncreaseMarkerRule;
import com.sheetdelta.sheetdelta.priority.FieldPattern;
import com.sheetdelta.sheetdelta.priority.PatternRule;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Enables binding of the change ruleset and turns it into one validated {@link EngineConfig}.
 */
@Configuration
@EnableConfigurationProperties(ChangeDetectionProperties.class)
public class ChangeDetectionConfig {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetectionConfig.class);

    @Bean
    public EngineConfig engineConfig(ChangeDetectionProperties properties) {
        EngineConfig config = toEngineConfig(properties);
        log.info("Change ruleset loaded. patternRules={}, causalRules={}, maxCascadeDepth={}, minConfidence={}",
                config.patternRules().size(), config.causalRules().size(),
                config.maxCascadeDepth(), config.minConfidence());
        return config;
    }

    @Bean
    public ChangeDetectionEngine changeDetectionEngine() {
        return new ChangeDetectionEngine();
    }

    /**
     * Compiles every pattern and builds the causal rules; invalid input fails with an {@link IllegalArgumentException}.
     */
    static EngineConfig toEngineConfig(ChangeDetectionProperties properties) {
        List<PatternRule> patternRules = new ArrayList<>();
        for (ChangeDetectionProperties.Pattern entry : properties.getPatterns()) {
            if (entry.getPriority() == null) {
                throw new IllegalArgumentException(ChangeDetectionConstants.MSG_PRIORITY_REQUIRED.formatted(entry.getPattern()));
            }
            patternRules.add(PatternRule.of(entry.getPattern(), entry.getPriority()));
        }

        return new EngineConfig(
                patternRules,
                properties.getDefaultPriority(),
                causalRules(properties),
                properties.getMaxCascadeDepth(),
                properties.getMinConfidence(),
                properties.getListIdentityKey()
        );
    }

    private static List<CausalRule> causalRules(ChangeDetectionProperties properties) {
        List<CausalRule> rules = new ArrayList<>();

        ChangeDetectionProperties.LevelHitPoints levelHitPoints = properties.getLevelHitPoints();
        if (levelHitPoints.isEnabled()) {
            rules.add(new NumericIncreaseRule(
                    ChangeDetectionConstants.RULE_LEVEL_HIT_POINTS,
                    FieldPattern.compile(levelHitPoints.getCause()),
                    FieldPattern.compile(levelHitPoints.getEffect()),
                    levelHitPoints.isScoped(),
                    levelHitPoints.getConfidence()
            ));
        }

        ChangeDetectionProperties.ScoreIncrease scoreIncrease = properties.getScoreIncrease();
        if (scoreIncrease.isEnabled()) {
            rules.add(new ScoreIncreaseMarkerRule(
                    ChangeDetectionConstants.RULE_SCORE_INCREASE,
                    scoreIncrease.getMarkerKey(),
                    scoreIncrease.getConfidence()
            ));
        }

        ChangeDetectionProperties.FeatureResource featureResource = properties.getFeatureResource();
        if (featureResource.isEnabled()) {
            rules.add(new FeatureResourceRule(
                    ChangeDetectionConstants.RULE_FEATURE_RESOURCE,
                    featureResource.getFeatureRoot(),
                    featureResource.getResourceRoot(),
                    featureResource.getConfidence()
            ));
        }

        for (ChangeDetectionProperties.KeywordRuleEntry entry : properties.getKeywordRules()) {
            rules.add(new KeywordCausalRule(
                    entry.getName(),
                    entry.getTriggers(),
                    entry.getAffected(),
                    kinds(entry.getTriggerKinds()),
                    entry.getConfidence()
            ));
        }

        List<ChangeDetectionProperties.CausalRuleEntry> entries = properties.getCausalRules();
        for (int i = 0; i < entries.size(); i++) {
            ChangeDetectionProperties.CausalRuleEntry entry = entries.get(i);
            if (entry.getName() == null || entry.getName().isBlank()) {
                throw new IllegalArgumentException(ChangeDetectionConstants.MSG_RULE_NAME_REQUIRED.formatted(i));
            }
            if (entry.getAffected().isEmpty()) {
                throw new IllegalArgumentException(ChangeDetectionConstants.MSG_RULE_AFFECTED_REQUIRED.formatted(entry.getName()));
            }
            List<FieldPattern> affected = entry.getAffected().stream().map(FieldPattern::compile).toList();
            rules.add(new PathPatternCausalRule(
                    entry.getName(),
                    FieldPattern.compile(entry.getTrigger()),
                    affected,
                    kinds(entry.getTriggerKinds()),
                    entry.getConfidence()
            ));
        }
        return rules;
    }

    private static Set<ChangeKind> kinds(List<ChangeKind> configured) {
        return configured.isEmpty() ? EnumSet.allOf(ChangeKind.class) : EnumSet.copyOf(configured);
    }
}
