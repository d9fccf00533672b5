package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausalRule;
import com.sheetdelta.sheetdelta.snapshot.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ChangeSetService {

    private static final Logger log = LoggerFactory.getLogger(ChangeSetService.class);

    private final ChangeDetectionEngine engine;
    private final EngineConfig engineConfig;

    public ChangeSetService(ChangeDetectionEngine engine, EngineConfig engineConfig) {
        this.engine = engine;
        this.engineConfig = engineConfig;
    }

    /**
     * Computes the change set between two raw snapshots using the loaded ruleset.
     */
    public ChangeSet compute(ChangeSetModels.ComputeRequest request) {
        if (request == null || request.previous() == null || request.current() == null) {
            throw new IllegalArgumentException(ChangeDetectionConstants.MSG_SNAPSHOT_REQUIRED);
        }
        ChangeSet changeSet = engine.computeChangeSet(
                Snapshot.of(request.previous()), Snapshot.of(request.current()), engineConfig);
        ChangeSetSummary summary = changeSet.summary();
        log.info("Change set computed. changes={}, notifiable={}, orphans={}, truncated={}, highPriority={}",
                summary.totalChanges(), summary.notifiableChanges(), summary.orphanCount(),
                summary.truncatedCount(), summary.hasHighPriority());
        return changeSet;
    }

    public ChangeSetSummary summarize(ChangeSetModels.ComputeRequest request) {
        return compute(request).summary();
    }

    /**
     * Describes the ruleset every computation runs with.
     */
    public ChangeSetModels.RulesetResponse describeRuleset() {
        return new ChangeSetModels.RulesetResponse(
                engineConfig.patternRules().stream()
                        .map(rule -> new ChangeSetModels.PatternRuleResponse(
                                rule.pattern().toString(), rule.priority(), rule.specificity()))
                        .toList(),
                engineConfig.defaultPriority(),
                engineConfig.causalRules().stream().map(CausalRule::name).toList(),
                engineConfig.maxCascadeDepth(),
                engineConfig.minConfidence(),
                engineConfig.listIdentityKey()
        );
    }
}
