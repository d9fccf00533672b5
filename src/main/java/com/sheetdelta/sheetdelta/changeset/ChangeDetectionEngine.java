package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausationAnalyzer;
import com.sheetdelta.sheetdelta.causation.CausationLink;
import com.sheetdelta.sheetdelta.priority.PriorityClassifier;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.Snapshot;
import com.sheetdelta.sheetdelta.snapshot.SnapshotDiffer;

import java.util.List;
import java.util.Objects;

/**
 * Single entry point: diff, classify, explain and assemble. Holds no state between calls.
 */
public class ChangeDetectionEngine {

    private final SnapshotDiffer differ;
    private final PriorityClassifier classifier;
    private final CausationAnalyzer analyzer;
    private final ChangeSetAssembler assembler;

    public ChangeDetectionEngine() {
        this(new SnapshotDiffer(), new PriorityClassifier(), new CausationAnalyzer(), new ChangeSetAssembler());
    }

    public ChangeDetectionEngine(
            SnapshotDiffer differ,
            PriorityClassifier classifier,
            CausationAnalyzer analyzer,
            ChangeSetAssembler assembler
    ) {
        this.differ = differ;
        this.classifier = classifier;
        this.analyzer = analyzer;
        this.assembler = assembler;
    }

    /**
     * Computes the ordered, classified and explained changes between two snapshots.
     */
    public ChangeSet computeChangeSet(Snapshot previous, Snapshot current, EngineConfig config) {
        Objects.requireNonNull(config, "config");
        List<FieldChange> changes = differ.diff(previous, current, config.listIdentityKey());
        if (changes.isEmpty()) {
            return ChangeSet.empty();
        }
        List<CausationLink> links = analyzer.analyze(
                changes, config.causalRules(), config.maxCascadeDepth(), config.minConfidence());
        return assembler.assemble(
                changes,
                change -> classifier.classify(change, config.patternRules(), config.defaultPriority()),
                links
        );
    }
}
