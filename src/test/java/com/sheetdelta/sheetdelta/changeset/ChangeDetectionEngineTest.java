package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausalRule;
import com.sheetdelta.sheetdelta.causation.CausationLink;
import com.sheetdelta.sheetdelta.causation.NumericIncreaseRule;
import com.sheetdelta.sheetdelta.causation.PathPatternCausalRule;
import com.sheetdelta.sheetdelta.causation.ScoreIncreaseMarkerRule;
import com.sheetdelta.sheetdelta.priority.FieldPattern;
import com.sheetdelta.sheetdelta.priority.PatternRule;
import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;
import com.sheetdelta.sheetdelta.snapshot.MalformedSnapshotException;
import com.sheetdelta.sheetdelta.snapshot.Snapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeDetectionEngineTest {

    private final ChangeDetectionEngine engine = new ChangeDetectionEngine();

    @Test
    void shouldExplainHitPointGainByLevelUp() {
        CausalRule levelToHp = NumericIncreaseRule.scoped(
                "level_hp", FieldPattern.compile("level"), FieldPattern.compile("hp_max"), 0.9);
        EngineConfig config = EngineConfig.of(List.of(), Priority.MEDIUM).withCausalRules(List.of(levelToHp), 3, 0.7);

        ChangeSet changeSet = engine.computeChangeSet(
                Snapshot.of(Map.of("level", 3, "hp_max", 24)),
                Snapshot.of(Map.of("level", 4, "hp_max", 30)),
                config
        );

        assertEquals(2, changeSet.entries().size());
        ChangeEntry hp = entryAt(changeSet, "hp_max");
        ChangeEntry level = entryAt(changeSet, "level");
        assertEquals(ChangeKind.MODIFIED, hp.change().kind());
        assertEquals(level.change(), hp.link().cause());
        assertEquals(1, hp.link().depth());
        assertTrue(level.orphan());
    }

    @Test
    void shouldExplainAbilityGainByAddedFeat() {
        CausalRule marker = new ScoreIncreaseMarkerRule("asi", "grants_score_increase", 0.85);
        EngineConfig config = EngineConfig.of(List.of(), Priority.LOW).withCausalRules(List.of(marker), 3, 0.5);

        ChangeSet changeSet = engine.computeChangeSet(
                Snapshot.of(Map.of("feats", List.of(), "cha", 16)),
                Snapshot.of(Map.of("feats", List.of(Map.of("id", "lucky", "grants_score_increase", "cha")), "cha", 18)),
                config
        );

        ChangeEntry cha = entryAt(changeSet, "cha");
        ChangeEntry feat = entryAt(changeSet, "feats[id=lucky]");
        assertEquals(ChangeKind.ADDED, feat.change().kind());
        assertEquals(feat.change(), cha.link().cause());
        assertEquals("asi", cha.link().ruleName());
    }

    @Test
    void shouldKeepIgnoredChangesOutOfNotifiableView() {
        EngineConfig config = EngineConfig.of(List.of(
                PatternRule.of("combat.hit_points.current", Priority.IGNORED),
                PatternRule.of("combat.*", Priority.MEDIUM)
        ), Priority.LOW);

        ChangeSet changeSet = engine.computeChangeSet(
                Snapshot.of(Map.of("combat", Map.of("hit_points", Map.of("current", 20), "armor_class", 15))),
                Snapshot.of(Map.of("combat", Map.of("hit_points", Map.of("current", 12), "armor_class", 16))),
                config
        );

        assertEquals(Priority.MEDIUM, entryAt(changeSet, "combat.armor_class").priority());
        assertEquals(Priority.IGNORED, entryAt(changeSet, "combat.hit_points.current").priority());
        assertEquals(1, changeSet.notifiable().size());
        assertEquals(Priority.IGNORED, changeSet.entries().get(changeSet.entries().size() - 1).priority());
    }

    @Test
    void shouldReportFieldModificationsForReusedInventoryId() {
        EngineConfig config = EngineConfig.of(List.of(PatternRule.of("inventory[*].*", Priority.MEDIUM)), Priority.LOW);

        ChangeSet changeSet = engine.computeChangeSet(
                Snapshot.of(Map.of("inventory", List.of(Map.of("id", 7, "name", "Torch", "weight", 1.0)))),
                Snapshot.of(Map.of("inventory", List.of(Map.of("id", 7, "name", "Lantern", "weight", 2.0)))),
                config
        );

        List<FieldChange> changes = changeSet.entries().stream().map(ChangeEntry::change).toList();
        assertEquals(List.of(
                FieldChange.modified(FieldPath.parse("inventory[id=7].name"), "Torch", "Lantern"),
                FieldChange.modified(FieldPath.parse("inventory[id=7].weight"), 1.0, 2.0)
        ), changes);
    }

    @Test
    void shouldStopCascadeAtConfiguredDepth() {
        EngineConfig config = EngineConfig.of(List.of(), Priority.LOW)
                .withCausalRules(List.of(chain("a", "b"), chain("b", "c")), 2, 0.5);

        ChangeSet changeSet = engine.computeChangeSet(
                Snapshot.of(Map.of("a", 1, "b", 1, "c", 1)),
                Snapshot.of(Map.of("a", 2, "b", 2, "c", 2)),
                config
        );

        CausationLink toC = entryAt(changeSet, "c").link();
        assertEquals(FieldPath.of("b"), toC.cause().path());
        assertEquals(2, toC.depth());
        assertTrue(toC.cascadeTruncated());
        assertFalse(entryAt(changeSet, "b").link().cascadeTruncated());
        assertNull(entryAt(changeSet, "a").link());
    }

    @Test
    void shouldBeIdempotentAndEmptyForEqualSnapshots() {
        EngineConfig config = EngineConfig.of(List.of(PatternRule.of("*", Priority.HIGH)), Priority.LOW);
        Snapshot previous = Snapshot.of(Map.of("level", 3, "name", "Vex"));
        Snapshot current = Snapshot.of(Map.of("level", 4, "name", "Vex the Bold"));

        assertEquals(engine.computeChangeSet(previous, current, config), engine.computeChangeSet(previous, current, config));
        assertTrue(engine.computeChangeSet(current, current, config).entries().isEmpty());
    }

    @Test
    void shouldFailWholeInvocationOnMalformedSnapshot() {
        EngineConfig config = EngineConfig.of(List.of(), Priority.LOW);

        assertThrows(MalformedSnapshotException.class, () -> engine.computeChangeSet(
                Snapshot.empty(), Snapshot.of(Map.of("portrait", new byte[] {1, 2})), config));
    }

    @Test
    void shouldRejectInvalidEngineConfig() {
        assertThrows(IllegalArgumentException.class,
                () -> new EngineConfig(List.of(), Priority.LOW, List.of(), 0, 0.5, "id"));
        assertThrows(IllegalArgumentException.class,
                () -> new EngineConfig(List.of(), Priority.LOW, List.of(), 3, -0.1, "id"));
        assertThrows(IllegalArgumentException.class,
                () -> new EngineConfig(List.of(), Priority.LOW, List.of(chain("a", "b"), chain("a", "b")), 3, 0.5, "id"));
        assertEquals("id", new EngineConfig(List.of(), Priority.LOW, List.of(), 3, 0.5, " ").listIdentityKey());
    }

    private static CausalRule chain(String trigger, String affected) {
        return new PathPatternCausalRule(
                trigger + "_to_" + affected,
                FieldPattern.compile(trigger),
                List.of(FieldPattern.compile(affected)),
                Set.of(),
                0.8
        );
    }

    private static ChangeEntry entryAt(ChangeSet changeSet, String path) {
        FieldPath target = FieldPath.parse(path);
        return changeSet.entries().stream()
                .filter(entry -> entry.change().path().equals(target))
                .findFirst()
                .orElseThrow();
    }
}
