package com.sheetdelta.sheetdelta.changeset;

import com.sheetdelta.sheetdelta.causation.CausationLink;
import com.sheetdelta.sheetdelta.priority.Priority;
import com.sheetdelta.sheetdelta.snapshot.ChangeKind;
import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeSetAssemblerTest {

    private final ChangeSetAssembler assembler = new ChangeSetAssembler();

    @Test
    void shouldOrderByPriorityThenPathThenKind() {
        FieldChange speedRemoved = FieldChange.removed(FieldPath.of("speed"), 30);
        FieldChange speedAdded = FieldChange.added(FieldPath.of("speed"), Map.of("walk", 30));
        FieldChange armorClass = FieldChange.modified(FieldPath.parse("combat.armor_class"), 15, 16);
        FieldChange background = FieldChange.added(FieldPath.of("background"), "sage");
        FieldChange level = FieldChange.modified(FieldPath.parse("character_info.level"), 3, 4);
        Map<FieldPath, Priority> priorities = Map.of(
                FieldPath.of("speed"), Priority.MEDIUM,
                FieldPath.parse("combat.armor_class"), Priority.MEDIUM,
                FieldPath.of("background"), Priority.LOW,
                FieldPath.parse("character_info.level"), Priority.HIGH
        );

        ChangeSet changeSet = assembler.assemble(
                List.of(speedAdded, background, speedRemoved, armorClass, level),
                change -> priorities.get(change.path()),
                List.of()
        );

        List<FieldChange> ordered = changeSet.entries().stream().map(ChangeEntry::change).toList();
        assertEquals(List.of(level, armorClass, speedRemoved, speedAdded, background), ordered);
    }

    @Test
    void shouldAttachLinksAndMarkOrphans() {
        FieldChange level = FieldChange.modified(FieldPath.of("level"), 3, 4);
        FieldChange hpMax = FieldChange.modified(FieldPath.of("hp_max"), 24, 30);
        CausationLink link = new CausationLink(hpMax, level, "level_hp", 0.9, 1, false);

        ChangeSet changeSet = assembler.assemble(List.of(level, hpMax), change -> Priority.HIGH, List.of(link));

        ChangeEntry hpEntry = changeSet.entries().get(0);
        ChangeEntry levelEntry = changeSet.entries().get(1);
        assertEquals(hpMax, hpEntry.change());
        assertEquals(link, hpEntry.link());
        assertFalse(hpEntry.orphan());
        assertNull(levelEntry.link());
        assertTrue(levelEntry.orphan());
    }

    @Test
    void shouldRejectDuplicateChangeForSamePathAndKind() {
        FieldChange first = FieldChange.modified(FieldPath.of("level"), 3, 4);
        FieldChange second = FieldChange.modified(FieldPath.of("level"), 3, 5);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> assembler.assemble(List.of(first, second), change -> Priority.LOW, List.of()));

        assertTrue(ex.getMessage().contains(ChangeKind.MODIFIED.name()));
        assertTrue(ex.getMessage().contains("level"));
    }

    @Test
    void shouldProduceIdenticalResultForIdenticalInput() {
        List<FieldChange> changes = List.of(
                FieldChange.modified(FieldPath.of("b"), 1, 2),
                FieldChange.modified(FieldPath.of("a"), 1, 2),
                FieldChange.added(FieldPath.of("c"), 1)
        );

        assertEquals(
                assembler.assemble(changes, change -> Priority.LOW, List.of()),
                assembler.assemble(List.copyOf(changes), change -> Priority.LOW, List.of())
        );
    }
}
