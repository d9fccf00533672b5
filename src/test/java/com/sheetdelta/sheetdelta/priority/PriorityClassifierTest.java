package com.sheetdelta.sheetdelta.priority;

import com.sheetdelta.sheetdelta.snapshot.FieldChange;
import com.sheetdelta.sheetdelta.snapshot.FieldPath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriorityClassifierTest {

    private final PriorityClassifier classifier = new PriorityClassifier();

    @Test
    void shouldPreferExactRuleOverWildcardRule() {
        List<PatternRule> rules = List.of(
                PatternRule.of("combat.*.current", Priority.MEDIUM),
                PatternRule.of("combat.hit_points.current", Priority.IGNORED)
        );
        FieldChange damage = FieldChange.modified(FieldPath.parse("combat.hit_points.current"), 20, 12);

        assertEquals(Priority.IGNORED, classifier.classify(damage, rules, Priority.LOW));
    }

    @Test
    void shouldUseDefaultWhenNothingMatches() {
        List<PatternRule> rules = List.of(
                PatternRule.of("combat.hit_points.current", Priority.IGNORED),
                PatternRule.of("combat.*", Priority.MEDIUM)
        );

        assertEquals(Priority.LOW, classifier.classify(FieldPath.parse("background"), rules, Priority.LOW));
        assertEquals(Priority.MEDIUM, classifier.classify(FieldPath.parse("combat.armor_class"), rules, Priority.LOW));
    }

    @Test
    void shouldBreakSpecificityTiesByDeclarationOrder() {
        PatternRule first = PatternRule.of("abilities.*", Priority.HIGH);
        PatternRule second = PatternRule.of("*.cha", Priority.LOW);
        FieldPath cha = FieldPath.parse("abilities.cha");

        assertEquals(Priority.HIGH, classifier.classify(cha, List.of(first, second), Priority.MEDIUM));
        assertEquals(Priority.LOW, classifier.classify(cha, List.of(second, first), Priority.MEDIUM));
        assertEquals(first, classifier.bestMatch(cha, List.of(first, second)).orElseThrow());
    }

    @Test
    void shouldReturnSamePriorityForRepeatedCalls() {
        List<PatternRule> rules = List.of(PatternRule.of("inventory[*].quantity", Priority.LOW));
        FieldPath quantity = FieldPath.parse("inventory[id=rope].quantity");

        Priority first = classifier.classify(quantity, rules, Priority.HIGH);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, classifier.classify(quantity, rules, Priority.HIGH));
        }
        assertTrue(classifier.bestMatch(FieldPath.parse("inventory"), rules).isEmpty());
    }
}
