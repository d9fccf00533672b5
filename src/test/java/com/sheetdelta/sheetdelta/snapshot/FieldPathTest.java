package com.sheetdelta.sheetdelta.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldPathTest {

    @Test
    void shouldRenderKeysAndListSelectors() {
        FieldPath path = FieldPath.of("inventory").identity("id", "dagger-1").child("quantity");

        assertEquals("inventory[id=dagger-1].quantity", path.toString());
        assertEquals(List.of("inventory", "[id=dagger-1]", "quantity"), path.segments());
        assertEquals("inventory[3]", FieldPath.of("inventory").index(3).toString());
    }

    @Test
    void shouldParseRenderedForm() {
        FieldPath parsed = FieldPath.parse("classes[id=fighter].hit_points.maximum");

        assertEquals(FieldPath.of("classes").identity("id", "fighter").child("hit_points").child("maximum"), parsed);
        assertEquals(4, parsed.depth());
        assertTrue(FieldPath.parse("").isRoot());
    }

    @Test
    void shouldExposeParentLeafAndCategory() {
        FieldPath path = FieldPath.parse("feats[id=lucky]");

        assertEquals(FieldPath.of("feats"), path.parent());
        assertEquals("[id=lucky]", path.leaf());
        assertEquals("feats", path.leafKey());
        assertEquals("feats", path.category());
        assertEquals("lucky", FieldPath.segmentName(path.leaf()));
        assertEquals(FieldPath.root(), FieldPath.root().parent());
        assertEquals("", FieldPath.root().category());
    }

    @Test
    void shouldCheckPrefixesBySegment() {
        FieldPath path = FieldPath.parse("combat.hit_points.maximum");

        assertTrue(path.startsWith(FieldPath.of("combat", "hit_points")));
        assertTrue(path.startsWith(FieldPath.root()));
        assertFalse(path.startsWith(FieldPath.of("combat", "hit")));
        assertFalse(FieldPath.of("combat").startsWith(path));
    }

    @Test
    void shouldOrderByRenderedString() {
        assertTrue(FieldPath.parse("abilities.cha").compareTo(FieldPath.parse("abilities.str")) < 0);
        assertTrue(FieldPath.parse("combat").compareTo(FieldPath.parse("combat.armor_class")) < 0);
    }

    @Test
    void shouldRejectMalformedPaths() {
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a..b"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse(".a"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a."));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a[1"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a[]"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a]"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("a[0]b"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.of("a").child(""));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.of("a").child("b.c"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.of("a").child("b[0]"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.of("a").index(-1));
    }
}
