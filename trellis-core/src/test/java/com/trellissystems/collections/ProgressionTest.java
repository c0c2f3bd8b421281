package com.trellissystems.collections;

import com.trellissystems.IdType;
import com.trellissystems.ItemNotFoundException;
import com.trellissystems.TypeConstraintException;
import com.trellissystems.graph.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressionTest {

    private final String a = IdType.generate();
    private final String b = IdType.generate();
    private final String c = IdType.generate();

    @Test
    void testAppendAcceptsElementsAndIds() {
        Node node = new Node("x");
        Progression progression = new Progression("p");

        progression.append(a);
        progression.append(node);

        assertEquals(List.of(a, node.getId()), progression.toList());
        assertEquals("p", progression.getName());
        assertThrows(TypeConstraintException.class, () -> progression.append("bogus"));
    }

    @Test
    void testDuplicatesAllowedButIncludeIsIdempotent() {
        Progression progression = new Progression(null, List.of(a, a));

        progression.include(a);
        progression.include(List.of(a, b));

        assertEquals(List.of(a, a, b), progression.toList());
    }

    @Test
    void testContainsHandlesBatches() {
        Progression progression = new Progression(null, List.of(a, b));

        assertTrue(progression.contains(a));
        assertTrue(progression.contains(List.of(a, b)));
        assertTrue(progression.contains(new Progression(null, List.of(b))));
        assertFalse(progression.contains(List.of(a, c)));
        assertFalse(progression.contains(List.of()));
        assertFalse(progression.contains(42));
    }

    @Test
    void testExcludeRemovesAllOccurrences() {
        Progression progression = new Progression(null, List.of(a, b, a));

        assertTrue(progression.exclude(a));
        assertFalse(progression.exclude(a));

        assertEquals(List.of(b), progression.toList());
    }

    @Test
    void testRemoveMissingRaises() {
        Progression progression = new Progression(null, List.of(a));

        progression.remove(a);

        assertThrows(ItemNotFoundException.class, () -> progression.remove(a));
    }

    @Test
    void testExcludeCountPopsFromLeft() {
        Progression progression = new Progression(null, List.of(a, b, c));

        progression.exclude(2);

        assertEquals(List.of(c), progression.toList());
        assertThrows(IndexOutOfBoundsException.class, () -> progression.exclude(2));
    }

    @Test
    void testPopAndPopLeft() {
        Progression progression = new Progression(null, List.of(a, b, c));

        assertEquals(c, progression.pop());
        assertEquals(a, progression.popLeft());
        assertEquals(b, progression.pop(0));
        assertThrows(ItemNotFoundException.class, progression::pop);
        assertThrows(ItemNotFoundException.class, progression::popLeft);
    }

    @Test
    void testPositionalAccess() {
        Progression progression = new Progression(null, List.of(a, b, c));

        assertEquals(c, progression.get(-1));
        progression.set(0, c);
        assertEquals(List.of(c, b, c), progression.toList());
        assertEquals(List.of(b), progression.slice(1, 2).toList());

        progression.setSlice(0, 2, List.of(a));
        assertEquals(List.of(a, c), progression.toList());

        progression.deleteSlice(0, 1);
        assertEquals(List.of(c), progression.toList());
        assertThrows(ItemNotFoundException.class, () -> progression.get(3));
    }

    @Test
    void testExtendRequiresProgression() {
        Progression first = new Progression(null, List.of(a));
        Progression second = new Progression(null, List.of(b, c));

        first.extend(second);

        assertEquals(List.of(a, b, c), first.toList());
    }

    @Test
    void testPlusAndMinusReturnCopies() {
        Progression progression = new Progression(null, List.of(a, b));

        Progression plus = progression.plus(c);
        Progression merged = progression.plus(new Progression(null, List.of(c, a)));
        Progression minus = progression.minus(a);

        assertEquals(List.of(a, b), progression.toList());
        assertEquals(List.of(a, b, c), plus.toList());
        assertEquals(List.of(a, b, c, a), merged.toList());
        assertEquals(List.of(b), minus.toList());
    }

    @Test
    void testReversedAndCopyAreIndependent() {
        Progression progression = new Progression(null, List.of(a, b));

        Progression reversed = progression.reversed();
        Progression copy = progression.copy();
        copy.clear();

        assertEquals(List.of(b, a), reversed.toList());
        assertEquals(2, progression.size());
        assertTrue(copy.isEmpty());
        assertNotEquals(progression.getId(), copy.getId());
    }
}
