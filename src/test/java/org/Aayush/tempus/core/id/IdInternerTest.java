package org.Aayush.tempus.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Id Interning Tests")
class IdInternerTest {

    @Test
    @DisplayName("Assigns dense ids in first-seen order and reuses them")
    void testDenseFirstSeenIds() {
        IdInterner interner = new IdInterner();
        assertEquals(0, interner.intern("(robot-at robot1 depot)"));
        assertEquals(1, interner.intern("(hand-empty robot1)"));
        assertEquals(0, interner.intern("(robot-at robot1 depot)"));
        assertEquals(2, interner.size());
        assertEquals(1, interner.lookup("(hand-empty robot1)"));
        assertEquals(IDMapper.NOT_FOUND, interner.lookup("(delivered package1)"));
        assertEquals(2, interner.size(), "lookup must not intern");
    }

    @Test
    @DisplayName("Frozen mapper answers both directions")
    void testFrozenMapper() {
        IdInterner interner = new IdInterner();
        interner.intern("a");
        interner.intern("b");
        IDMapper mapper = interner.freeze();

        assertEquals(2, mapper.size());
        assertEquals(1, mapper.toInternal("b"));
        assertEquals("a", mapper.toExternal(0));
        assertTrue(mapper.containsExternal("a"));
        assertFalse(mapper.containsExternal("c"));
        assertTrue(mapper.containsInternal(1));
        assertFalse(mapper.containsInternal(2));
        assertEquals(IDMapper.NOT_FOUND, mapper.indexOf("c"));
    }

    @Test
    @DisplayName("Unknown signature fails fast in strict lookup")
    void testUnknownSignature() {
        IDMapper mapper = new FastUtilIDMapper(List.of("x"));
        assertThrows(IDMapper.UnknownIDException.class, () -> mapper.toInternal("y"));
    }

    @Test
    @DisplayName("Rejects duplicate signatures at construction")
    void testRejectsDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilIDMapper(List.of("x", "x")));
    }
}
