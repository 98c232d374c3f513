package io.github.manjago.v8decomp.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LineCursor.
 */
class LineCursorTest {

    @Test
    @DisplayName("Blank lines are skipped and lines trimmed")
    void testSkipsBlankLines() {
        LineCursor cursor = new LineCursor("dump.txt", List.of("  a  ", "", "   ", "\tb"));

        assertEquals("a", cursor.next());
        assertEquals(1, cursor.lineNumber());
        assertEquals("b", cursor.next());
        assertEquals(4, cursor.lineNumber());
        assertEquals("dump.txt:4", cursor.location());
        assertNull(cursor.next());
        assertFalse(cursor.hasNext());
    }

    @Test
    @DisplayName("Pushed back line is returned again")
    void testPushBack() {
        LineCursor cursor = new LineCursor("dump.txt", List.of("a", "b"));

        assertEquals("a", cursor.next());
        cursor.pushBack();
        assertEquals("a", cursor.next());
        assertEquals("b", cursor.next());
    }

    @Test
    @DisplayName("Only one line can be pushed back")
    void testDoublePushBack() {
        LineCursor cursor = new LineCursor("dump.txt", List.of("a", "b"));
        cursor.next();
        cursor.next();
        cursor.pushBack();

        assertThrows(IllegalStateException.class, cursor::pushBack);
    }

    @Test
    @DisplayName("Nothing to push back before the first line or after the end")
    void testPushBackWithoutLine() {
        LineCursor cursor = new LineCursor("dump.txt", List.of("a"));
        assertThrows(IllegalStateException.class, cursor::pushBack);

        cursor.next();
        assertNull(cursor.next());
        assertThrows(IllegalStateException.class, cursor::pushBack);
    }

    @Test
    @DisplayName("Context shows raw lines around the current one")
    void testContext() {
        LineCursor cursor = new LineCursor("dump.txt", List.of("a", "", "  b", "c", "d"));
        cursor.next();
        cursor.next();

        String context = cursor.context(1);
        assertEquals(3, context.split("\n").length);
        assertTrue(context.contains(">>>    3:   b"), context);
        assertTrue(context.contains("    4: c"));
        assertFalse(context.contains("d"));
    }

    @Test
    @DisplayName("No context before the first line")
    void testContextBeforeStart() {
        LineCursor cursor = new LineCursor("dump.txt", List.of("a"));
        assertEquals("", cursor.context(2));
    }
}
