package io.github.manjago.v8decomp.simplify;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FunctionContextTable.
 */
class FunctionContextTableTest {

    private FunctionContextTable table;

    @BeforeEach
    void setUp() {
        table = new FunctionContextTable();
    }

    @Test
    @DisplayName("Zero binding is upgraded, nonzero binding is kept")
    void testBind() {
        table.bind("f", 0, null);
        assertEquals(0, table.boundContext("f"));

        table.bind("f", 3, null);
        assertEquals(3, table.boundContext("f"));

        table.bind("f", 0, null);
        table.bind("f", 5, null);
        assertEquals(3, table.boundContext("f"));
    }

    @Test
    @DisplayName("Function without binding inherits from its declarer chain")
    void testDeclarerChain() {
        table.bind("outer", 2, null);
        table.recordDeclarer("middle", "outer");
        table.recordDeclarer("inner", "middle");

        assertEquals(2, table.contextOf("inner", "middle"));
        assertEquals(2, table.boundContext("inner"));
    }

    @Test
    @DisplayName("Own binding wins over the declarer")
    void testOwnBinding() {
        table.bind("outer", 2, null);
        table.bind("inner", 4, "outer");

        assertEquals(4, table.contextOf("inner", "outer"));
    }

    @Test
    @DisplayName("Unknown chain gives and binds zero")
    void testUnknown() {
        assertNull(table.boundContext("lonely"));
        assertEquals(0, table.contextOf("lonely", "nobody"));
        assertEquals(0, table.boundContext("lonely"));
    }

    @Test
    @DisplayName("Cyclic declarers terminate")
    void testCycle() {
        table.recordDeclarer("a", "b");
        table.recordDeclarer("b", "a");

        assertEquals(0, table.contextOf("c", "a"));
    }

    @Test
    @DisplayName("First declarer is kept")
    void testFirstDeclarerKept() {
        table.bind("one", 1, null);
        table.bind("two", 2, null);
        table.recordDeclarer("f", "one");
        table.recordDeclarer("f", "two");

        assertEquals(1, table.contextOf("g", "f"));
    }
}
