package io.github.manjago.v8decomp.translate;

import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.Instruction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for V8OpcodeTable.
 */
class V8OpcodeTableTest {

    private final V8OpcodeTable table = new V8OpcodeTable();

    private String translate(String instruction) throws Exception {
        FunctionRecord f = new FunctionRecord(null);
        f.setCode(List.of(Instruction.of(0, "", instruction)));
        new BytecodeTranslator(table).translate(f);
        return f.getCode().get(0).getTranslated();
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', textBlock = """
            Ldar a0                               | ACCU = a0
            Star r2                               | r2 = ACCU
            Star3                                 | r3 = ACCU
            Mov a0, r1                            | r1 = a0
            LdaZero                               | ACCU = 0
            LdaSmi [42]                           | ACCU = 42
            LdaSmi.Wide [1000]                    | ACCU = 1000
            LdaUndefined                          | ACCU = undefined
            LdaTheHole                            | ACCU = <hole>
            LdaConstant [3]                       | ACCU = ConstPool[3]
            LdaGlobal [1], [0]                    | ACCU = ConstPool[1]
            StaGlobal [2], [0]                    | ConstPool[2] = ACCU
            LdaCurrentContextSlot [4]             | ACCU = Scope[CURRENT][4]
            StaCurrentContextSlot [4]             | Scope[CURRENT][4] = ACCU
            LdaContextSlot <context>, [3], [1]    | ACCU = Scope[CURRENT-1][3]
            LdaImmutableContextSlot r1, [2], [0]  | ACCU = Scope[r1][2]
            StaContextSlot r1, [2], [2]           | Scope[r1-2][2] = ACCU
            GetNamedProperty a0, [1], [0]         | ACCU = a0[ConstPool[1]]
            LdaNamedProperty a0, [1], [0]         | ACCU = a0[ConstPool[1]]
            SetNamedProperty r0, [1], [2]         | r0[ConstPool[1]] = ACCU
            GetKeyedProperty r0, [3]              | ACCU = r0[ACCU]
            SetKeyedProperty r0, r1, [3]          | r0[r1] = ACCU
            Add r1, [0]                           | ACCU = r1 + ACCU
            SubSmi [5], [1]                       | ACCU = ACCU - 5
            Inc [0]                               | ACCU = ACCU + 1
            LogicalNot                            | ACCU = !ACCU
            TestEqualStrict r0, [0]               | ACCU = r0 === ACCU
            TestNull                              | ACCU = ACCU === null
            TestTypeOf #1                         | ACCU = typeof ACCU == "string"
            CallProperty1 r1, r2, a0, [4]         | ACCU = r1(a0)
            CallUndefinedReceiver0 r1, [0]        | ACCU = r1()
            CallUndefinedReceiver r1, r2-r4, [0]  | ACCU = r1(r2, r3, r4)
            CallWithSpread r1, r2-r4, [0]         | ACCU = r1(r3, ...r4)
            CallRuntime [ThrowIteratorResultNotAnObject], r0-r0 | ACCU = ThrowIteratorResultNotAnObject(r0)
            Construct r1, r2-r3, [0]              | ACCU = new r1(r2, r3)
            CreateClosure [0], [0], #2            | ACCU = ConstPool[0]
            CreateEmptyArrayLiteral [0]           | ACCU = []
            CreateFunctionContext [1], [3]        | ACCU = new Context(ConstPool[1])
            PushContext r4                        | PushContext r4
            ForInNext r0, r1, r2-r3, [0]          | ACCU = r0[r1]
            Return                                | return ACCU
            Throw                                 | throw ACCU
            """)
    @DisplayName("Translate single instructions")
    void testTranslate(String instruction, String expected) throws Exception {
        assertEquals(expected, translate(instruction));
    }

    @ParameterizedTest
    @ValueSource(strings = {"StackCheck", "ToNumeric [0]", "SetPendingMessage", "ThrowReferenceErrorIfHole [2]"})
    @DisplayName("Bookkeeping opcodes translate to nothing")
    void testSilentOpcodes(String instruction) throws Exception {
        assertEquals("", translate(instruction));
    }

    @Test
    @DisplayName("Unknown mnemonics are not in the table")
    void testUnknown() {
        assertNull(table.lookup("NoSuchOpcode"));
        assertTrue(table.mnemonics().contains("GetNamedProperty"));
        assertTrue(table.mnemonics().contains("LdaNamedProperty"));
        assertThrows(UnsupportedOperationException.class, () -> table.mnemonics().add("X"));
    }

    @Test
    @DisplayName("Register ranges expand")
    void testExpandRange() {
        assertEquals(List.of("r1", "r2", "r3"), V8OpcodeTable.expandRange("r1-r3"));
        assertEquals(List.of("a0"), V8OpcodeTable.expandRange("a0"));
        assertEquals(List.of("r0"), V8OpcodeTable.expandRange("r0-r0"));
    }

    @Test
    @DisplayName("Bracketed operands lose their brackets")
    void testIndex() {
        assertEquals("12", V8OpcodeTable.index("[12]"));
        assertEquals("12", V8OpcodeTable.index(" [ 12 ] "));
        assertEquals("r0", V8OpcodeTable.index("r0"));
    }
}
