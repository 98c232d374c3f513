package io.github.manjago.v8decomp.translate;

import io.github.manjago.v8decomp.core.DecompileException;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.HandlerRange;
import io.github.manjago.v8decomp.core.Instruction;
import io.github.manjago.v8decomp.flow.EdgeSet;
import io.github.manjago.v8decomp.flow.JumpEdge;
import io.github.manjago.v8decomp.flow.JumpType;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BytecodeTranslator.
 */
class BytecodeTranslatorTest {

    private BytecodeTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new BytecodeTranslator(new V8OpcodeTable());
    }

    /**
     * @param lines alternating offsets and instruction texts
     */
    private static FunctionRecord function(Object... lines) {
        FunctionRecord f = new FunctionRecord(null);
        f.setName("func_start_0x1000");
        List<Instruction> code = new ArrayList<>();
        for (int i = 0; i < lines.length; i += 2) {
            code.add(Instruction.of((Integer) lines[i], "", (String) lines[i + 1]));
        }
        f.setCode(code);
        return f;
    }

    private static String text(FunctionRecord f, int index) {
        return f.getCode().get(index).getTranslated();
    }

    @Test
    @DisplayName("Conditional jump with absolute target")
    void testConditionalJump() throws Exception {
        FunctionRecord f = function(8, "JumpIfFalse [10] (0x9a08 @ 18)");
        EdgeSet edges = translator.translate(f);

        assertEquals("if (!ACCU)", text(f, 0));
        JumpEdge edge = edges.pending(JumpType.IF, 8);
        assertNotNull(edge);
        assertEquals(18, edge.getEnd());
    }

    @Test
    @DisplayName("Relative jumps and loops without absolute target")
    void testRelativeJumps() throws Exception {
        FunctionRecord f = function(
                4, "Jump [6]",
                16, "JumpLoop [13], [0]");
        EdgeSet edges = translator.translate(f);

        assertEquals(10, edges.pending(JumpType.JUMP, 4).getEnd());
        JumpEdge loop = edges.pending(JumpType.LOOP, 3);
        assertNotNull(loop, edges.toString());
        assertEquals(16, loop.getEnd());
        assertEquals("", text(f, 1));
    }

    @Test
    @DisplayName("Constant jump distance comes from the pool")
    void testConstantJump() throws Exception {
        FunctionRecord f = function(2, "JumpIfTrueConstant [0]");
        f.setConstantPool(List.of("12"));
        EdgeSet edges = translator.translate(f);

        assertEquals(14, edges.pending(JumpType.IF, 2).getEnd());
    }

    @Test
    @DisplayName("Receiver check registers its own edge type")
    void testReceiverCheck() throws Exception {
        FunctionRecord f = function(4, "JumpIfJSReceiver [8] (0x9a04 @ 12)");
        EdgeSet edges = translator.translate(f);

        assertNotNull(edges.pending(JumpType.IF_JS_RECEIVER, 4));
        assertNull(edges.pending(JumpType.IF, 4));
    }

    @Test
    @DisplayName("Handler table entries become exception edges")
    void testHandlerTable() throws Exception {
        FunctionRecord f = function(0, "LdaZero");
        f.setExceptionTable(Map.of(6, new HandlerRange(0, 4)));
        EdgeSet edges = translator.translate(f);

        JumpEdge edge = edges.pending(JumpType.EXCEPTION, 0);
        assertNotNull(edge);
        assertEquals(6, edge.getEnd());
    }

    @Test
    @DisplayName("Jump table switch registers head and case chain")
    void testIntSwitch() throws Exception {
        FunctionRecord f = function(2, "SwitchOnSmiNoFeedback [0], [3], [0] { 0: @6, 1: @6, 2: @10 }");
        EdgeSet edges = translator.translate(f);

        JumpEdge head = edges.pending(JumpType.INT_SWITCH, 2);
        assertTrue(head.isSwitchHead());
        assertEquals(6, head.getEnd());
        assertEquals(10, head.getLastCaseStart());

        JumpEdge shared = edges.pending(JumpType.INT_SWITCH, 6);
        assertEquals("case 0:\ncase 1:", shared.getCaseLabel());
        assertEquals(10, shared.getEnd());
        JumpEdge last = edges.pending(JumpType.INT_SWITCH, 10);
        assertEquals("case 2:", last.getCaseLabel());
        assertEquals(2, last.getEnd());
    }

    @Test
    @DisplayName("Unknown opcodes, placeholders and comments stay untranslated")
    void testUntranslated() throws Exception {
        FunctionRecord f = function(0, "FancyNewOpcode r0", 2, "// comment");
        f.getCode().add(Instruction.placeholder(3, "// placeholder"));
        translator.translate(f);

        assertEquals("", text(f, 0));
        assertEquals("", text(f, 1));
        assertEquals("", text(f, 2));
    }

    @Test
    @DisplayName("Hex bytes left in the instruction text are skipped")
    void testHexPrefix() throws Exception {
        FunctionRecord f = function(0, "0b 03 Ldar a0");
        translator.translate(f);

        assertEquals("ACCU = a0", text(f, 0));
    }

    @Test
    @DisplayName("Conflicting edges fail the function")
    void testConflictingEdges() {
        OpcodeTable conflicting = new OpcodeTable() {
            @Override
            public @Nullable OpcodeHandler lookup(String mnemonic) {
                return ctx -> {
                    ctx.addJump(JumpType.IF, 0, 4);
                    ctx.addJump(JumpType.IF, 0, 6);
                    return "";
                };
            }

            @Override
            public Set<String> mnemonics() {
                return Set.of();
            }
        };
        FunctionRecord f = function(0, "Anything");

        DecompileException e = assertThrows(DecompileException.class,
                () -> new BytecodeTranslator(conflicting).translate(f));
        assertEquals(0, e.getOffset());
        assertEquals("func_start_0x1000", e.getFunctionName());
    }

    @Test
    @DisplayName("Operand scale suffixes are stripped")
    void testBaseMnemonic() {
        assertEquals("LdaSmi", BytecodeTranslator.baseMnemonic("LdaSmi.Wide"));
        assertEquals("LdaSmi", BytecodeTranslator.baseMnemonic("LdaSmi.ExtraWide"));
        assertEquals("Ldar", BytecodeTranslator.baseMnemonic("Ldar"));
    }
}
