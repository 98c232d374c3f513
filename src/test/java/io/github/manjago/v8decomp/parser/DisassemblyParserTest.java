package io.github.manjago.v8decomp.parser;

import io.github.manjago.v8decomp.Dumps;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.HandlerRange;
import io.github.manjago.v8decomp.core.Instruction;
import io.github.manjago.v8decomp.core.RunContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DisassemblyParser.
 */
class DisassemblyParserTest {

    private RunContext context;
    private DisassemblyParser parser;

    @BeforeEach
    void setUp() {
        context = new RunContext("test");
        parser = new DisassemblyParser(context, 2);
    }

    private Map<String, FunctionRecord> parse(String... blocks) {
        return parser.parse(Dumps.lines(blocks));
    }

    @Test
    @DisplayName("Function metadata and bytecode")
    void testMetadata() {
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .params(3).registers(2)
                .scope("0x100").outer("0x50")
                .code(0, "Ldar a0")
                .code(2, "Return")
                .build());

        FunctionRecord f = functions.get("func_start_0x1000");
        assertNotNull(f, functions.keySet().toString());
        assertNull(f.getDeclarer());
        assertEquals(3, f.getParameterCount());
        assertEquals(2, f.getRegisterCount());
        assertEquals("0x100", f.getScopeInfoAddress());
        assertEquals("0x50", f.getOuterScopeInfoAddress());
        assertFalse(f.isFailed());

        List<Instruction> code = f.getCode();
        assertEquals(3, code.size());
        assertEquals("Ldar a0", code.get(0).getInstruction());
        assertTrue(code.get(1).isPlaceholder());
        assertEquals(1, code.get(1).getOffset());
        assertEquals("Return", code.get(2).getInstruction());
    }

    @Test
    @DisplayName("Hex bytes are split from the instruction")
    void testHexBytes() {
        Map<String, FunctionRecord> functions = parse("""
                Start SharedFunctionInfo
                0x1000: [SharedFunctionInfo] in OldSpace
                Parameter count 1
                  0x2b5a08293d00 @    0 : 0b 03             Ldar a0
                  0x2b5a08293d02 @    2 : ab                Return
                End SharedFunctionInfo
                """);

        List<Instruction> code = functions.get("func_start_0x1000").getCode();
        assertEquals("0b 03", code.get(0).getHexBytes());
        assertEquals("Ldar a0", code.get(0).getInstruction());
        assertEquals("ab", code.get(2).getHexBytes());
    }

    @Test
    @DisplayName("Constant pool always has its declared size")
    void testPoolSize() {
        Map<String, FunctionRecord> functions = parse("""
                Start SharedFunctionInfo
                0x1000: [SharedFunctionInfo] in OldSpace
                Parameter count 1
                Constant pool (size = 4)
                0: 0x5000 <String[3]: #foo>
                1-2: 0x5001 <Odd Oddball[8]: undefined>
                Handler Table (size = 0)
                End SharedFunctionInfo
                """);

        assertEquals(List.of("\"foo\"", "null", "null", ""), functions.get("func_start_0x1000").getConstantPool());
    }

    @Test
    @DisplayName("Literal array in the pool resolves through the prescan")
    void testPoolFixedArray() {
        String array = """
                Start FixedArray
                0x1234: [FixedArray]
                 - length: 3
                0: 1
                1-2: 2
                End FixedArray
                """;
        Map<String, FunctionRecord> functions = parse(array, Dumps.function("0x1000")
                .pool("0x1234 <FixedArray[3]>")
                .code(0, "LdaConstant [0]")
                .build());

        assertEquals(1, functions.size());
        assertEquals(List.of("[1, 2, 2]"), functions.get("func_start_0x1000").getConstantPool());
    }

    @Test
    @DisplayName("Nested function after its reference takes the referencing label")
    void testNestedFunction() {
        String inner = Dumps.function("0x2000")
                .code(0, "LdaUndefined")
                .code(1, "Return")
                .build();
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .pool("0x3000 <SharedFunctionInfo inner>")
                .code(0, "CreateClosure [0], [0], #2")
                .code(4, "Return")
                .build(inner));

        assertEquals(List.of("func_inner_0x2000", "func_start_0x1000"), List.copyOf(functions.keySet()));
        FunctionRecord outer = functions.get("func_start_0x1000");
        FunctionRecord nested = functions.get("func_inner_0x2000");
        assertEquals(List.of("func_inner_0x2000"), outer.getConstantPool());
        assertEquals("func_start_0x1000", nested.getDeclarer());
        assertEquals(2, nested.getCode().size());
    }

    @Test
    @DisplayName("Function reference without a following block stays a reference")
    void testFunctionReference() {
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .pool("0x3000 <SharedFunctionInfo helper>")
                .build());

        assertEquals(List.of("func_ref_helper"), functions.get("func_start_0x1000").getConstantPool());
    }

    @Test
    @DisplayName("Nested block in the body gets a positional label")
    void testNestedInBody() {
        String inner = Dumps.function("0x2000").code(0, "Return").build();
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .code(0, "Return")
                .build(inner));

        FunctionRecord nested = functions.get("func_nested_0_0x2000");
        assertNotNull(nested, functions.keySet().toString());
        assertEquals("func_start_0x1000", nested.getDeclarer());
    }

    @Test
    @DisplayName("Handler table entries keyed by handler offset")
    void testHandlerTable() {
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .handler(0, 4, 6)
                .handler(10, 20, 22)
                .code(0, "Return")
                .build());

        Map<Integer, HandlerRange> table = functions.get("func_start_0x1000").getExceptionTable();
        assertEquals(2, table.size());
        assertEquals(new HandlerRange(0, 4), table.get(6));
        assertEquals(new HandlerRange(10, 20), table.get(22));
    }

    @Test
    @DisplayName("Duplicate offsets keep the first line; unreadable lines become placeholders")
    void testBytecodeOddities() {
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .code(2, "Return")
                .code(0, "Ldar a0")
                .code(0, "Ldar a1")
                .code(1, "???")
                .build());

        List<Instruction> code = functions.get("func_start_0x1000").getCode();
        assertEquals(3, code.size());
        assertEquals("Ldar a0", code.get(0).getInstruction());
        assertTrue(code.get(1).isPlaceholder());
        assertEquals("Return", code.get(2).getInstruction());
    }

    @Test
    @DisplayName("Broken function is kept as a failed partial record")
    void testMalformedFunction() {
        String broken = """
                Start SharedFunctionInfo
                0x1000: [SharedFunctionInfo] in OldSpace
                Parameter count 99999999999
                Register count 1
                End SharedFunctionInfo
                """;
        Map<String, FunctionRecord> functions = parse(broken, Dumps.function("0x2000").code(0, "Return").build());

        assertEquals(2, functions.size());
        FunctionRecord failed = functions.get("func_start_0x1000");
        assertTrue(failed.isFailed());
        assertTrue(failed.getFailures().get(0).startsWith("parse: "));
        assertFalse(functions.get("func_start_0x2000").isFailed());
    }

    @Test
    @DisplayName("Huge offset gap fails the function, not the run")
    void testOffsetGapTooLarge() {
        String broken = Dumps.function("0x1000")
                .code(0, "LdaZero")
                .code(2000000000, "Return")
                .build();
        Map<String, FunctionRecord> functions = parse(broken, Dumps.function("0x2000").code(0, "Return").build());

        FunctionRecord failed = functions.get("func_start_0x1000");
        assertTrue(failed.isFailed());
        assertTrue(failed.getFailures().get(0).contains("Gap of 1999999999 offsets"), failed.getFailures().toString());
        assertFalse(functions.get("func_start_0x2000").isFailed());
        assertEquals(1, functions.get("func_start_0x2000").getCode().size());
    }

    @Test
    @DisplayName("Gap at the limit is still filled")
    void testOffsetGapAtLimit() {
        int last = DisassemblyParser.MAX_GAP + 1;
        Map<String, FunctionRecord> functions = parse(Dumps.function("0x1000")
                .code(0, "LdaZero")
                .code(last, "Return")
                .build());

        FunctionRecord f = functions.get("func_start_0x1000");
        assertFalse(f.isFailed());
        assertEquals(last + 1, f.getCode().size());
        assertTrue(f.getCode().get(last - 1).isPlaceholder());
    }

    @Test
    @DisplayName("Same block twice keeps the later record")
    void testDuplicateName() {
        Map<String, FunctionRecord> functions = parse(
                Dumps.function("0x1000").params(1).build(),
                Dumps.function("0x1000").params(2).build());

        assertEquals(1, functions.size());
        assertEquals(2, functions.get("func_start_0x1000").getParameterCount());
    }

    @Test
    @DisplayName("Other top-level blocks are skipped")
    void testTopLevelBlocksSkipped() {
        String other = """
                Start BytecodeArray
                Parameter count 7
                End BytecodeArray
                """;
        Map<String, FunctionRecord> functions = parse(other, Dumps.function("0x1000").build());

        assertEquals(1, functions.size());
        assertEquals(1, functions.get("func_start_0x1000").getParameterCount());
        assertSame(context.getFunctions().get("func_start_0x1000"), functions.get("func_start_0x1000"));
    }
}
