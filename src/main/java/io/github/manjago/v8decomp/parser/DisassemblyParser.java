package io.github.manjago.v8decomp.parser;

import io.github.manjago.v8decomp.core.DecompileException;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.HandlerRange;
import io.github.manjago.v8decomp.core.Instruction;
import io.github.manjago.v8decomp.core.RunContext;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for V8 {@code --print-bytecode} style disassembly dumps.
 * <p>
 * Builds one {@link FunctionRecord} per {@code Start SharedFunctionInfo} block and
 * stores it in the run's flat registry. Blocks nested anywhere inside a function,
 * constant pools included, are parsed recursively and recorded with the enclosing
 * function as declarer.
 *
 * <h2>Recognized lines:</h2>
 * <pre>
 * Start SharedFunctionInfo / End SharedFunctionInfo
 * 0x2b5a08293a6f: [SharedFunctionInfo] in OldSpace
 * - scope info: 0x2b5a08293b01
 * - outer scope info: 0x2b5a08293a01
 * Parameter count 2
 * Register count 3
 * Constant pool (size = 3)
 *   0: 0x2b5a08293c11 &lt;String[3]: #foo&gt;
 *   1-2: 0x2b5a08293c22 &lt;Odd Oddball[8]: undefined&gt;
 * Handler Table (size = 1)
 *   from   to       hdlr
 *   (   0,   4)  -&gt;     6 (prediction=1, data=1)
 * 0x2b5a08293d00 @    0 : 0b 03             Ldar a0
 * </pre>
 * A failure inside one function is logged with source context and the partial
 * record is still stored.
 */
public class DisassemblyParser {

    private static final Logger log = LoggerFactory.getLogger(DisassemblyParser.class);

    static final String START_FUNCTION = "Start SharedFunctionInfo";
    static final String END_FUNCTION = "End SharedFunctionInfo";
    /** Largest run of missing offsets filled with placeholders */
    static final int MAX_GAP = 4096;

    // Metadata
    private static final Pattern OUTER_SCOPE_PATTERN =
            Pattern.compile("^-?\\s*outer scope info:\\s*(0x[0-9a-fA-F]+)");
    private static final Pattern OUTER_SCOPE_LOOSE_PATTERN =
            Pattern.compile("\\bouter scope info:\\s*(0x[0-9a-fA-F]+)");
    private static final Pattern SCOPE_PATTERN =
            Pattern.compile("^-?\\s*scope info:\\s*(0x[0-9a-fA-F]+)");
    private static final Pattern SCOPE_LOOSE_PATTERN =
            Pattern.compile("(?<!outer )scope info:\\s*(0x[0-9a-fA-F]+)");
    private static final Pattern PARAMETER_COUNT_PATTERN = Pattern.compile("Parameter count\\s+(-?\\d+)");
    private static final Pattern REGISTER_COUNT_PATTERN = Pattern.compile("Register count\\s+(-?\\d+)");
    private static final Pattern ADDRESS_PATTERN =
            Pattern.compile("^(\\S+):\\s*\\[(SharedFunctionInfo|BytecodeArray)\\]");

    // Constant pool
    private static final Pattern POOL_SIZE_PATTERN = Pattern.compile("Constant pool\\s*\\(size\\s*=\\s*(\\d+)\\)");
    private static final Pattern POOL_RANGE_PATTERN =
            Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)\\s*:\\s*(0x[0-9a-fA-F]+\\s+)?(.+)$");
    private static final Pattern POOL_SINGLE_PATTERN =
            Pattern.compile("^(\\d+)\\s*:\\s*(0x[0-9a-fA-F]+\\s+)?(.+)$");

    // Handler table
    private static final Pattern HANDLER_SIZE_PATTERN = Pattern.compile("Handler Table\\s*\\(size\\s*=\\s*(\\d+)\\)");
    private static final Pattern HANDLER_ENTRY_PATTERN =
            Pattern.compile("\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)\\s*->\\s*(\\d+)");

    // Bytecode
    private static final Pattern BYTECODE_MARKER = Pattern.compile("(?:^|\\s)@\\s*\\d+");
    private static final Pattern BYTECODE_LINE_PATTERN = Pattern.compile(
            "^[^@]*@\\s*(\\d+)\\s*:\\s*((?:[0-9a-fA-F]{2}\\s+)*)([A-Za-z_][A-Za-z0-9._]*.*)$");
    private static final Pattern BYTECODE_OFFSET_PATTERN = Pattern.compile("@\\s*(\\d+)");

    private final RunContext context;
    private final int contextLines;
    private final FixedArrayScanner scanner = new FixedArrayScanner();

    /**
     * @param context run state receiving the prescan table and the function registry
     * @param contextLines source lines logged on each side of a parse failure
     */
    public DisassemblyParser(RunContext context, int contextLines) {
        this.context = context;
        this.contextLines = contextLines;
    }

    /**
     * Parse a whole dump.
     *
     * @param lines raw lines of the dump
     * @return the run's registry, in parse order
     */
    public Map<String, FunctionRecord> parse(List<String> lines) {
        int arrays = scanner.scan(lines, context.getFixedArrays());
        log.debug("{}: {} literal arrays prescanned", context.getSourceName(), arrays);

        LineCursor cursor = new LineCursor(context.getSourceName(), lines);
        String line;
        while ((line = cursor.next()) != null) {
            if (START_FUNCTION.equals(line)) {
                parseFunction(cursor, "start", null);
            } else if (line.startsWith("Start ")) {
                log.debug("Skipping top-level block '{}' at {}", line, cursor.location());
                skipBlock(cursor, line);
            }
        }

        log.info("Parsed {} functions from {}", context.functionCount(), context.getSourceName());
        return context.getFunctions();
    }

    // ========== Function blocks ==========

    /**
     * Parse one function block. The cursor is positioned after its start marker.
     *
     * @param label label used in the synthesized name
     * @param declarer name of the enclosing function, or null
     * @return name under which the record was stored
     */
    String parseFunction(LineCursor cursor, String label, @Nullable String declarer) {
        FunctionRecord record = new FunctionRecord(declarer);
        try {
            readFunctionBody(cursor, record, label);
        } catch (DecompileException | RuntimeException e) {
            log.warn("Error parsing function '{}' at {}: {}\n{}",
                    record.getName(), cursor.location(), e.getMessage(), cursor.context(contextLines));
            record.markFailed("parse", e.getMessage());
            skipToFunctionEnd(cursor);
        }

        FunctionRecord replaced = context.register(record);
        if (replaced != null) {
            log.warn("Duplicate function name {}, previous record replaced", record.getName());
        }
        log.debug("Parsed {}", record);
        return record.getName();
    }

    private void readFunctionBody(LineCursor cursor, FunctionRecord record, String label) throws DecompileException {
        String line;
        while ((line = cursor.next()) != null) {
            if (END_FUNCTION.equals(line)) {
                return;
            }

            // outer scope first: "scope info:" is a substring of it
            Matcher m = firstMatch(line, OUTER_SCOPE_PATTERN, OUTER_SCOPE_LOOSE_PATTERN);
            if (m != null) {
                record.setOuterScopeInfoAddress(m.group(1));
                continue;
            }
            m = firstMatch(line, SCOPE_PATTERN, SCOPE_LOOSE_PATTERN);
            if (m != null) {
                record.setScopeInfoAddress(m.group(1));
                continue;
            }

            if (START_FUNCTION.equals(line)) {
                parseFunction(cursor, "nested_" + context.functionCount(), record.getName());
            } else if (line.contains("Parameter count")) {
                record.setParameterCount(readCount(line, PARAMETER_COUNT_PATTERN, record));
            } else if (line.contains("Register count")) {
                record.setRegisterCount(readCount(line, REGISTER_COUNT_PATTERN, record));
            } else if (line.contains("Constant pool")) {
                record.setConstantPool(parseConstantPool(cursor, line, record.getName()));
            } else if (line.contains("Handler Table")) {
                record.setExceptionTable(parseHandlerTable(cursor, line));
            } else if (isBytecodeLine(line)) {
                record.setCode(parseBytecode(cursor, line, record.getName()));
            } else {
                Matcher address = ADDRESS_PATTERN.matcher(line);
                // the first address line names the function; later ones belong to its BytecodeArray
                if (address.find() && FunctionRecord.UNKNOWN_NAME.equals(record.getName())) {
                    record.setName(FunctionRecord.nameOf(label, address.group(1)));
                }
            }
        }
    }

    private int readCount(String line, Pattern pattern, FunctionRecord record) throws DecompileException {
        Matcher m = pattern.matcher(line);
        if (!m.find()) {
            throw new DecompileException("Malformed count line '" + line + "'", record.getName());
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            throw new DecompileException("Count out of range in '" + line + "'", record.getName(), e);
        }
    }

    // ========== Constant pool ==========

    /**
     * Read entries until all declared slots are filled or a sibling section begins.
     * The terminating line is pushed back.
     *
     * @return exactly {@code size} entries, {@code ""} for unfilled slots
     */
    List<String> parseConstantPool(LineCursor cursor, String header, String functionName) {
        Matcher sizeMatcher = POOL_SIZE_PATTERN.matcher(header);
        if (!sizeMatcher.find()) {
            return List.of();
        }
        int size = Integer.parseInt(sizeMatcher.group(1));
        if (size <= 0) {
            return List.of();
        }

        String[] pool = new String[size];
        int assigned = 0;
        FixedArrayTable arrays = context.getFixedArrays();

        String line;
        while ((line = cursor.next()) != null) {
            if (assigned >= size) {
                cursor.pushBack();
                break;
            }

            if (START_FUNCTION.equals(line)) {
                parseFunction(cursor, "nested_" + context.functionCount(), functionName);
                continue;
            }
            if (line.startsWith("Start ObjectBoilerplateDescription")
                    || line.startsWith("Start ArrayBoilerplateDescription")
                    || line.startsWith("Start FixedArray")) {
                skipBlock(cursor, line);
                continue;
            }
            if (isSectionBoundary(line)) {
                cursor.pushBack();
                break;
            }

            Matcher range = POOL_RANGE_PATTERN.matcher(line);
            if (range.matches()) {
                int from = Integer.parseInt(range.group(1));
                int to = Integer.parseInt(range.group(2));
                String address = range.group(3) != null ? range.group(3).strip() : null;
                String value = classifyRangeValue(address, range.group(4), arrays);
                for (int idx = from; idx <= to && idx < size; idx++) {
                    if (pool[idx] == null) {
                        pool[idx] = value;
                        assigned++;
                    }
                }
                continue;
            }

            Matcher single = POOL_SINGLE_PATTERN.matcher(line);
            if (single.matches()) {
                int idx = Integer.parseInt(single.group(1));
                if (idx < size && pool[idx] == null) {
                    String address = single.group(2) != null ? single.group(2).strip() : null;
                    pool[idx] = classifySingleValue(cursor, address, single.group(3), functionName, arrays);
                    assigned++;
                }
            }
            // anything else (map, length, ...) is ignored
        }

        List<String> out = new ArrayList<>(size);
        for (String v : pool) {
            out.add(v != null ? v : "");
        }
        return out;
    }

    private String classifySingleValue(LineCursor cursor, @Nullable String address, String value,
                                       String functionName, FixedArrayTable arrays) {
        String val = value.strip();
        if (address != null && val.startsWith(ConstantClassifier.SHARED_FUNCTION_INFO_TAG)
                && arrays.inlineLiteral(address + " " + val) == null) {
            // nested function block follows its reference
            String peek = cursor.next();
            if (START_FUNCTION.equals(peek)) {
                return parseFunction(cursor, ConstantClassifier.functionLabel(val), functionName);
            }
            if (peek != null) {
                cursor.pushBack();
            }
            return ConstantClassifier.functionReference(val);
        }
        return ConstantClassifier.classify(address, val, arrays);
    }

    private String classifyRangeValue(@Nullable String address, String value, FixedArrayTable arrays) {
        return ConstantClassifier.classify(address, value, arrays);
    }

    private boolean isSectionBoundary(String line) {
        return line.startsWith("Start BytecodeArray")
                || line.startsWith("Handler Table")
                || line.startsWith("Source Position Table")
                || END_FUNCTION.equals(line)
                || isBytecodeLine(line);
    }

    // ========== Handler table ==========

    /**
     * Read {@code (from,to) -> handler} entries. A header line before the first
     * entry is skipped; the first other non-entry line is pushed back.
     *
     * @return handler offset -> protected region
     */
    Map<Integer, HandlerRange> parseHandlerTable(LineCursor cursor, String header) {
        Map<Integer, HandlerRange> table = new LinkedHashMap<>();
        Matcher sizeMatcher = HANDLER_SIZE_PATTERN.matcher(header);
        if (!sizeMatcher.find() || Integer.parseInt(sizeMatcher.group(1)) == 0) {
            return table;
        }

        boolean headerSkipped = false;
        String line;
        while ((line = cursor.next()) != null) {
            Matcher m = HANDLER_ENTRY_PATTERN.matcher(line);
            if (m.find()) {
                int from = Integer.parseInt(m.group(1));
                int to = Integer.parseInt(m.group(2));
                int handler = Integer.parseInt(m.group(3));
                table.put(handler, new HandlerRange(from, to));
                continue;
            }
            if (table.isEmpty() && !headerSkipped && !line.startsWith("Start ")
                    && !line.startsWith("End ") && !isBytecodeLine(line)) {
                headerSkipped = true;
                continue;
            }
            cursor.pushBack();
            break;
        }
        return table;
    }

    // ========== Bytecode ==========

    /**
     * Read contiguous bytecode lines starting with {@code first}. The first line
     * that is not bytecode is pushed back.
     *
     * @return instructions sorted by offset, first occurrence per offset kept,
     *         gaps filled with placeholders
     * @throws DecompileException if two offsets are more than {@link #MAX_GAP} apart
     */
    List<Instruction> parseBytecode(LineCursor cursor, String first, String functionName)
            throws DecompileException {
        List<Instruction> parsed = new ArrayList<>();
        String line = first;
        while (line != null && isBytecodeLine(line)) {
            Instruction instruction = parseBytecodeLine(line);
            if (instruction != null) {
                parsed.add(instruction);
            }
            line = cursor.next();
        }
        if (line != null) {
            cursor.pushBack();
        }

        parsed.sort(Comparator.comparingInt(Instruction::getOffset));
        List<Instruction> unique = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (Instruction instruction : parsed) {
            if (seen.add(instruction.getOffset())) {
                unique.add(instruction);
            }
        }
        return fillGaps(unique, functionName);
    }

    /**
     * @return parsed instruction, a placeholder for an offset-bearing line that does
     *         not fully parse, or null
     */
    static @Nullable Instruction parseBytecodeLine(String line) {
        Matcher m = BYTECODE_LINE_PATTERN.matcher(line);
        if (m.matches()) {
            try {
                return Instruction.of(Integer.parseInt(m.group(1)), m.group(2).strip(), m.group(3).strip());
            } catch (NumberFormatException e) {
                log.debug("Bytecode offset out of range in '{}'", line);
                return null;
            }
        }
        Matcher offset = BYTECODE_OFFSET_PATTERN.matcher(line);
        if (offset.find()) {
            try {
                return Instruction.placeholder(Integer.parseInt(offset.group(1)), "// placeholder: " + line);
            } catch (NumberFormatException e) {
                log.debug("Bytecode offset out of range in '{}'", line);
            }
        }
        return null;
    }

    static boolean isBytecodeLine(String line) {
        return BYTECODE_MARKER.matcher(line).find();
    }

    private static List<Instruction> fillGaps(List<Instruction> sorted, String functionName)
            throws DecompileException {
        if (sorted.isEmpty()) {
            return sorted;
        }
        List<Instruction> filled = new ArrayList<>();
        int expected = sorted.get(0).getOffset();
        for (Instruction instruction : sorted) {
            long gap = (long) instruction.getOffset() - expected;
            if (gap > MAX_GAP) {
                throw new DecompileException("Gap of " + gap + " offsets before @" + instruction.getOffset(),
                        functionName);
            }
            while (expected < instruction.getOffset()) {
                filled.add(Instruction.placeholder(expected, "// placeholder"));
                expected++;
            }
            filled.add(instruction);
            expected = instruction.getOffset() + 1;
        }
        return filled;
    }

    // ========== Helpers ==========

    /**
     * Consume lines up to the end marker matching {@code startLine}.
     */
    private void skipBlock(LineCursor cursor, String startLine) {
        String kind = startLine.substring(startLine.indexOf(' ') + 1);
        String endMarker = "End " + kind;
        String line;
        while ((line = cursor.next()) != null) {
            if (endMarker.equals(line)) {
                return;
            }
        }
    }

    /**
     * After a failure, consume the rest of the function so that its lines are not
     * taken for top-level content. Nested function blocks are balanced.
     */
    private void skipToFunctionEnd(LineCursor cursor) {
        int depth = 0;
        String line;
        while ((line = cursor.next()) != null) {
            if (START_FUNCTION.equals(line)) {
                depth++;
            } else if (END_FUNCTION.equals(line)) {
                if (depth == 0) {
                    return;
                }
                depth--;
            }
        }
    }

    private static @Nullable Matcher firstMatch(String line, Pattern... patterns) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(line);
            if (m.find()) {
                return m;
            }
        }
        return null;
    }
}
