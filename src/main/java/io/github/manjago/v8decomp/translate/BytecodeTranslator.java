package io.github.manjago.v8decomp.translate;

import io.github.manjago.v8decomp.core.DecompileException;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.HandlerRange;
import io.github.manjago.v8decomp.core.Instruction;
import io.github.manjago.v8decomp.flow.EdgeSet;
import io.github.manjago.v8decomp.flow.JumpEdge;
import io.github.manjago.v8decomp.flow.JumpType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the bytecode of one function into pseudo-statements and jump edges.
 * <p>
 * Handler table entries become EXCEPTION edges before any instruction is looked
 * at. Instructions whose mnemonic the {@link OpcodeTable} does not know are left
 * untranslated.
 */
public class BytecodeTranslator {

    private static final Logger log = LoggerFactory.getLogger(BytecodeTranslator.class);

    private static final Pattern MNEMONIC_PATTERN =
            Pattern.compile("^(?:(?:[0-9a-fA-F]{2}\\s+)+)?([A-Za-z_][A-Za-z0-9._]*)\\b(?:\\s+(.*))?$");

    private final OpcodeTable table;

    public BytecodeTranslator(OpcodeTable table) {
        this.table = table;
    }

    /**
     * Translate every instruction of the function in place.
     *
     * @return edges registered by the handlers and the handler table
     * @throws DecompileException if a handler registers a conflicting edge
     */
    public EdgeSet translate(FunctionRecord function) throws DecompileException {
        EdgeSet edges = new EdgeSet();
        for (Map.Entry<Integer, HandlerRange> entry : function.getExceptionTable().entrySet()) {
            edges.add(new JumpEdge(JumpType.EXCEPTION, entry.getValue().start(), entry.getKey()));
        }

        TranslationContext ctx = new TranslationContext(function, edges);
        int translated = 0;
        int unknown = 0;

        for (Instruction instruction : function.getCode()) {
            String text = instruction.getInstruction().strip();
            if (instruction.isPlaceholder() || text.isEmpty() || text.startsWith("//")) {
                continue;
            }
            Matcher m = MNEMONIC_PATTERN.matcher(text);
            if (!m.matches()) {
                continue;
            }

            String mnemonic = baseMnemonic(m.group(1));
            OpcodeHandler handler = table.lookup(mnemonic);
            if (handler == null) {
                log.debug("{}: unknown opcode {} at @{}", function.getName(), mnemonic, instruction.getOffset());
                unknown++;
                continue;
            }

            String rest = m.group(2) != null ? m.group(2).strip() : "";
            ctx.moveTo(instruction.getOffset(), mnemonic, rest, splitOperands(rest));
            try {
                instruction.setTranslated(handler.translate(ctx));
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw new DecompileException(e.getMessage(), function.getName(), instruction.getOffset());
            }
            translated++;
        }

        log.debug("{}: translated {} instructions ({} unknown), {} edges",
                function.getName(), translated, unknown, edges.size());
        return edges;
    }

    /**
     * Strip the operand-scale suffix: {@code LdaSmi.Wide} is translated as {@code LdaSmi}.
     */
    static String baseMnemonic(String mnemonic) {
        if (mnemonic.endsWith(".ExtraWide")) {
            return mnemonic.substring(0, mnemonic.length() - ".ExtraWide".length());
        }
        if (mnemonic.endsWith(".Wide")) {
            return mnemonic.substring(0, mnemonic.length() - ".Wide".length());
        }
        return mnemonic;
    }

    static List<String> splitOperands(String rest) {
        List<String> operands = new ArrayList<>();
        if (rest.isEmpty()) {
            return operands;
        }
        for (String part : rest.split(", ")) {
            operands.add(part.strip());
        }
        return operands;
    }
}
