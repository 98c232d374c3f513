package io.github.manjago.v8decomp.simplify;

import io.github.manjago.v8decomp.core.DecompileException;
import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.Instruction;
import io.github.manjago.v8decomp.core.RunContext;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills the decompiled text of a structured function.
 * <p>
 * Walks the brace blocks produced by the reconstructor, numbers context references
 * through the run's {@link ScopeGraph}, propagates constant register values into
 * their uses (hiding the defining lines) and inlines context slots written by
 * functions simplified earlier.
 * <p>
 * Functions must be simplified in {@link SimplificationOrder}; slot inlining only
 * sees writes of functions already processed.
 */
public class Simplifier {

    private static final Logger log = LoggerFactory.getLogger(Simplifier.class);

    private static final Pattern SCOPE_PATTERN = Pattern.compile("Scope\\[([^\\]]+)\\](\\[(\\d+)\\])?");
    private static final Pattern SCOPE_LHS_PATTERN = Pattern.compile("^\\s*(Scope)\\[([^\\]]+)\\]\\[(\\d+)\\]\\s*=");
    private static final Pattern ASSIGNMENT_PATTERN =
            Pattern.compile("^\\s*(ACCU|CASE_\\d+|[ra]\\d+|Scope\\[\\d+\\]\\[\\d+\\])\\s*=\\s*(.+)$");
    private static final Pattern SLOT_PATTERN = Pattern.compile("Scope\\[(\\d+)\\]\\[(\\d+)\\]");
    private static final Pattern REGISTER_PATTERN = Pattern.compile("\\b(ACCU|CASE_\\d+|[ra]\\d+)\\b");
    private static final Pattern CONST_POOL_PATTERN = Pattern.compile("ConstPool\\[(\\d+)\\]");

    private static final Pattern CALL_SHAPED = Pattern.compile("[\\w\\]]\\(");
    private static final Pattern LITERAL_VALUE =
            Pattern.compile("^\\(*(Scope|ConstPool|<|true|false|Undefined|undefined|Null|null|[+-]?\\d)");
    private static final Pattern PROPERTY_VALUE = Pattern.compile("^[ra]\\d+\\[\\(*ConstPool\\[\\d+\\]");

    private final RunContext context;

    public Simplifier(RunContext context) {
        this.context = context;
    }

    /**
     * Simplify one function and bind it to its context id.
     *
     * @throws DecompileException if the block structure is broken
     */
    public void simplify(FunctionRecord function) throws DecompileException {
        int contextId = contextIdOf(function);
        FunctionContextTable table = context.getFunctionContexts();
        table.recordDeclarer(function.getName(), function.getDeclarer());
        table.bind(function.getName(), contextId,
                function.getDeclarer() != null ? function.getDeclarer() : function.getName());

        log.debug("{}: context id {}", function.getName(), contextId);
        new FunctionPass(function, contextId).run();
        substituteConstants(function);
    }

    int contextIdOf(FunctionRecord function) {
        String scope = function.getScopeInfoAddress();
        if (scope != null) {
            return context.getScopeGraph().idOf(scope);
        }
        return context.getFunctionContexts().contextOf(function.getName(), function.getDeclarer());
    }

    /**
     * Replace {@code ConstPool[i]} in decompiled text with the resolved pool text.
     * Unresolved entries are left as references.
     */
    static void substituteConstants(FunctionRecord function) {
        for (Instruction line : function.getCode()) {
            String text = line.getDecompiled();
            if (text.contains("ConstPool[")) {
                line.setDecompiled(resolveConstants(text, function));
            }
        }
    }

    private static String resolveConstants(String text, FunctionRecord function) {
        Matcher m = CONST_POOL_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = function.constantAt(Integer.parseInt(m.group(1)));
            String replacement = value == null || value.isEmpty() ? m.group(0) : value;
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Whether an assignment's right-hand side may replace uses of the register:
     * literals, constant-pool references, context reads and property reads off a
     * constant name, but never a call.
     */
    static boolean isSubstitutable(String value) {
        if (CALL_SHAPED.matcher(value).find()) {
            return false;
        }
        return LITERAL_VALUE.matcher(value).find() || PROPERTY_VALUE.matcher(value).find();
    }

    /**
     * State of one function's simplification.
     */
    private final class FunctionPass {

        private final FunctionRecord function;
        private final List<Instruction> code;
        private final int contextId;
        private final String scopeInfo;
        private final String outerScopeInfo;

        private int lineIndex;
        private int level;

        FunctionPass(FunctionRecord function, int contextId) {
            this.function = function;
            this.code = function.getCode();
            this.contextId = contextId;
            this.scopeInfo = function.getScopeInfoAddress();
            this.outerScopeInfo = function.getOuterScopeInfoAddress();
        }

        void run() throws DecompileException {
            if (code.isEmpty() || !"{".equals(code.get(0).getTranslated())) {
                throw new DecompileException("code does not start with a block", function.getName());
            }
            block(new LinkedHashMap<>());
            if (lineIndex != code.size() - 1) {
                log.warn("{}: simplification stopped after {}/{}", function.getName(), lineIndex, code.size() - 1);
            }
        }

        // ========== Blocks ==========

        private void block(Map<String, Register> outer) throws DecompileException {
            boolean loop = lineIndex > 0 && code.get(lineIndex - 1).getDecompiled().contains("while");
            Map<String, Register> registers = loop ? loopSnapshot(outer) : new LinkedHashMap<>(outer);
            Map<String, Integer> overwritten = new LinkedHashMap<>();

            emit("{");
            level++;
            String line;
            while (!(line = nextLine()).equals("}")) {
                if (line.equals("{")) {
                    Map<String, Register> merged = new LinkedHashMap<>(outer);
                    merged.putAll(registers);
                    block(merged);
                    continue;
                }
                emit(simplifyLine(line, registers, outer, overwritten));
            }
            level--;
            emit("}");

            if (loop) {
                mergeLoop(outer, registers);
            }
            for (Map.Entry<String, Integer> e : overwritten.entrySet()) {
                Register reg = outer.get(e.getKey());
                if (reg != null) {
                    reg.definitions.add(e.getValue());
                }
            }
        }

        /**
         * Inside a loop no outer value is known: every register is overwritten, but its
         * first definition is remembered so it can be made visible.
         */
        private Map<String, Register> loopSnapshot(Map<String, Register> outer) {
            Map<String, Register> snapshot = new LinkedHashMap<>();
            for (Map.Entry<String, Register> e : outer.entrySet()) {
                snapshot.put(e.getKey(), new Register("", e.getValue().definitions.get(0), true));
            }
            return snapshot;
        }

        private void mergeLoop(Map<String, Register> outer, Map<String, Register> registers) {
            for (Map.Entry<String, Register> e : registers.entrySet()) {
                Register inner = e.getValue();
                Register before = outer.get(e.getKey());
                if (inner.overwritten && inner.definitions.size() > 1 && before != null && !before.overwritten) {
                    before.overwritten = true;
                    before.definitions.addAll(inner.definitions.subList(1, inner.definitions.size()));
                }
            }
        }

        private String nextLine() throws DecompileException {
            lineIndex++;
            if (lineIndex >= code.size()) {
                throw new DecompileException("no more lines", function.getName());
            }
            return code.get(lineIndex).getTranslated();
        }

        private void emit(String line) {
            code.get(lineIndex).setDecompiled(line.isEmpty() ? "" : "\t".repeat(level) + line);
        }

        // ========== Lines ==========

        private String simplifyLine(String line, Map<String, Register> registers,
                                    Map<String, Register> outer, Map<String, Integer> overwritten) {
            if (line.contains("PushContext")) {
                line = "ACCU = Scope[CURRENT-1]";
            } else if (line.contains("PopContext")) {
                line = "ACCU = Scope[CURRENT]";
            }
            line = numberScopes(line);

            Matcher m = ASSIGNMENT_PATTERN.matcher(line);
            if (!m.matches()) {
                return substituteRegisters(inlineSlots(line), registers);
            }

            String lhs = m.group(1);
            String rhs = substituteRegisters(inlineSlots(m.group(2).strip()), registers);

            registers.remove(lhs);
            Register previous = outer.get(lhs);
            if (previous != null) {
                previous.overwritten = true;
                overwritten.put(lhs, lineIndex);
            }
            for (Register reg : registers.values()) {
                if (reg.mentions(lhs)) {
                    reg.overwritten = true;
                }
            }
            if (isSubstitutable(rhs)) {
                registers.put(lhs, new Register(rhs, lineIndex));
            }

            Matcher slot = SLOT_PATTERN.matcher(lhs);
            if (slot.matches()) {
                recordSlot(Integer.parseInt(slot.group(1)), Integer.parseInt(slot.group(2)), rhs);
            }
            return lhs + " = " + rhs;
        }

        private void recordSlot(int scopeId, int slot, String value) {
            String resolved = resolveConstants(value, function);
            if (!context.getSlots().write(scopeId, slot, resolved)) {
                log.debug("{}: Scope[{}][{}] not inlinable", function.getName(), scopeId, slot);
            }
        }

        private String substituteRegisters(String line, Map<String, Register> registers) {
            Matcher m = REGISTER_PATTERN.matcher(line);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String name = m.group(1);
                Register reg = registers.get(name);
                String replacement = name;
                if (reg != null) {
                    if (!reg.overwritten) {
                        code.get(reg.definitions.get(0)).setVisible(false);
                        replacement = reg.value;
                    } else {
                        for (int idx : reg.definitions) {
                            code.get(idx).setVisible(true);
                        }
                    }
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(sb);
            return sb.toString();
        }

        private String inlineSlots(String text) {
            Matcher m = SLOT_PATTERN.matcher(text);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String value = context.getSlots().get(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
                m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group(0)));
            }
            m.appendTail(sb);
            return sb.toString();
        }

        // ========== Context numbering ==========

        /**
         * Replace symbolic context references with scope ids. A slot read through the
         * current context refers to the enclosing scope; the written slot of an
         * assignment stays in the function's own scope.
         */
        private String numberScopes(String line) {
            Matcher lhs = SCOPE_LHS_PATTERN.matcher(line);
            int lhsStart = lhs.find() ? lhs.start(1) : -1;

            Matcher m = SCOPE_PATTERN.matcher(line);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String expr = m.group(1);
                boolean hasSlot = m.group(2) != null;
                String slotSuffix = hasSlot ? m.group(2) : "";
                boolean isLhs = hasSlot && m.start() == lhsStart;

                Integer id = resolve(expr, hasSlot && !isLhs);
                String replacement = id == null || id == 0
                        ? m.group(0)
                        : "Scope[" + id + "]" + slotSuffix;
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            }
            m.appendTail(sb);
            return sb.toString();
        }

        /**
         * @return scope id, or null when the expression cannot be resolved
         */
        private @Nullable Integer resolve(String expr, boolean readsSlot) {
            String e = expr.strip();
            if (e.matches("\\d+")) {
                return Integer.parseInt(e);
            }

            String base = e;
            int steps = 0;
            int dash = e.indexOf('-');
            if (dash >= 0) {
                base = e.substring(0, dash).strip();
                try {
                    steps = Integer.parseInt(e.substring(dash + 1).strip());
                } catch (NumberFormatException ex) {
                    return null;
                }
            }

            ScopeGraph graph = context.getScopeGraph();
            if (base.equals("CURRENT")) {
                if (steps == 0) {
                    if (readsSlot && outerScopeInfo != null) {
                        return graph.idOf(outerScopeInfo);
                    }
                    return contextId != 0 ? contextId : null;
                }
                String ancestor = graph.ascend(scopeInfo, steps);
                return ancestor != null ? graph.idOf(ancestor) : null;
            }

            // context held in a register: only the current context is known
            if (steps == 0 && contextId != 0) {
                return contextId;
            }
            return null;
        }
    }
}
