package io.github.manjago.v8decomp.flow;

import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.core.Instruction;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns translated statements plus jump edges into brace-structured pseudocode.
 * <p>
 * Braces and keywords are spliced into the translated text of the instructions
 * at the edge endpoints; multi-line texts are exploded into synthetic lines at
 * the end and the whole function is wrapped in one pair of braces.
 *
 * <h2>Edge handling:</h2>
 * <ul>
 *   <li>LOOP: {@code while (true)} around the loop body, with break and continue detection</li>
 *   <li>EXCEPTION: {@code try} / {@code catch} using the jump over the handler</li>
 *   <li>INT_SWITCH: flat {@code switch} with one braced section per case</li>
 *   <li>IF: value switch over compared constants, otherwise {@code if} with
 *       {@code &&}/{@code ||} fusion and {@code else}</li>
 *   <li>IF_JS_RECEIVER: receiver checks are blanked</li>
 * </ul>
 * Edges whose offsets cannot be resolved are treated as satisfied. Shapes no
 * handler recognizes are left as flat statements.
 */
public class ControlFlowReconstructor {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowReconstructor.class);

    public static final int DEFAULT_CONTINUE_WINDOW = 4;

    private static final String CLOSE = "\n}\n";
    private static final Pattern CASE_COMPARE_PATTERN = Pattern.compile("^ACCU = (\\S+) ===? ACCU$");

    private final int continueWindow;

    public ControlFlowReconstructor() {
        this(DEFAULT_CONTINUE_WINDOW);
    }

    /**
     * @param continueWindow bytecode offsets before the loop end within which a jump counts as continue
     */
    public ControlFlowReconstructor(int continueWindow) {
        this.continueWindow = continueWindow;
    }

    /**
     * Structure the function's code in place.
     *
     * @param function translated function
     * @param edges edges registered during translation
     */
    public void reconstruct(FunctionRecord function, EdgeSet edges) {
        new FunctionPass(function, edges).run();
        expand(function);
    }

    /**
     * Explode multi-line statements into separate lines and wrap the code in one
     * pair of braces. Empty fragments after the first are dropped.
     */
    public void expand(FunctionRecord function) {
        List<Instruction> out = new ArrayList<>();
        out.add(Instruction.synthetic("{"));
        for (Instruction instruction : function.getCode()) {
            String[] parts = instruction.getTranslated().split("\n", -1);
            instruction.setTranslated(parts[0]);
            out.add(instruction);
            for (int i = 1; i < parts.length; i++) {
                if (!parts[i].isEmpty()) {
                    out.add(Instruction.synthetic(parts[i]));
                }
            }
        }
        out.add(Instruction.synthetic("}"));
        function.setCode(out);
    }

    /**
     * State of one function's reconstruction.
     */
    private final class FunctionPass {

        private final String name;
        private final EdgeSet edges;
        private final OffsetIndex index;
        private final Set<Integer> breakStarts = new HashSet<>();

        FunctionPass(FunctionRecord function, EdgeSet edges) {
            this.name = function.getName();
            this.edges = edges;
            this.index = new OffsetIndex(function.getCode());
        }

        void run() {
            if (index.isEmpty()) {
                edges.all().forEach(edges::consume);
                return;
            }

            List<JumpEdge> ordered = prepare();
            removeReceiverChecks();

            for (JumpEdge edge : ordered) {
                if (edge.isConsumed()) {
                    continue;
                }
                switch (edge.getType()) {
                    case LOOP -> handleLoop(edge);
                    case EXCEPTION -> handleException(edge);
                    case INT_SWITCH -> handleIntSwitch(edge);
                    case IF -> {
                        if (!handleValueSwitch(edge)) {
                            handleIf(edge);
                        }
                    }
                    default -> {
                        // plain jumps were absorbed by the handlers above or stay as they are
                    }
                }
            }

            long left = edges.all().stream().filter(e -> !e.isConsumed()).count();
            log.debug("{}: {} edges, {} left unstructured", name, edges.size(), left);
        }

        // ========== Preprocessing ==========

        /**
         * Consume zero-width edges, move ends to the last guarded instruction and sort.
         */
        private List<JumpEdge> prepare() {
            for (JumpEdge edge : edges.all()) {
                if (edge.isZeroWidth()) {
                    edges.consume(edge);
                    continue;
                }
                if (edge.getType().shiftsEnd()) {
                    edge.setEnd(index.relative(edge.getEnd(), -1));
                }
            }
            return edges.sorted();
        }

        /**
         * Blank every line of a receiver check, from the jump through its shifted end.
         * Edges starting inside the check go with it.
         */
        private void removeReceiverChecks() {
            for (JumpEdge guard : edges.pending(JumpType.IF_JS_RECEIVER)) {
                if (guard.isConsumed()) {
                    continue;
                }
                Integer from = index.snap(guard.getStart());
                for (int offset : index.between(guard.getStart(), guard.getEnd())) {
                    Instruction line = index.line(offset);
                    if (line != null) {
                        line.setTranslated("");
                    }
                    if (from != null && offset > from) {
                        for (JumpType type : JumpType.values()) {
                            JumpEdge inside = edges.pending(type, offset);
                            if (inside != null) {
                                edges.consume(inside);
                            }
                        }
                    }
                }
                edges.consume(guard);
            }
        }

        // ========== Sections ==========

        /**
         * Close a brace section at {@code end}, never past an enclosed catch handler.
         *
         * @return offset of the line that received the brace
         */
        private int closeSection(int start, int end) {
            for (JumpEdge handler : edges.ofType(JumpType.CATCH)) {
                if (start < handler.getStart() && handler.getStart() <= end) {
                    end = handler.getStart();
                }
            }
            Instruction line = index.line(end);
            if (line == null) {
                return end;
            }
            String text = line.getTranslated();
            line.setTranslated(text.contains("{") ? CLOSE + text : text + CLOSE);
            return line.getOffset();
        }

        /**
         * Add a statement to a line without moving it past the closing braces the
         * line already ends with.
         *
         * @param inline true to join the statement to the last statement with a space
         */
        private void attach(Instruction line, String statement, boolean inline) {
            String text = line.getTranslated();
            int cut = text.length();
            while (cut >= CLOSE.length() && text.startsWith(CLOSE, cut - CLOSE.length())) {
                cut -= CLOSE.length();
            }
            String core = text.substring(0, cut);
            String closes = text.substring(cut);
            String joined;
            if (core.isEmpty() || core.endsWith("\n")) {
                joined = core + statement;
            } else {
                joined = core + (inline ? " " : "\n") + statement;
            }
            line.setTranslated(joined + closes);
        }

        /**
         * Turn pending IF and JUMP edges leaving {@code [rangeStart, rangeEnd]} into breaks.
         *
         * @return offsets of the lines the breaks jump to
         */
        private Set<Integer> handleBreak(int rangeStart, int rangeEnd) {
            Set<Integer> ends = new TreeSet<>();
            for (JumpEdge jump : edges.pending(JumpType.IF, JumpType.JUMP)) {
                if (!(rangeStart <= jump.getStart() && jump.getStart() <= rangeEnd && rangeEnd < jump.getEnd())) {
                    continue;
                }
                Instruction startLine = index.line(jump.getStart());
                Instruction endLine = index.line(jump.getEnd());
                if (startLine == null || endLine == null) {
                    continue;
                }
                attach(startLine, "break", jump.getType() == JumpType.IF);
                ends.add(endLine.getOffset());
                breakStarts.add(jump.getStart());
                edges.consume(jump);
            }
            return ends;
        }

        /**
         * Turn pending edges that jump to the last few offsets of a loop into continues.
         * The window counts offsets, placeholders included.
         */
        private void handleContinue(int rangeStart, int rangeEnd) {
            int nearLoopEnd = rangeEnd - continueWindow;
            for (JumpEdge jump : edges.pending(JumpType.IF, JumpType.JUMP)) {
                if (!(rangeStart <= jump.getStart() && jump.getStart() <= rangeEnd
                        && nearLoopEnd <= jump.getEnd() && jump.getEnd() <= rangeEnd)) {
                    continue;
                }
                if (jump.getType() == JumpType.IF
                        && (edges.pending(JumpType.JUMP, jump.getEnd()) != null || breakStarts.contains(jump.getEnd()))) {
                    continue;
                }
                Instruction startLine = index.line(jump.getStart());
                Instruction endLine = index.line(jump.getEnd());
                if (startLine == null || endLine == null) {
                    continue;
                }
                attach(startLine, "continue", jump.getType() == JumpType.IF);
                edges.consume(jump);
            }
        }

        // ========== Loops ==========

        private void handleLoop(JumpEdge loop) {
            Instruction startLine = index.line(loop.getStart());
            if (startLine == null) {
                edges.consume(loop);
                return;
            }
            startLine.setTranslated("while (true)\n{\n" + startLine.getTranslated());
            closeSection(loop.getStart(), loop.getEnd());
            edges.consume(loop);

            // breaks and continues were shifted one back, so is the loop end
            int inner = index.relative(loop.getEnd(), -1);
            handleBreak(loop.getStart(), inner);
            handleContinue(loop.getStart(), inner);
        }

        // ========== Exceptions ==========

        private void handleException(JumpEdge tryEdge) {
            Instruction startLine = index.line(tryEdge.getStart());
            if (startLine == null) {
                edges.consume(tryEdge);
                return;
            }
            startLine.setTranslated("try\n{\n" + startLine.getTranslated());

            JumpEdge catchJump = edges.pending(JumpType.JUMP, tryEdge.getEnd());
            if (catchJump != null) {
                Instruction catchStart = index.line(catchJump.getStart());
                Instruction catchEnd = index.line(catchJump.getEnd());
                if (catchStart != null) {
                    catchStart.setTranslated(catchStart.getTranslated() + "\n}\ncatch\n{");
                }
                if (catchEnd != null) {
                    catchEnd.setTranslated(catchEnd.getTranslated() + CLOSE);
                }
                catchJump.reclassify(JumpType.CATCH);
                edges.consume(catchJump);
            } else {
                Instruction endLine = index.line(tryEdge.getEnd());
                if (endLine != null) {
                    endLine.setTranslated(endLine.getTranslated() + "\n}\ncatch {}\n");
                }
            }
            edges.consume(tryEdge);
        }

        // ========== Switches ==========

        private void handleIntSwitch(JumpEdge head) {
            if (!head.isSwitchHead()) {
                return;
            }
            Instruction startLine = index.line(head.getStart());
            if (startLine == null) {
                return;
            }
            edges.consume(head);
            startLine.setTranslated(startLine.getTranslated() + "\n" + head.getCaseLabel() + "\n{\n");

            Set<Integer> switchEnd = new TreeSet<>();
            Set<JumpEdge> visited = new HashSet<>();
            int prevStart = head.getStart();
            JumpEdge current = edges.pending(JumpType.INT_SWITCH, head.getEnd());
            while (current != null && visited.add(current)) {
                Instruction caseLine = index.line(current.getStart());
                if (caseLine != null) {
                    caseLine.setTranslated(CLOSE + current.getCaseLabel() + "\n{\n" + caseLine.getTranslated());
                }
                // case starts double as the shifted end of the previous case
                switchEnd.addAll(handleBreak(prevStart, index.relative(current.getStart(), -1)));
                prevStart = current.getStart();
                edges.consume(current);
                current = edges.pending(JumpType.INT_SWITCH, current.getEnd());
            }

            int lastCaseStart = head.getLastCaseStart() != null ? head.getLastCaseStart() : prevStart;
            if (!switchEnd.isEmpty()) {
                int first = Collections.min(switchEnd);
                switchEnd.addAll(handleBreak(lastCaseStart, index.relative(first, -1)));
            }
            closeSwitch(lastCaseStart, switchEnd);
        }

        /**
         * Close the last case using the break targets collected from the cases.
         */
        private void closeSwitch(int lastCaseStart, Set<Integer> breakTargets) {
            List<Integer> ends = new ArrayList<>();
            for (int end : breakTargets) {
                if (end > lastCaseStart) {
                    ends.add(end);
                }
            }

            if (ends.isEmpty()) {
                Instruction lastCase = index.line(lastCaseStart);
                if (lastCase != null) {
                    lastCase.setTranslated(lastCase.getTranslated().replace("\n{\n", "\n{}\n"));
                }
                return;
            }
            if (ends.size() == 1) {
                closeSection(lastCaseStart, ends.get(0));
                return;
            }

            // default section sits between the last two break targets
            int defaultStart = ends.get(ends.size() - 2);
            int switchEnd = ends.get(ends.size() - 1);
            Instruction defaultLine = index.line(defaultStart);
            if (defaultLine != null) {
                defaultLine.setTranslated(defaultLine.getTranslated() + "\n}\ndefault:\n{\n");
            }
            int end = closeSection(defaultStart, switchEnd);
            handleBreak(defaultStart, ends.size() == 2 ? index.relative(end, -1) : end);
        }

        /**
         * Recognize a chain of {@code value === subject} tests jumping to case bodies,
         * followed by a jump to the default body.
         *
         * @return true when the edge was structured as a switch
         */
        private boolean handleValueSwitch(JumpEdge first) {
            List<JumpEdge> cases = new ArrayList<>();
            for (JumpEdge c : edges.pending(JumpType.IF)) {
                if (first.getStart() <= c.getStart() && c.getStart() <= first.getEnd() && first.getEnd() <= c.getEnd()) {
                    cases.add(c);
                }
            }
            if (cases.isEmpty()) {
                return false;
            }

            JumpEdge defaultCase = edges.pending(JumpType.JUMP,
                    index.relative(cases.get(cases.size() - 1).getStart(), 1));
            long distinctEnds = cases.stream().mapToInt(JumpEdge::getEnd).distinct().count();
            if (distinctEnds < 2 || defaultCase == null || first.getEnd() < defaultCase.getStart()) {
                return false;
            }

            cases.add(defaultCase);
            cases.sort(Comparator.comparingInt(JumpEdge::getEnd));

            String subject = null;
            boolean headerWritten = false;
            StringBuilder caseLine = new StringBuilder();
            Set<Integer> switchEnd = new TreeSet<>();
            Integer prevCaseStart = null;

            for (int idx = 0; idx < cases.size(); idx++) {
                JumpEdge c = cases.get(idx);
                if (c == defaultCase) {
                    caseLine.append("default:\n");
                } else {
                    caseLine.append("case CASE_").append(idx).append(":\n");
                    String compared = captureCaseValue(c, idx);
                    if (subject == null) {
                        subject = compared;
                    }
                }
                edges.consume(c);

                if (idx + 1 < cases.size() && c.getEnd() == cases.get(idx + 1).getEnd()) {
                    continue;
                }
                if (prevCaseStart != null) {
                    switchEnd.addAll(handleBreak(index.relative(prevCaseStart, 1), c.getEnd()));
                }

                Instruction endLine = index.line(c.getEnd());
                if (endLine != null) {
                    String header = headerWritten ? "" : "switch (" + (subject != null ? subject : "") + ")\n";
                    endLine.setTranslated(endLine.getTranslated() + header + caseLine + "{\n");
                }
                headerWritten = true;
                prevCaseStart = c.getEnd();
                caseLine.setLength(0);
                caseLine.append(CLOSE);
            }

            JumpEdge last = cases.get(cases.size() - 1);
            if (switchEnd.isEmpty() || Collections.max(switchEnd) == defaultCase.getEnd()) {
                Instruction lastEnd = index.line(last.getEnd());
                if (lastEnd != null) {
                    lastEnd.setTranslated(lastEnd.getTranslated().replace("\n{\n", "\n{}\n"));
                }
                return true;
            }

            int end = closeSection(last.getStart(), Collections.max(switchEnd));
            handleBreak(last.getStart(), index.relative(end, -1));
            return true;
        }

        /**
         * Store the value a case compares against in {@code CASE_idx}.
         *
         * @return the compared subject, or null when the comparison was not found
         */
        private @Nullable String captureCaseValue(JumpEdge c, int idx) {
            Instruction jumpLine = index.line(c.getStart());
            int prevOffset = index.relative(c.getStart(), -1);
            Instruction compareLine = prevOffset != c.getStart() ? index.line(prevOffset) : null;
            String temp = "CASE_" + idx + " = ACCU";

            if (compareLine != null) {
                Matcher m = CASE_COMPARE_PATTERN.matcher(compareLine.getTranslated());
                if (m.matches()) {
                    compareLine.setTranslated(temp);
                    if (jumpLine != null) {
                        jumpLine.setTranslated("");
                    }
                    return m.group(1);
                }
            }
            if (jumpLine != null) {
                jumpLine.setTranslated(temp);
            }
            return null;
        }

        // ========== Conditionals ==========

        private void handleIf(JumpEdge first) {
            if (first.isZeroWidth()) {
                Instruction line = index.line(first.getStart());
                if (line != null) {
                    line.setTranslated(line.getTranslated() + " {}");
                }
                edges.consume(first);
                return;
            }

            JumpEdge lastIf = lastIfInStatement(first);
            List<JumpEdge> chain = new ArrayList<>();
            for (JumpEdge jump : edges.pending(JumpType.IF)) {
                if (first.getStart() <= jump.getStart() && jump.getStart() <= lastIf.getStart() && !jump.isZeroWidth()) {
                    chain.add(jump);
                }
            }
            Map<Integer, String> operators = andOrTable(chain, lastIf);

            String connective = "if";
            for (JumpEdge jump : chain) {
                String op = operators.get(jump.getEnd());
                if (op == null) {
                    continue;
                }
                if (op.equals("&&")) {
                    invertCondition(jump);
                }
                Instruction line = index.line(jump.getStart());
                if (line != null) {
                    line.setTranslated(replaceFirst(line.getTranslated(), "if (", connective + " ("));
                }
                connective = "\t" + op;
                edges.consume(jump);
            }

            Instruction lastLine = index.line(lastIf.getStart());
            if (lastLine != null) {
                lastLine.setTranslated(lastLine.getTranslated() + "\n{");
            }

            JumpEdge elseJump = edges.pending(JumpType.JUMP, lastIf.getEnd());
            if (elseJump != null && !elseJump.isZeroWidth()) {
                Instruction elseStart = index.line(elseJump.getStart());
                if (elseStart != null) {
                    elseStart.setTranslated(elseStart.getTranslated() + "\n}\nelse\n{");
                }
                closeSection(elseJump.getStart(), elseJump.getEnd());
                edges.consume(elseJump);
            } else {
                closeSection(lastIf.getStart(), lastIf.getEnd());
            }
        }

        /**
         * Follow conditionals that start where the previous one ends to find the last
         * condition of a fused expression.
         */
        private JumpEdge lastIfInStatement(JumpEdge jump) {
            JumpEdge last = jump;
            Set<JumpEdge> seen = new HashSet<>();
            seen.add(last);
            while (true) {
                JumpEdge next = edges.pending(JumpType.IF, last.getEnd());
                if (next == null || next.isZeroWidth() || !seen.add(next)) {
                    break;
                }
                last = next;
            }

            // several && conditions all jump to the else branch
            JumpEdge elseJump = edges.pending(JumpType.JUMP, last.getEnd());
            if (elseJump != null) {
                JumpEdge candidate = last;
                for (JumpEdge j : edges.pending(JumpType.IF)) {
                    if (j.getEnd() == elseJump.getStart() && (candidate.getEnd() != elseJump.getStart()
                            || j.getStart() > candidate.getStart())) {
                        candidate = j;
                    }
                }
                last = candidate;
            }

            // a conditional that only skips a far jump takes over the far jump's target
            JumpEdge farJump = edges.pending(JumpType.JUMP, index.relative(last.getStart(), 1));
            if (farJump != null) {
                last.setEnd(farJump.getEnd());
                edges.consume(farJump);
            }
            return last;
        }

        /**
         * Color each link of a conditional chain {@code &&} or {@code ||}, keyed by the
         * link's end offset, breadth-first from the statement body.
         */
        private Map<Integer, String> andOrTable(List<JumpEdge> chain, JumpEdge lastIf) {
            Map<Integer, String> known = new LinkedHashMap<>();
            int afterLast = index.relative(lastIf.getStart(), 1);
            known.put(afterLast, "||");
            known.put(lastIf.getEnd(), "&&");

            Deque<Map.Entry<Integer, String>> queue = new ArrayDeque<>();
            queue.add(Map.entry(afterLast, "||"));
            queue.add(Map.entry(lastIf.getEnd(), "&&"));

            while (!queue.isEmpty()) {
                Map.Entry<Integer, String> entry = queue.poll();
                for (JumpEdge jump : chain) {
                    if (jump.getEnd() == entry.getKey() && !known.containsKey(jump.getStart())) {
                        String opposite = entry.getValue().equals("&&") ? "||" : "&&";
                        known.put(jump.getStart(), opposite);
                        queue.add(Map.entry(jump.getStart(), opposite));
                    }
                }
            }
            return known;
        }

        /**
         * Negate the condition of a conditional jump line.
         */
        private void invertCondition(JumpEdge jump) {
            Instruction line = index.line(jump.getStart());
            if (line == null) {
                return;
            }
            String text = line.getTranslated();
            int at = Math.max(text.indexOf("if ("), 0);
            String head = text.substring(0, at);
            String cond = text.substring(at);

            if (cond.contains(" !== ")) {
                cond = replaceFirst(cond, " !== ", " === ");
            } else if (cond.contains(" === ")) {
                cond = replaceFirst(cond, " === ", " !== ");
            } else if (cond.contains(" != ")) {
                cond = replaceFirst(cond, " != ", " == ");
            } else if (cond.contains(" == ")) {
                cond = replaceFirst(cond, " == ", " != ");
            } else {
                int paren = cond.indexOf('(');
                if (paren < 0) {
                    return;
                }
                if (cond.startsWith("(!", paren)) {
                    cond = cond.substring(0, paren + 1) + cond.substring(paren + 2);
                } else {
                    cond = cond.substring(0, paren + 1) + "!" + cond.substring(paren + 1);
                }
            }
            line.setTranslated(head + cond);
        }
    }

    private static String replaceFirst(String text, String target, String replacement) {
        int at = text.indexOf(target);
        if (at < 0) {
            return text;
        }
        return text.substring(0, at) + replacement + text.substring(at + target.length());
    }
}
