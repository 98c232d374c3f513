package io.github.manjago.v8decomp.translate;

import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.flow.EdgeSet;
import io.github.manjago.v8decomp.flow.JumpEdge;
import io.github.manjago.v8decomp.flow.JumpType;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * What an {@link OpcodeHandler} sees of the instruction being translated.
 */
public class TranslationContext {

    private final FunctionRecord function;
    private final EdgeSet edges;

    private int offset;
    private String mnemonic = "";
    private String rawOperands = "";
    private List<String> operands = List.of();

    TranslationContext(FunctionRecord function, EdgeSet edges) {
        this.function = function;
        this.edges = edges;
    }

    void moveTo(int offset, String mnemonic, String rawOperands, List<String> operands) {
        this.offset = offset;
        this.mnemonic = mnemonic;
        this.rawOperands = rawOperands;
        this.operands = operands;
    }

    public int getOffset() {
        return offset;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    /**
     * @return operand text after the mnemonic, unsplit
     */
    public String getRawOperands() {
        return rawOperands;
    }

    /**
     * @return operands split on {@code ", "}
     */
    public List<String> getOperands() {
        return operands;
    }

    /**
     * @return operand at the index, or "" when absent
     */
    public String operand(int index) {
        return index < operands.size() ? operands.get(index) : "";
    }

    public String getFunctionName() {
        return function.getName();
    }

    /**
     * @return constant pool text at the index, or null
     */
    public @Nullable String constant(int index) {
        return function.constantAt(index);
    }

    /**
     * Register a jump edge.
     *
     * @throws IllegalStateException if an edge of the type already starts there
     */
    public void addJump(JumpType type, int start, int end) {
        edges.add(new JumpEdge(type, start, end));
    }

    /**
     * Register a switch head or case edge.
     *
     * @param label {@code "switch (ACCU)"} for the head, {@code "case k:"} for a case
     * @param lastCaseStart start of the last case (head only)
     */
    public void addSwitchCase(int start, int end, String label, @Nullable Integer lastCaseStart) {
        edges.add(new JumpEdge(JumpType.INT_SWITCH, start, end, label, lastCaseStart));
    }
}
