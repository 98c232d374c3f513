package io.github.manjago.v8decomp.flow;

import org.jetbrains.annotations.Nullable;

/**
 * A typed relationship between a branch offset and its target offset.
 * <p>
 * Edges are created by the translator and consumed at most once by the
 * reconstructor. Switch edges also carry their case label; a switch head carries
 * the start of its last case.
 */
public final class JumpEdge {

    private JumpType type;
    private final int start;
    private int end;
    private boolean consumed;

    private final String caseLabel;
    private final Integer lastCaseStart;

    public JumpEdge(JumpType type, int start, int end) {
        this(type, start, end, null, null);
    }

    public JumpEdge(JumpType type, int start, int end, @Nullable String caseLabel, @Nullable Integer lastCaseStart) {
        this.type = type;
        this.start = start;
        this.end = end;
        this.caseLabel = caseLabel;
        this.lastCaseStart = lastCaseStart;
    }

    public JumpType getType() {
        return type;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public boolean isConsumed() {
        return consumed;
    }

    public boolean isZeroWidth() {
        return start == end;
    }

    public @Nullable String getCaseLabel() {
        return caseLabel;
    }

    public @Nullable Integer getLastCaseStart() {
        return lastCaseStart;
    }

    public boolean isSwitchHead() {
        return type == JumpType.INT_SWITCH && caseLabel != null && caseLabel.contains("switch");
    }

    void setEnd(int end) {
        this.end = end;
    }

    void consume() {
        this.consumed = true;
    }

    void reclassify(JumpType type) {
        this.type = type;
    }

    @Override
    public String toString() {
        return String.format("%s(%d -> %d%s%s)", type, start, end,
                caseLabel != null ? ", '" + caseLabel + "'" : "",
                consumed ? ", consumed" : "");
    }
}
