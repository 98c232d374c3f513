package io.github.manjago.v8decomp.core;

import org.jetbrains.annotations.NotNull;

/**
 * A single line of a function's code listing.
 * <p>
 * Parsed bytecode lines carry their offset, hex bytes and raw instruction text.
 * The translator fills {@link #getTranslated()}, the control-flow reconstructor
 * rewrites it (brace insertion) and the simplifier fills {@link #getDecompiled()}
 * and toggles visibility.
 * <p>
 * Synthetic lines (braces and exploded multi-line statements) have offset
 * {@link #SYNTHETIC}.
 */
public final class Instruction {

    /** Offset used for lines that do not come from the bytecode listing */
    public static final int SYNTHETIC = -1;

    private final int offset;
    private final String hexBytes;
    private final String instruction;
    private final boolean placeholder;

    private String translated = "";
    private String decompiled = "";
    private boolean visible = true;

    private Instruction(int offset, String hexBytes, String instruction, boolean placeholder) {
        this.offset = offset;
        this.hexBytes = hexBytes;
        this.instruction = instruction;
        this.placeholder = placeholder;
    }

    /**
     * Create an instruction parsed from a bytecode line.
     *
     * @param offset bytecode offset
     * @param hexBytes encoded bytes as printed in the dump
     * @param instruction mnemonic and operands, e.g. {@code "Ldar a0"}
     */
    public static @NotNull Instruction of(int offset, String hexBytes, String instruction) {
        return new Instruction(offset, hexBytes, instruction, false);
    }

    /**
     * Create an inert filler for an offset with no parsed instruction.
     *
     * @param offset bytecode offset
     * @param note text kept as the raw instruction
     */
    public static @NotNull Instruction placeholder(int offset, String note) {
        return new Instruction(offset, "", note, true);
    }

    /**
     * Create a synthetic line holding already translated text.
     */
    public static @NotNull Instruction synthetic(String translated) {
        Instruction line = new Instruction(SYNTHETIC, "", "", true);
        line.translated = translated;
        return line;
    }

    // ========== Getters ==========

    public int getOffset() {
        return offset;
    }

    public String getHexBytes() {
        return hexBytes;
    }

    public String getInstruction() {
        return instruction;
    }

    /**
     * @return true for gap fillers, unparseable bytecode lines and synthetic lines
     */
    public boolean isPlaceholder() {
        return placeholder;
    }

    public boolean isSynthetic() {
        return offset == SYNTHETIC;
    }

    public String getTranslated() {
        return translated;
    }

    public void setTranslated(String translated) {
        this.translated = translated != null ? translated : "";
    }

    public String getDecompiled() {
        return decompiled;
    }

    public void setDecompiled(String decompiled) {
        this.decompiled = decompiled != null ? decompiled : "";
    }

    public boolean isVisible() {
        return visible;
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    @Override
    public String toString() {
        if (isSynthetic()) {
            return translated;
        }
        return String.format("@%d %s", offset, instruction);
    }
}
