package io.github.manjago.v8decomp.output;

import java.util.Locale;

/**
 * Granularity of an exported function listing.
 */
public enum ExportFormat {

    /** Raw bytecode lines, {@code @ offset : instruction} */
    BYTECODE,

    /** Translated statements after control-flow reconstruction */
    TRANSLATED,

    /** Simplified pseudocode, hidden lines dropped */
    DECOMPILED;

    /**
     * Parse a format name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ExportFormat parse(String name) {
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown export format: " + name
                    + " (expected bytecode, translated or decompiled)", e);
        }
    }
}
