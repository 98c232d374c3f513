package io.github.manjago.v8decomp.translate;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Opcode tables selectable by name in configuration.
 */
public enum OpcodeTableKind {

    /** Ignition bytecode of current V8 releases */
    V8(V8OpcodeTable::new);

    private final Supplier<OpcodeTable> factory;

    OpcodeTableKind(Supplier<OpcodeTable> factory) {
        this.factory = factory;
    }

    /**
     * @return a fresh table of this kind
     */
    public OpcodeTable create() {
        return factory.get();
    }

    /**
     * Parse a table name, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static OpcodeTableKind parse(String name) {
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown opcode table: " + name + " (expected "
                    + Arrays.stream(values()).map(k -> k.name().toLowerCase(Locale.ROOT))
                            .collect(Collectors.joining(", ")) + ")", e);
        }
    }
}
