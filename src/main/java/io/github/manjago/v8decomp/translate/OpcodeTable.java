package io.github.manjago.v8decomp.translate;

import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Mnemonic to pseudocode mapping for one bytecode format revision.
 * <p>
 * Implementations need a public no-argument constructor: the table class is
 * chosen by configuration and instantiated reflectively.
 */
public interface OpcodeTable {

    /**
     * @param mnemonic opcode name as printed in the dump
     * @return handler, or null for an unknown opcode
     */
    @Nullable OpcodeHandler lookup(String mnemonic);

    /**
     * @return mnemonics this table knows
     */
    Set<String> mnemonics();
}
