package io.github.manjago.v8decomp.translate;

/**
 * Translation of one opcode.
 */
@FunctionalInterface
public interface OpcodeHandler {

    /**
     * @param ctx current instruction, its operands and the jump registry
     * @return pseudo-statement text, possibly empty
     */
    String translate(TranslationContext ctx);
}
