package io.github.manjago.v8decomp.core;

/**
 * Protected bytecode region of one handler table entry.
 *
 * @param start first protected offset
 * @param end offset where the protected region ends
 */
public record HandlerRange(int start, int end) {
}
