package io.github.manjago.v8decomp.flow;

/**
 * Structural role of a jump edge.
 * <p>
 * Declaration order is the tie-breaker when edges share start and end.
 */
public enum JumpType {
    /** Backward {@code JumpLoop}: start is the loop head, end the jump itself */
    LOOP,
    /** Protected region of a handler table entry: start of region to handler */
    EXCEPTION,
    /** Unconditional jump over a catch body, reclassified while handling EXCEPTION */
    CATCH,
    /** {@code SwitchOnSmiNoFeedback} head or one of its cases */
    INT_SWITCH,
    /** Conditional jump */
    IF,
    /** Unconditional forward jump */
    JUMP,
    /** {@code JumpIfJSReceiver} receiver check */
    IF_JS_RECEIVER;

    /**
     * @return true when the end is moved one instruction back before structuring
     */
    public boolean shiftsEnd() {
        return this != LOOP && this != INT_SWITCH;
    }
}
