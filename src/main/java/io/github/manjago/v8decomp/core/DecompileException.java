package io.github.manjago.v8decomp.core;

/**
 * Failure of one decompilation stage for one function.
 * <p>
 * Always caught at the function boundary: the run logs it, marks the record as
 * failed and moves on to the next function.
 */
public class DecompileException extends Exception {

    private final String functionName;
    private final int offset;

    public DecompileException(String message, String functionName) {
        super(message + " in " + functionName);
        this.functionName = functionName;
        this.offset = -1;
    }

    public DecompileException(String message, String functionName, int offset) {
        super(message + " at offset " + offset + " in " + functionName);
        this.functionName = functionName;
        this.offset = offset;
    }

    public DecompileException(String message, String functionName, Throwable cause) {
        super(message + " in " + functionName + ": " + cause.getMessage(), cause);
        this.functionName = functionName;
        this.offset = -1;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * @return bytecode offset where the failure happened, or -1 when unknown
     */
    public int getOffset() {
        return offset;
    }
}
