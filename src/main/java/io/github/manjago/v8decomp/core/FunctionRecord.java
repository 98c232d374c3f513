package io.github.manjago.v8decomp.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Parsed metadata and code of one disassembled function (a SharedFunctionInfo block).
 * <p>
 * Records are built incrementally while the parser consumes the block and are kept
 * in a flat, name-keyed registry. Nesting is never materialized as a tree; it is
 * recovered later from the scope-info addresses.
 * <p>
 * Every field has an empty default, so a record whose parse failed halfway is still
 * usable downstream.
 */
public class FunctionRecord {

    /** Name used until the block's address line is seen */
    public static final String UNKNOWN_NAME = "func_unknown";

    private String name = UNKNOWN_NAME;
    private final String declarer;

    private int parameterCount;
    private int registerCount;
    private List<String> constantPool = List.of();
    private List<Instruction> code = new ArrayList<>();
    private Map<Integer, HandlerRange> exceptionTable = new LinkedHashMap<>();

    private String scopeInfoAddress;
    private String outerScopeInfoAddress;

    private boolean failed;
    private final List<String> failures = new ArrayList<>();

    /**
     * @param declarer name of the enclosing function, or null for a top-level block
     */
    public FunctionRecord(@Nullable String declarer) {
        this.declarer = declarer;
    }

    /**
     * Synthesize the record name from its label and block address.
     *
     * @param label "start" for top-level blocks, the referencing constant's label or "nested_N"
     * @param address block address, e.g. "0x2b5a08293a6f"
     */
    public static @NotNull String nameOf(@Nullable String label, String address) {
        String l = label == null || label.isBlank() ? "unknown" : label;
        return "func_" + l + "_" + address;
    }

    // ========== Identity ==========

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public @Nullable String getDeclarer() {
        return declarer;
    }

    // ========== Metadata ==========

    /**
     * @return parameter count as printed by V8 (includes the receiver)
     */
    public int getParameterCount() {
        return parameterCount;
    }

    public void setParameterCount(int parameterCount) {
        this.parameterCount = parameterCount;
    }

    public int getRegisterCount() {
        return registerCount;
    }

    public void setRegisterCount(int registerCount) {
        this.registerCount = registerCount;
    }

    public List<String> getConstantPool() {
        return constantPool;
    }

    public void setConstantPool(List<String> constantPool) {
        this.constantPool = List.copyOf(constantPool);
    }

    /**
     * @return resolved constant text, or null when the index is outside the pool
     */
    public @Nullable String constantAt(int index) {
        return index >= 0 && index < constantPool.size() ? constantPool.get(index) : null;
    }

    public List<Instruction> getCode() {
        return code;
    }

    public void setCode(List<Instruction> code) {
        this.code = new ArrayList<>(code);
    }

    /**
     * @return handler offset -> protected region
     */
    public Map<Integer, HandlerRange> getExceptionTable() {
        return Collections.unmodifiableMap(exceptionTable);
    }

    public void setExceptionTable(Map<Integer, HandlerRange> exceptionTable) {
        this.exceptionTable = new LinkedHashMap<>(exceptionTable);
    }

    public @Nullable String getScopeInfoAddress() {
        return scopeInfoAddress;
    }

    public void setScopeInfoAddress(String scopeInfoAddress) {
        this.scopeInfoAddress = scopeInfoAddress;
    }

    public @Nullable String getOuterScopeInfoAddress() {
        return outerScopeInfoAddress;
    }

    public void setOuterScopeInfoAddress(String outerScopeInfoAddress) {
        this.outerScopeInfoAddress = outerScopeInfoAddress;
    }

    // ========== Failures ==========

    /**
     * Mark the record as incomplete. The record stays in the registry and is still
     * processed by later stages on a best-effort basis.
     *
     * @param stage stage that failed
     * @param message failure description
     */
    public void markFailed(String stage, String message) {
        this.failed = true;
        failures.add(stage + ": " + message);
    }

    public boolean isFailed() {
        return failed;
    }

    public List<String> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    /**
     * @return explicit parameter names a0..aN (the receiver is not listed)
     */
    public List<String> parameterNames() {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < parameterCount - 1; i++) {
            names.add("a" + i);
        }
        return names;
    }

    @Override
    public String toString() {
        return String.format("FunctionRecord[%s, params=%d, regs=%d, pool=%d, code=%d%s]",
                name, parameterCount, registerCount, constantPool.size(), code.size(),
                failed ? ", failed" : "");
    }
}
