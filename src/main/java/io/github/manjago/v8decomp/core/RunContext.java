package io.github.manjago.v8decomp.core;

import io.github.manjago.v8decomp.parser.FixedArrayTable;
import io.github.manjago.v8decomp.simplify.FunctionContextTable;
import io.github.manjago.v8decomp.simplify.ScopeGraph;
import io.github.manjago.v8decomp.simplify.SlotEnvironment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All mutable state of one decompilation run.
 * <p>
 * The literal-array table is filled by the prescan and read-only afterwards.
 * The scope graph is built once every function is parsed. The slot environment
 * and the function context table grow while functions are simplified.
 * <p>
 * A new run must use a new context.
 */
public class RunContext {

    private final String sourceName;
    private final FixedArrayTable fixedArrays = new FixedArrayTable();
    private final Map<String, FunctionRecord> functions = new LinkedHashMap<>();
    private final SlotEnvironment slots = new SlotEnvironment();
    private final FunctionContextTable functionContexts = new FunctionContextTable();
    private ScopeGraph scopeGraph = ScopeGraph.empty();

    public RunContext(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    public FixedArrayTable getFixedArrays() {
        return fixedArrays;
    }

    // ========== Function registry ==========

    /**
     * Store a record under its name. A record with the same name is replaced.
     *
     * @return the replaced record, or null
     */
    public FunctionRecord register(FunctionRecord record) {
        return functions.put(record.getName(), record);
    }

    /**
     * @return registry in parse order (a nested function precedes its declarer)
     */
    public Map<String, FunctionRecord> getFunctions() {
        return Collections.unmodifiableMap(functions);
    }

    public int functionCount() {
        return functions.size();
    }

    // ========== Simplification state ==========

    public ScopeGraph getScopeGraph() {
        return scopeGraph;
    }

    public void setScopeGraph(ScopeGraph scopeGraph) {
        this.scopeGraph = scopeGraph;
    }

    public SlotEnvironment getSlots() {
        return slots;
    }

    public FunctionContextTable getFunctionContexts() {
        return functionContexts;
    }
}
