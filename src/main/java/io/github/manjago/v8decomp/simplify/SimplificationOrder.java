package io.github.manjago.v8decomp.simplify;

import io.github.manjago.v8decomp.core.FunctionRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Outer-before-inner processing order: functions sorted by the depth of their outer
 * scope, registry order kept within a depth. Slot writes of outer functions are
 * then known when inner functions read them.
 */
public final class SimplificationOrder {

    private SimplificationOrder() {
    }

    public static List<FunctionRecord> of(Collection<FunctionRecord> functions, ScopeGraph graph) {
        List<FunctionRecord> ordered = new ArrayList<>(functions);
        ordered.sort(Comparator.comparingInt(f -> graph.depthOfOuter(f.getOuterScopeInfoAddress())));
        return ordered;
    }
}
