package io.github.manjago.v8decomp.simplify;

import io.github.manjago.v8decomp.core.FunctionRecord;
import io.github.manjago.v8decomp.parser.FixedArrayTable;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * Lexical scope nesting recovered from scope-info addresses.
 * <p>
 * Every scope-info and outer-scope-info address seen in the registry gets a stable
 * id, 1..N by ascending numeric address. An address first seen later gets the next
 * id after the current maximum; existing ids never change.
 */
public class ScopeGraph {

    private final Map<String, String> parents = new HashMap<>();
    private final Map<String, Integer> ids = new HashMap<>();
    private int maxId;

    private ScopeGraph() {
    }

    public static ScopeGraph empty() {
        return new ScopeGraph();
    }

    /**
     * Build the graph over every function of a run.
     */
    public static ScopeGraph build(Collection<FunctionRecord> functions) {
        ScopeGraph graph = new ScopeGraph();
        Set<String> addresses = new LinkedHashSet<>();
        for (FunctionRecord function : functions) {
            String scope = function.getScopeInfoAddress();
            String outer = function.getOuterScopeInfoAddress();
            if (scope != null) {
                graph.parents.put(scope, outer);
                addresses.add(scope);
            }
            if (outer != null) {
                addresses.add(outer);
            }
        }

        List<String> sorted = new ArrayList<>(addresses);
        sorted.sort(Comparator.<String, Long>comparing(ScopeGraph::numeric, Long::compareUnsigned)
                .thenComparing(Comparator.<String>naturalOrder()));
        for (String address : sorted) {
            graph.idOf(address);
        }
        return graph;
    }

    private static long numeric(String address) {
        Long value = FixedArrayTable.parseAddress(address);
        return value != null ? value : 0L;
    }

    /**
     * @return stable id of the address; an unknown address gets the next free id
     */
    public int idOf(String address) {
        Integer id = ids.get(address);
        if (id != null) {
            return id;
        }
        ids.put(address, ++maxId);
        return maxId;
    }

    /**
     * @return the address as the outer scope of another one, or null for a root
     *         or unknown scope
     */
    public @Nullable String parentOf(String address) {
        return parents.get(address);
    }

    /**
     * Walk {@code steps} levels up from the address.
     *
     * @return ancestor address, or null when the chain ends first
     */
    public @Nullable String ascend(@Nullable String address, int steps) {
        String current = address;
        for (int i = 0; i < steps; i++) {
            if (current == null) {
                return null;
            }
            current = parents.get(current);
        }
        return current;
    }

    /**
     * Nesting depth of a function whose outer scope is {@code outer}: 0 without an
     * outer scope, otherwise one more than the number of ancestors of the outer scope.
     */
    public int depthOfOuter(@Nullable String outer) {
        int depth = 0;
        Set<String> seen = new HashSet<>();
        String current = outer;
        while (current != null && seen.add(current)) {
            current = parents.get(current);
            depth++;
        }
        return depth;
    }

    /**
     * @return address to id, in id order
     */
    public Map<String, Integer> ids() {
        Map<String, Integer> out = new LinkedHashMap<>();
        ids.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .forEach(e -> out.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(out);
    }

    public int size() {
        return ids.size();
    }
}
