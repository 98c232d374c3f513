package io.github.manjago.v8decomp.flow;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Ordered collection of the jump edges of one function.
 * <p>
 * At most one edge of a type may start at a given offset. Lookups by type and
 * start only see pending (not yet consumed) edges.
 */
public class EdgeSet {

    private final List<JumpEdge> edges = new ArrayList<>();

    /**
     * Add an edge.
     * <p>
     * EXCEPTION and INT_SWITCH edges replace an existing edge of the same type and
     * start; for every other type a second edge at the same start is an error.
     *
     * @throws IllegalStateException on a duplicate edge
     */
    public void add(JumpEdge edge) {
        for (int i = 0; i < edges.size(); i++) {
            JumpEdge existing = edges.get(i);
            if (existing.getType() == edge.getType() && existing.getStart() == edge.getStart()) {
                if (edge.getType() == JumpType.EXCEPTION || edge.getType() == JumpType.INT_SWITCH) {
                    edges.set(i, edge);
                    return;
                }
                throw new IllegalStateException("Jump table " + edge.getType()
                        + " already has an edge at " + edge.getStart());
            }
        }
        edges.add(edge);
    }

    /**
     * @return the pending edge of the type starting at the offset, or null
     */
    public @Nullable JumpEdge pending(JumpType type, int start) {
        for (JumpEdge edge : edges) {
            if (!edge.isConsumed() && edge.getType() == type && edge.getStart() == start) {
                return edge;
            }
        }
        return null;
    }

    /**
     * @return pending edges of the types, grouped by type in argument order, each
     *         group in insertion order
     */
    public List<JumpEdge> pending(JumpType... types) {
        List<JumpEdge> out = new ArrayList<>();
        for (JumpType type : types) {
            for (JumpEdge edge : edges) {
                if (!edge.isConsumed() && edge.getType() == type) {
                    out.add(edge);
                }
            }
        }
        return out;
    }

    /**
     * @return every edge of the type, consumed ones included
     */
    public List<JumpEdge> ofType(JumpType type) {
        List<JumpEdge> out = new ArrayList<>();
        for (JumpEdge edge : edges) {
            if (edge.getType() == type) {
                out.add(edge);
            }
        }
        return out;
    }

    /**
     * @return all edges sorted by start, end, type and insertion order
     */
    public List<JumpEdge> sorted() {
        List<JumpEdge> out = new ArrayList<>(edges);
        out.sort(Comparator.comparingInt(JumpEdge::getStart)
                .thenComparingInt(JumpEdge::getEnd)
                .thenComparing(JumpEdge::getType));
        return out;
    }

    public void consume(JumpEdge edge) {
        edge.consume();
    }

    public List<JumpEdge> all() {
        return Collections.unmodifiableList(edges);
    }

    public int size() {
        return edges.size();
    }

    public boolean allConsumed() {
        return edges.stream().allMatch(JumpEdge::isConsumed);
    }

    @Override
    public String toString() {
        return edges.toString();
    }
}
