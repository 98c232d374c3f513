package io.github.manjago.v8decomp.simplify;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Context ids bound to function names, with the declarer chain as fallback for
 * functions that carry no scope-info address.
 */
public class FunctionContextTable {

    private final Map<String, Integer> contexts = new HashMap<>();
    private final Map<String, String> declarers = new HashMap<>();

    /**
     * Bind a function to a context. A nonzero binding is never replaced by 0; a 0
     * binding is upgraded by a nonzero one. The first declarer recorded is kept.
     */
    public void bind(String function, int contextId, @Nullable String declarer) {
        Integer old = contexts.get(function);
        if (old == null || (old == 0 && contextId != 0)) {
            contexts.put(function, contextId);
        }
        recordDeclarer(function, declarer);
    }

    public void recordDeclarer(String function, @Nullable String declarer) {
        if (declarer != null && !declarer.isEmpty()) {
            declarers.putIfAbsent(function, declarer);
        }
    }

    /**
     * Context of a function: its own binding, else the first bound declarer up the
     * chain, else 0. The answer is bound to the function.
     */
    public int contextOf(String function, @Nullable String declarer) {
        Integer own = contexts.get(function);
        if (own != null) {
            return own;
        }
        Set<String> seen = new HashSet<>();
        String current = declarer;
        while (current != null && seen.add(current)) {
            Integer ctx = contexts.get(current);
            if (ctx != null) {
                contexts.put(function, ctx);
                return ctx;
            }
            current = declarers.get(current);
        }
        contexts.put(function, 0);
        return 0;
    }

    public @Nullable Integer boundContext(String function) {
        return contexts.get(function);
    }
}
