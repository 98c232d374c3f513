package io.github.manjago.v8decomp.simplify;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Last known simple value of each context slot, shared by all functions of a run.
 * <p>
 * A write records its right-hand side only when the value is simple: no call, no
 * parentheses, no function-local register. Any other write forgets the slot.
 */
public class SlotEnvironment {

    private static final Pattern SIMPLE_VALUE = Pattern.compile("^[A-Za-z0-9_\\[\\]\\.\"'$:<>-]+$");
    private static final Pattern REGISTER = Pattern.compile("\\b(ACCU|CASE_\\d+|[ra]\\d+)\\b");

    public record SlotKey(int scopeId, int slot) {
    }

    private final Map<SlotKey, String> values = new HashMap<>();

    public @Nullable String get(int scopeId, int slot) {
        return values.get(new SlotKey(scopeId, slot));
    }

    /**
     * Record a write to the slot: simple values are kept, anything else
     * invalidates the slot.
     *
     * @return true if the value was recorded
     */
    public boolean write(int scopeId, int slot, String value) {
        SlotKey key = new SlotKey(scopeId, slot);
        if (isSimple(value)) {
            values.put(key, value.strip());
            return true;
        }
        values.remove(key);
        return false;
    }

    public void remove(int scopeId, int slot) {
        values.remove(new SlotKey(scopeId, slot));
    }

    public int size() {
        return values.size();
    }

    public static boolean isSimple(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String v = value.strip();
        if (v.contains("(") || v.contains(")")) {
            return false;
        }
        return SIMPLE_VALUE.matcher(v).matches() && !REGISTER.matcher(v).find();
    }
}
