package io.github.manjago.v8decomp.simplify;

import java.util.ArrayList;
import java.util.List;

/**
 * Known value of a register inside a block.
 * <p>
 * {@code definitions} lists the code indices of the lines assigning the register;
 * the first one is hidden when the value is substituted. An overwritten register
 * keeps its name and all its definitions stay visible.
 */
final class Register {

    final String value;
    boolean overwritten;
    final List<Integer> definitions = new ArrayList<>();

    Register(String value, int definition) {
        this(value, definition, false);
    }

    Register(String value, int definition, boolean overwritten) {
        this.value = value;
        this.overwritten = overwritten;
        this.definitions.add(definition);
    }

    /**
     * @return true if {@code name} occurs in the value, not as the prefix of a longer register
     */
    boolean mentions(String name) {
        int idx = value.indexOf(name);
        while (idx != -1) {
            int after = idx + name.length();
            if (after == value.length() || !Character.isDigit(value.charAt(after))) {
                return true;
            }
            idx = value.indexOf(name, idx + 1);
        }
        return false;
    }

    @Override
    public String toString() {
        return value + (overwritten ? " (overwritten)" : "") + " @" + definitions;
    }
}
