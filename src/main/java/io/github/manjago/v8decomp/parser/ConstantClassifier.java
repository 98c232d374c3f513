package io.github.manjago.v8decomp.parser;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Turns a raw constant pool value into the text used in pseudocode.
 * <p>
 * <pre>
 * &lt;String[4]: #name&gt;               -&gt; "name"
 * 0x1234 &lt;FixedArray[3]&gt;             -&gt; [1, 2, 2]   (when collected by the prescan)
 * &lt;ArrayBoilerplateDescription ...&gt; -&gt; [] unless resolvable
 * &lt;ObjectBoilerplateDescription ...&gt; -&gt; {}
 * &lt;Odd Oddball[8]: ...&gt;             -&gt; null
 * &lt;HeapNumber 3.5&gt;                   -&gt; 3.5
 * </pre>
 * Function references are resolved by the parser, which may need to read ahead.
 */
public final class ConstantClassifier {

    static final String SHARED_FUNCTION_INFO_TAG = "<SharedFunctionInfo";

    private ConstantClassifier() {
    }

    /**
     * Classify one entry.
     *
     * @param address object address printed before the value, or null for plain literals
     * @param value value text after the address
     * @param arrays prescan result
     * @return resolved text
     */
    public static @NotNull String classify(@Nullable String address, String value, FixedArrayTable arrays) {
        String val = value.strip();
        if (address == null) {
            return val;
        }

        if (val.startsWith("<String")) {
            return stringLiteral(val);
        }

        String inline = arrays.inlineLiteral(address + " " + val);
        if (inline != null) {
            return inline;
        }

        if (val.startsWith(SHARED_FUNCTION_INFO_TAG)) {
            return functionReference(val);
        }
        if (val.startsWith("<ArrayBoilerplateDescription") || val.startsWith("<FixedArray")) {
            return "[]";
        }
        if (val.startsWith("<ObjectBoilerplateDescription")) {
            return "{}";
        }
        if (val.startsWith("<Odd Oddball")) {
            return "null";
        }

        String stripped = stripTrailing(val, ">");
        int space = stripped.indexOf(' ');
        return space >= 0 ? stripped.substring(space + 1) : stripped;
    }

    /**
     * {@code <String[n]: #name>} or {@code <String[n]: name>} to a quoted literal.
     */
    static String stringLiteral(String val) {
        String t = stripTrailing(val.strip(), ">");
        int hash = t.indexOf('#');
        if (hash >= 0) {
            t = t.substring(hash + 1).strip();
        } else {
            int colon = t.indexOf(':');
            if (colon >= 0) {
                t = t.substring(colon + 1).strip();
            }
        }
        return "\"" + t.replace("\"", "\\\"") + "\"";
    }

    /**
     * @return label of a {@code <SharedFunctionInfo label>} value, empty when unnamed
     */
    static String functionLabel(String val) {
        int space = val.indexOf(' ');
        if (space < 0) {
            return "";
        }
        return stripTrailing(val.substring(space + 1), "> ");
    }

    /**
     * @return placeholder used when the referenced function block does not follow
     */
    static String functionReference(String val) {
        String t = val.strip();
        int space = t.lastIndexOf(' ');
        String shortName = space >= 0 ? stripTrailing(t.substring(space + 1), ">") : "unknown";
        return "func_ref_" + (shortName.isEmpty() ? "unknown" : shortName);
    }

    private static String stripTrailing(String s, String chars) {
        int end = s.length();
        while (end > 0 && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(0, end);
    }
}
