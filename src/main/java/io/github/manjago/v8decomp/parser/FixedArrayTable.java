package io.github.manjago.v8decomp.parser;

import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Literal arrays collected by the FixedArray prescan, keyed by numeric address.
 */
public class FixedArrayTable {

    private static final Pattern REFERENCE_PATTERN =
            Pattern.compile("(0x[0-9a-fA-F]+)\\s*<FixedArray\\[\\d+\\]>");

    private final Map<Long, int[]> arrays = new HashMap<>();

    public void put(long address, int[] values) {
        arrays.put(address, values.clone());
    }

    /**
     * @return copy of the array stored at the address, or null
     */
    public int[] get(long address) {
        int[] values = arrays.get(address);
        return values != null ? values.clone() : null;
    }

    public int size() {
        return arrays.size();
    }

    /**
     * Render the array referenced by {@code "0xADDR <FixedArray[n]>"} somewhere in the text.
     *
     * @param text constant pool entry text, address included
     * @return inline literal such as {@code [1, 2, 2]}, or null when there is no
     *         reference or the address was not collected
     */
    public @Nullable String inlineLiteral(String text) {
        Matcher m = REFERENCE_PATTERN.matcher(text);
        if (!m.find()) {
            return null;
        }
        Long address = parseAddress(m.group(1));
        if (address == null) {
            return null;
        }
        int[] values = arrays.get(address);
        if (values == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(values[i]);
        }
        return sb.append(']').toString();
    }

    /**
     * Parse a hex address with or without the {@code 0x} prefix.
     *
     * @return numeric address, 0 for an empty digit string, null when not hex
     */
    public static @Nullable Long parseAddress(String text) {
        String s = text.strip().toLowerCase(Locale.ROOT);
        if (s.startsWith("0x")) {
            s = s.substring(2);
        }
        if (s.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(s, 16);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
