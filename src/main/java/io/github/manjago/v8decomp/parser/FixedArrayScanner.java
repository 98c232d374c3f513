package io.github.manjago.v8decomp.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First pass over a dump: collects every {@code Start FixedArray} block into a
 * {@link FixedArrayTable}.
 * <p>
 * Only numeric (Smi) elements are kept. {@code i-j: v} fills every index of the
 * inclusive range; other element kinds leave their slot at 0. Entries past the
 * declared length are dropped.
 */
public class FixedArrayScanner {

    private static final Logger log = LoggerFactory.getLogger(FixedArrayScanner.class);

    private static final String START_MARKER = "Start FixedArray";
    private static final String END_MARKER = "End FixedArray";

    private static final Pattern ADDRESS_PATTERN =
            Pattern.compile("^((?:0x)?[0-9a-fA-F]+):\\s*\\[FixedArray\\]");
    private static final Pattern LENGTH_PATTERN = Pattern.compile("^-\\s*length:\\s*(\\d+)$");
    private static final Pattern SINGLE_PATTERN = Pattern.compile("^(\\d+)\\s*:\\s*(-?\\d+)$");
    private static final Pattern RANGE_PATTERN = Pattern.compile("^(\\d+)\\s*-\\s*(\\d+)\\s*:\\s*(-?\\d+)$");
    private static final Pattern INDEXED_PATTERN = Pattern.compile("^(\\d+)(?:\\s*-\\s*(\\d+))?\\s*:");

    /** Arrays longer than this are truncated */
    static final int MAX_LENGTH = 1 << 20;

    /** Lines after the marker that may hold a malformed-then-valid address line */
    private static final int ADDRESS_LOOKAHEAD = 3;

    /**
     * Scan all lines and store the collected arrays.
     *
     * @param lines raw dump lines
     * @param table destination
     * @return number of arrays collected
     */
    public int scan(List<String> lines, FixedArrayTable table) {
        int collected = 0;
        int i = 0;
        int n = lines.size();

        while (i < n) {
            if (!START_MARKER.equals(lines.get(i).strip())) {
                i++;
                continue;
            }

            int blockStart = i + 1;
            Long address = null;
            int addressLine = -1;
            for (int j = blockStart; j < Math.min(blockStart + ADDRESS_LOOKAHEAD, n); j++) {
                Matcher m = ADDRESS_PATTERN.matcher(lines.get(j).strip());
                if (m.find()) {
                    address = FixedArrayTable.parseAddress(m.group(1));
                    addressLine = j;
                    break;
                }
            }

            if (addressLine < 0) {
                log.debug("FixedArray at line {} has no address line, skipped", i + 1);
                i = skipToEnd(lines, blockStart) + 1;
                continue;
            }

            int end = skipToEnd(lines, addressLine + 1);
            int[] values = readBlock(lines.subList(addressLine + 1, Math.min(end, n)));
            if (address != null) {
                table.put(address, values);
                collected++;
            }
            i = end + 1;
        }

        log.debug("Prescan collected {} FixedArray blocks", collected);
        return collected;
    }

    private int[] readBlock(List<String> body) {
        Integer length = null;
        int maxIndex = -1;
        List<int[]> entries = new ArrayList<>();

        for (String raw : body) {
            String line = raw.strip();
            try {
                length = readLine(line, length, entries);
                Matcher indexed = INDEXED_PATTERN.matcher(line);
                if (indexed.find()) {
                    String last = indexed.group(2) != null ? indexed.group(2) : indexed.group(1);
                    maxIndex = Math.max(maxIndex, Integer.parseInt(last));
                }
            } catch (NumberFormatException e) {
                log.debug("Unreadable FixedArray entry '{}': {}", line, e.getMessage());
            }
        }

        long size = length != null ? length : maxIndex + 1L;
        if (size > MAX_LENGTH) {
            log.debug("FixedArray of {} elements truncated to {}", size, MAX_LENGTH);
        }
        int[] out = new int[(int) Math.max(0, Math.min(size, MAX_LENGTH))];
        for (int[] entry : entries) {
            int to = Math.min(entry[1], out.length - 1);
            for (int k = entry[0]; k <= to; k++) {
                out[k] = entry[2];
            }
        }
        return out;
    }

    /**
     * Apply one block line. Entries are kept as {@code {from, to, value}} and laid
     * out once the length is known.
     *
     * @return the declared length, updated when the line declares it
     */
    private Integer readLine(String line, Integer length, List<int[]> entries) {
        Matcher m = LENGTH_PATTERN.matcher(line);
        if (m.matches()) {
            return Integer.parseInt(m.group(1));
        }
        m = RANGE_PATTERN.matcher(line);
        if (m.matches()) {
            int from = Integer.parseInt(m.group(1));
            int to = Integer.parseInt(m.group(2));
            entries.add(new int[]{from, to, Integer.parseInt(m.group(3))});
            return length;
        }
        m = SINGLE_PATTERN.matcher(line);
        if (m.matches()) {
            int index = Integer.parseInt(m.group(1));
            entries.add(new int[]{index, index, Integer.parseInt(m.group(2))});
        }
        return length;
    }

    /**
     * @return index of the matching end marker, or lines.size() when missing
     */
    private int skipToEnd(List<String> lines, int from) {
        int j = from;
        while (j < lines.size() && !END_MARKER.equals(lines.get(j).strip())) {
            j++;
        }
        return j;
    }
}
