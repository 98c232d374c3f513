package io.github.manjago.v8decomp.flow;

import io.github.manjago.v8decomp.core.Instruction;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Offset arithmetic over the real instructions of a function.
 * <p>
 * Placeholders never serve as anchors: snapping and relative stepping only land on
 * offsets that hold a parsed instruction.
 */
public class OffsetIndex {

    private final int[] offsets;
    private final Map<Integer, Instruction> byOffset = new HashMap<>();

    public OffsetIndex(List<Instruction> code) {
        this.offsets = code.stream()
                .filter(i -> !i.isPlaceholder())
                .mapToInt(Instruction::getOffset)
                .sorted()
                .distinct()
                .toArray();
        for (Instruction instruction : code) {
            if (!instruction.isPlaceholder()) {
                byOffset.putIfAbsent(instruction.getOffset(), instruction);
            }
        }
    }

    public boolean isEmpty() {
        return offsets.length == 0;
    }

    /**
     * Closest existing offset at or before {@code offset}; the first offset when
     * {@code offset} precedes it.
     *
     * @return snapped offset, or null when there are no instructions
     */
    public @Nullable Integer snap(int offset) {
        if (offsets.length == 0) {
            return null;
        }
        int idx = Arrays.binarySearch(offsets, offset);
        if (idx >= 0) {
            return offset;
        }
        int insertion = -idx - 1;
        if (insertion == 0) {
            return offsets[0];
        }
        return offsets[insertion - 1];
    }

    /**
     * Step {@code n} instructions from the snapped offset, clamped to the first and
     * last instruction.
     *
     * @throws IllegalStateException when there are no instructions
     */
    public int relative(int offset, int n) {
        if (offsets.length == 0) {
            throw new IllegalStateException("relative offset requested with empty code list");
        }
        int idx = Arrays.binarySearch(offsets, offset);
        if (idx < 0) {
            int insertion = -idx - 1;
            idx = insertion == 0 ? 0 : insertion - 1;
        }
        int target = Math.max(0, Math.min(offsets.length - 1, idx + n));
        return offsets[target];
    }

    /**
     * @return instruction at the snapped offset, or null when there are no instructions
     */
    public @Nullable Instruction line(int offset) {
        Integer snapped = snap(offset);
        return snapped != null ? byOffset.get(snapped) : null;
    }

    /**
     * @return offsets from {@code from} to {@code to}, both inclusive and snapped
     */
    int[] between(int from, int to) {
        Integer a = snap(from);
        Integer b = snap(to);
        if (a == null || b == null || a > b) {
            return new int[0];
        }
        int lo = Arrays.binarySearch(offsets, a);
        int hi = Arrays.binarySearch(offsets, b);
        return Arrays.copyOfRange(offsets, lo, hi + 1);
    }
}
