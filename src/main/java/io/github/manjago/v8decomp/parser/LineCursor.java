package io.github.manjago.v8decomp.parser;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Peekable cursor over the non-blank, trimmed lines of a dump.
 * <p>
 * {@link #next()} returns {@code null} once the input is exhausted. At most one
 * line can be pushed back: the next call to {@link #next()} returns it again.
 * Original line numbers are kept for diagnostics.
 */
public class LineCursor {

    private final String sourceName;
    private final List<String> rawLines;
    private final List<String> lines = new ArrayList<>();
    private final List<Integer> numbers = new ArrayList<>();

    private int position;
    private boolean pushedBack;
    private boolean lastWasLine;

    /**
     * @param sourceName file name used in diagnostics
     * @param rawLines lines as read from the input, blank lines included
     */
    public LineCursor(String sourceName, List<String> rawLines) {
        this.sourceName = sourceName;
        this.rawLines = List.copyOf(rawLines);
        for (int i = 0; i < rawLines.size(); i++) {
            String trimmed = rawLines.get(i).strip();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
                numbers.add(i + 1);
            }
        }
    }

    /**
     * @return next trimmed non-blank line, or null at end of input
     */
    public @Nullable String next() {
        pushedBack = false;
        if (position >= lines.size()) {
            lastWasLine = false;
            return null;
        }
        lastWasLine = true;
        return lines.get(position++);
    }

    /**
     * Make the line last returned by {@link #next()} current again.
     *
     * @throws IllegalStateException on a second consecutive push-back, or when
     *         nothing was read since
     */
    public void pushBack() {
        if (pushedBack) {
            throw new IllegalStateException("Only one line can be pushed back");
        }
        if (!lastWasLine) {
            throw new IllegalStateException("No line to push back");
        }
        position--;
        pushedBack = true;
    }

    public boolean hasNext() {
        return position < lines.size();
    }

    /**
     * @return 1-based source line number of the line last returned, or 0 before the first
     */
    public int lineNumber() {
        if (position == 0) {
            return 0;
        }
        return numbers.get(position - 1);
    }

    public String getSourceName() {
        return sourceName;
    }

    /**
     * @return "file:line" of the current line
     */
    public String location() {
        return sourceName + ":" + lineNumber();
    }

    /**
     * Render the raw source lines around the current line.
     *
     * @param radius lines shown on each side
     * @return multi-line excerpt, the current line marked with {@code >>>}
     */
    public String context(int radius) {
        int current = lineNumber();
        if (current < 1 || current > rawLines.size()) {
            return "";
        }
        int from = Math.max(1, current - radius);
        int to = Math.min(rawLines.size(), current + radius);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i <= to; i++) {
            sb.append(i == current ? ">>> " : "    ");
            sb.append(String.format("%4d: %s", i, rawLines.get(i - 1).stripTrailing()));
            if (i < to) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
