package io.github.pyfuncs.analyzer;

import java.util.List;

/**
 * A changed region of a file, as in a unified diff hunk: {@code count} lines starting at {@code start} (1-based).
 * Used to keep only the functions a change touches.
 */
public record LineRange(int start, int count) {

    public LineRange {
        if (start < 1) {
            throw new IllegalArgumentException("start must be >= 1: " + start);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
    }

    /**
     * Parses {@code START:COUNT}, or a bare {@code START} meaning a single line.
     *
     * @throws IllegalArgumentException if the text is malformed
     */
    public static LineRange parse(String text) {
        int colon = text.indexOf(':');
        try {
            if (colon < 0) {
                return new LineRange(Integer.parseInt(text.trim()), 1);
            }
            int start = Integer.parseInt(text.substring(0, colon).trim());
            int count = Integer.parseInt(text.substring(colon + 1).trim());
            return new LineRange(start, count);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("expected START:COUNT but got '" + text + "'", e);
        }
    }

    /** Last line covered, inclusive. Less than {@link #start()} for an empty (pure deletion) range. */
    public int end() {
        return start + count - 1;
    }

    public boolean overlaps(FunctionRecord record) {
        return record.overlaps(start, end());
    }

    /** Keeps the records that overlap at least one range, preserving order. */
    public static List<FunctionRecord> filterOverlapping(List<FunctionRecord> records, List<LineRange> ranges) {
        return records.stream()
                .filter(r -> ranges.stream().anyMatch(range -> range.overlaps(r)))
                .toList();
    }
}
