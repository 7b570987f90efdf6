package com.raditha.sorter.model;

/**
 * Inclusive line interval in a buffer.
 *
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record Range(int startLine, int endLine) {

    public Range {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got: " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "endLine must be >= startLine, got: " + startLine + "-" + endLine);
        }
    }

    /**
     * Create from 0-based tree rows.
     */
    public static Range fromRows(int startRow, int endRow) {
        return new Range(startRow + 1, endRow + 1);
    }

    /**
     * Smallest interval covering both ranges.
     */
    public Range union(Range other) {
        return new Range(Math.min(startLine, other.startLine), Math.max(endLine, other.endLine));
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }

    public boolean overlaps(Range other) {
        return startLine <= other.endLine && other.startLine <= endLine;
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
