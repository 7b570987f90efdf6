package com.raditha.sorter.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets of a text to 0-based rows and columns and back.
 */
public class LineIndex {

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public int rowOf(int offset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    public int columnOf(int offset) {
        return offset - lineStarts[rowOf(offset)];
    }

    /**
     * Offset of a 0-based row and column, clamped to the text.
     */
    public int offsetOf(int row, int column) {
        if (row >= lineStarts.length) {
            return text.length();
        }
        return Math.min(lineStarts[row] + column, text.length());
    }

    /**
     * Range of the text between two offsets (end exclusive).
     */
    public NodeRange rangeOf(int startOffset, int endOffset) {
        int lastChar = Math.max(startOffset, endOffset - 1);
        int endRow = rowOf(lastChar);
        return new NodeRange(rowOf(startOffset), columnOf(startOffset), endRow, lastChar - lineStarts[endRow] + 1);
    }

    public String slice(int startOffset, int endOffset) {
        return text.substring(startOffset, endOffset);
    }
}
