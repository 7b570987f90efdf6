package com.raditha.sorter.syntax;

/**
 * Position of a syntax node. Rows and columns are 0-based; the end column is exclusive.
 */
public record NodeRange(int startRow, int startColumn, int endRow, int endColumn) {

    public NodeRange {
        if (startRow < 0 || endRow < startRow) {
            throw new IllegalArgumentException("Invalid row span: " + startRow + "-" + endRow);
        }
    }

    /**
     * Whether the node touches the row window {@code [fromRow, toRow]}; {@code toRow == -1} is unbounded.
     */
    public boolean intersectsRows(int fromRow, int toRow) {
        return endRow >= fromRow && (toRow < 0 || startRow <= toRow);
    }
}
