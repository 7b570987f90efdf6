package com.raditha.sorter.syntax;

import java.util.List;

/**
 * Parsed source file.
 */
public interface SyntaxTree {

    SyntaxNode root();

    Language language();

    /**
     * Nodes selected by the query that intersect the row window, in document order.
     *
     * @param query    node selection
     * @param startRow first row of the window (0-based)
     * @param endRow   last row of the window (0-based, inclusive), or -1 for end of file
     */
    List<Capture> captures(NodeQuery query, int startRow, int endRow);

    default List<Capture> captures(NodeQuery query) {
        return captures(query, 0, -1);
    }
}
