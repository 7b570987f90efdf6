package com.raditha.sorter.model;

import java.util.List;

/**
 * Leading comment attached to an element.
 *
 * @param range line span of the comment
 * @param lines raw buffer lines spanning the range
 */
public record Comment(Range range, List<String> lines) {

    public Comment {
        lines = List.copyOf(lines);
    }
}
