package com.raditha.sorter.model;

import java.util.List;
import java.util.Optional;

/**
 * One declaration statement captured from a buffer.
 * <p>
 * Elements are snapshots: once a write shifts lines in the buffer their ranges are stale
 * and they must be extracted again.
 *
 * @param category           kind of declaration
 * @param range              line span of the statement itself
 * @param lines              raw buffer lines spanning {@code range}
 * @param sortKey            exact statement text, modifiers included
 * @param comment            attached leading comment, or null
 * @param visibilityModifier explicit visibility keyword, or null when the statement has none
 */
public record Element(
        Category category,
        Range range,
        List<String> lines,
        String sortKey,
        Comment comment,
        String visibilityModifier) {

    public Element {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (range == null) {
            throw new IllegalArgumentException("range cannot be null");
        }
        if (sortKey == null) {
            throw new IllegalArgumentException("sortKey cannot be null");
        }
        lines = List.copyOf(lines);
    }

    public Optional<Comment> getComment() {
        return Optional.ofNullable(comment);
    }

    public boolean hasComment() {
        return comment != null;
    }

    /**
     * Span of the statement together with its comment.
     */
    public Range fullRange() {
        return comment == null ? range : range.union(comment.range());
    }
}
