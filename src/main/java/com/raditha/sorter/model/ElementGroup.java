package com.raditha.sorter.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Same-category elements occupying one contiguous region of a buffer.
 *
 * @param category category shared by every member
 * @param elements members in ascending source order
 */
public record ElementGroup(Category category, List<Element> elements) {

    public ElementGroup {
        elements = List.copyOf(elements);
        Element previous = null;
        for (Element element : elements) {
            if (element.category() != category) {
                throw new IllegalArgumentException(
                        "Element " + element.range() + " is " + element.category() + ", expected " + category);
            }
            if (previous != null && previous.fullRange().endLine() >= element.fullRange().startLine()) {
                throw new IllegalArgumentException(
                        "Elements must not overlap and must be in source order: "
                                + previous.fullRange() + " then " + element.fullRange());
            }
            previous = element;
        }
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    /**
     * Union range of all members and their comments.
     *
     * @throws IllegalStateException if the group is empty
     */
    public Range span() {
        if (elements.isEmpty()) {
            throw new IllegalStateException("Empty group has no span");
        }
        Range span = elements.get(0).fullRange();
        for (Element element : elements) {
            span = span.union(element.fullRange());
        }
        return span;
    }

    /**
     * Mutable copy of the members, for sorting.
     */
    public List<Element> toMutableList() {
        return new ArrayList<>(elements);
    }
}
