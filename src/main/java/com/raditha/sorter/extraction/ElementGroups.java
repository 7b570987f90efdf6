package com.raditha.sorter.extraction;

import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.ElementGroup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits same-category elements into contiguous groups.
 */
public final class ElementGroups {

    private ElementGroups() {
    }

    /**
     * Consecutive elements stay in one group when only blank lines separate them; any other
     * line in between (a method, a statement) starts a new group.
     */
    public static List<ElementGroup> contiguous(List<Element> elements, LineBuffer buffer) {
        List<ElementGroup> groups = new ArrayList<>();
        if (elements.isEmpty()) {
            return groups;
        }
        List<String> lines = buffer.lines();
        List<Element> ordered = new ArrayList<>(elements);
        ordered.sort(Comparator.comparingInt(e -> e.fullRange().startLine()));

        List<Element> current = new ArrayList<>();
        Element previous = null;
        for (Element element : ordered) {
            if (previous != null && !onlyBlankBetween(previous, element, lines)) {
                groups.add(new ElementGroup(element.category(), current));
                current = new ArrayList<>();
            }
            current.add(element);
            previous = element;
        }
        groups.add(new ElementGroup(previous.category(), current));
        return groups;
    }

    private static boolean onlyBlankBetween(Element previous, Element next, List<String> lines) {
        int from = previous.fullRange().endLine() + 1;
        int to = next.fullRange().startLine() - 1;
        if (from > to + 1) {
            // overlapping spans, e.g. two statements on one line
            return false;
        }
        for (int line = from; line <= to; line++) {
            if (!lines.get(line - 1).isBlank()) {
                return false;
            }
        }
        return true;
    }
}
