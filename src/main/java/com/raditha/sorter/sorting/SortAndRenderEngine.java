package com.raditha.sorter.sorting;

import com.raditha.sorter.buffer.BufferWriteException;
import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.model.Category;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.ElementGroup;
import com.raditha.sorter.model.Range;
import com.raditha.sorter.model.Visibility;
import com.raditha.sorter.model.WriteFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sorts one element group and writes it back with a single range replacement.
 * <p>
 * Nothing is written when the group is already in canonical order or when the rendered
 * text matches what the buffer holds.
 */
public class SortAndRenderEngine {

    private static final Logger logger = LoggerFactory.getLogger(SortAndRenderEngine.class);

    private final LineBuffer buffer;
    private final boolean addNewlineBetweenConstAndProperties;
    private final boolean addVisibilitySpacing;

    public SortAndRenderEngine(LineBuffer buffer, boolean addNewlineBetweenConstAndProperties,
            boolean addVisibilitySpacing) {
        this.buffer = buffer;
        this.addNewlineBetweenConstAndProperties = addNewlineBetweenConstAndProperties;
        this.addVisibilitySpacing = addVisibilitySpacing;
    }

    /**
     * Sort and render a group.
     *
     * @param group         elements extracted from the current buffer state
     * @param comparator    canonical order
     * @param propertyGroup whether visibility spacing applies
     * @param session       rolling render state of this invocation
     * @return true iff the buffer was written
     */
    public boolean sortAndRender(ElementGroup group, ElementComparator comparator, boolean propertyGroup,
            RenderSession session) {
        if (group.isEmpty()) {
            return false;
        }
        Range span = group.span();
        List<Element> sorted = group.toMutableList();
        List<String> originalKeys = sortKeys(sorted);
        sorted.sort(comparator);
        if (sortKeys(sorted).equals(originalKeys)) {
            logger.debug("{} group at {} already sorted", group.category(), span);
            return false;
        }

        List<String> rendered = render(sorted, comparator, propertyGroup, session);
        try {
            if (rendered.equals(buffer.getLines(span.startLine(), span.endLine()))) {
                return false;
            }
            buffer.setLines(span.startLine(), span.endLine(), rendered);
        } catch (BufferWriteException e) {
            logger.error("Failed to write sorted {} group at {}: {}", group.category(), span, e.getMessage());
            session.addFailure(new WriteFailure("sort", span, e.getMessage()));
            return false;
        }
        session.recordRewrite();
        logger.info("Sorted {} {} elements at {}", group.size(), group.category(), span);
        return true;
    }

    /**
     * Convenience overload for an ad hoc list of same-category elements.
     */
    public boolean sortAndRender(List<Element> elements, ElementComparator comparator, boolean propertyGroup,
            RenderSession session) {
        if (elements.isEmpty()) {
            return false;
        }
        return sortAndRender(new ElementGroup(elements.get(0).category(), elements), comparator, propertyGroup,
                session);
    }

    List<String> render(List<Element> sorted, ElementComparator comparator, boolean propertyGroup,
            RenderSession session) {
        List<String> out = new ArrayList<>();
        for (Element element : sorted) {
            if (addNewlineBetweenConstAndProperties
                    && session.getPreviousCategory() == Category.CONSTANT
                    && element.category() == Category.PROPERTY
                    && !(!out.isEmpty() && endsBlank(out))) {
                out.add("");
            }
            if (propertyGroup && addVisibilitySpacing) {
                Visibility visibility = comparator.visibilityOf(element);
                if (visibility != session.getPreviousVisibility() && !out.isEmpty() && !endsBlank(out)) {
                    out.add("");
                }
                session.setPreviousVisibility(visibility);
            }
            element.getComment().ifPresent(comment -> out.addAll(comment.lines()));
            out.addAll(element.lines());
            session.setPreviousCategory(element.category());
        }
        return out;
    }

    private static boolean endsBlank(List<String> out) {
        return out.get(out.size() - 1).isBlank();
    }

    private static List<String> sortKeys(List<Element> elements) {
        List<String> keys = new ArrayList<>(elements.size());
        for (Element element : elements) {
            keys.add(element.sortKey());
        }
        return keys;
    }
}
