package com.raditha.sorter.cleanup;

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
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Collapses stray blank lines inside declaration groups and re-derives the blank line at
 * every visibility boundary.
 */
public class BlankLineNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(BlankLineNormalizer.class);

    private final LineBuffer buffer;
    private final Visibility defaultVisibility;
    private final boolean addVisibilitySpacing;
    private final List<WriteFailure> failures = new ArrayList<>();

    public BlankLineNormalizer(LineBuffer buffer, Visibility defaultVisibility, boolean addVisibilitySpacing) {
        this.buffer = buffer;
        this.defaultVisibility = defaultVisibility;
        this.addVisibilitySpacing = addVisibilitySpacing;
    }

    /**
     * Delete whitespace-only lines between the first and last import of each group,
     * bottom-up.
     *
     * @return number of lines deleted
     */
    public int normalizeImports(List<ElementGroup> importGroups) {
        List<ElementGroup> groups = bottomUp(importGroups);
        int removed = 0;
        for (ElementGroup group : groups) {
            Range span = group.span();
            for (int line = span.endLine(); line >= span.startLine(); line--) {
                try {
                    if (buffer.getLines(line, line).get(0).isBlank()) {
                        buffer.setLines(line, line, List.of());
                        removed++;
                    }
                } catch (BufferWriteException e) {
                    logger.error("Failed to remove blank line {}: {}", line, e.getMessage());
                    failures.add(new WriteFailure("normalize", new Range(line, line), e.getMessage()));
                }
            }
        }
        return removed;
    }

    /**
     * Rewrite each group so that its members are separated by exactly one blank line at
     * each visibility change and by none otherwise. A blank line is also kept between the
     * group and code that directly follows it, unless that code closes the enclosing body.
     * <p>
     * The groups must come from one extraction of the current buffer; they are processed
     * bottom-up so their ranges stay valid.
     *
     * @return number of groups rewritten
     */
    public int normalizeGroups(List<ElementGroup> declarationGroups) {
        int rewritten = 0;
        for (ElementGroup group : bottomUp(declarationGroups)) {
            Range span = group.span();
            try {
                List<String> desired = desiredLines(group, span);
                List<String> current = buffer.getLines(span.startLine(), span.endLine());
                if (!desired.equals(current)) {
                    buffer.setLines(span.startLine(), span.endLine(), desired);
                    rewritten++;
                    logger.debug("Normalized blank lines of {} group at {}", group.category(), span);
                }
            } catch (BufferWriteException e) {
                logger.error("Failed to normalize {} group at {}: {}", group.category(), span, e.getMessage());
                failures.add(new WriteFailure("normalize", span, e.getMessage()));
            }
        }
        return rewritten;
    }

    List<String> desiredLines(ElementGroup group, Range span) throws BufferWriteException {
        List<String> lines = new ArrayList<>();
        String previousKey = null;
        for (Element element : group.elements()) {
            String key = visibilityKey(element);
            if (addVisibilitySpacing && previousKey != null && !previousKey.equals(key)) {
                lines.add("");
            }
            element.getComment().ifPresent(comment -> lines.addAll(comment.lines()));
            lines.addAll(element.lines());
            previousKey = key;
        }
        int next = span.endLine() + 1;
        if (next <= buffer.lineCount()) {
            String following = buffer.getLines(next, next).get(0).trim();
            if (!following.isEmpty() && !following.startsWith("}")) {
                lines.add("");
            }
        }
        return lines;
    }

    /**
     * Grouping key: "use" for trait uses, otherwise the explicit visibility keyword or the
     * default visibility.
     */
    String visibilityKey(Element element) {
        if (element.category() == Category.TRAIT_USE) {
            return "use";
        }
        String modifier = element.visibilityModifier();
        return modifier == null ? defaultVisibility.keyword() : modifier.toLowerCase(Locale.ROOT);
    }

    public List<WriteFailure> getFailures() {
        return List.copyOf(failures);
    }

    private static List<ElementGroup> bottomUp(List<ElementGroup> groups) {
        List<ElementGroup> ordered = new ArrayList<>();
        for (ElementGroup group : groups) {
            if (!group.isEmpty()) {
                ordered.add(group);
            }
        }
        ordered.sort(Comparator.comparingInt((ElementGroup g) -> g.span().startLine()).reversed());
        return ordered;
    }
}
