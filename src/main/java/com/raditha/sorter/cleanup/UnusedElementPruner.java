package com.raditha.sorter.cleanup;

import com.raditha.sorter.buffer.BufferWriteException;
import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.model.Element;
import com.raditha.sorter.model.Range;
import com.raditha.sorter.model.WriteFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deletes elements the oracle reports as unused.
 * <p>
 * Deletions run from the highest start line down so that no deletion shifts a range that
 * is still pending.
 */
public class UnusedElementPruner {

    private static final Logger logger = LoggerFactory.getLogger(UnusedElementPruner.class);

    private final LineBuffer buffer;
    private final List<WriteFailure> failures = new ArrayList<>();

    public UnusedElementPruner(LineBuffer buffer) {
        this.buffer = buffer;
    }

    /**
     * Remove every flagged element together with its comment.
     *
     * @param elements elements extracted from the current buffer state
     * @param oracle   decides which start lines are unused
     * @return number of elements removed
     */
    public int pruneUnused(List<Element> elements, UnusedOracle oracle) {
        List<Element> pending = new ArrayList<>(elements);
        pending.sort(Comparator.comparingInt((Element e) -> e.range().startLine()).reversed());

        int removed = 0;
        for (Element element : pending) {
            if (!oracle.isUnused(element.range().startLine())) {
                continue;
            }
            Range span = element.fullRange();
            try {
                buffer.setLines(span.startLine(), span.endLine(), List.of());
                removed++;
                logger.info("Removed unused {}", element.sortKey());
            } catch (BufferWriteException e) {
                logger.error("Failed to remove unused element at {}: {}", span, e.getMessage());
                failures.add(new WriteFailure("prune", span, e.getMessage()));
            }
        }
        return removed;
    }

    public List<WriteFailure> getFailures() {
        return List.copyOf(failures);
    }
}
