package com.raditha.sorter.workflow;

import com.raditha.sorter.model.WriteFailure;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one sorter invocation.
 */
public class SortResult {
    private int sortedGroups;
    private int normalizedGroups;
    private int removedElements;
    private int removedBlankLines;
    private boolean modified;
    private final List<WriteFailure> failures = new ArrayList<>();

    void addSortedGroups(int count) {
        sortedGroups += count;
    }

    void addNormalizedGroups(int count) {
        normalizedGroups += count;
    }

    void addRemovedElements(int count) {
        removedElements += count;
    }

    void addRemovedBlankLines(int count) {
        removedBlankLines += count;
    }

    void addFailures(List<WriteFailure> more) {
        failures.addAll(more);
    }

    void setModified(boolean modified) {
        this.modified = modified;
    }

    /**
     * Groups rewritten in a new order.
     */
    public int getSortedGroups() {
        return sortedGroups;
    }

    /**
     * Groups whose blank lines were rewritten.
     */
    public int getNormalizedGroups() {
        return normalizedGroups;
    }

    public int getRemovedElements() {
        return removedElements;
    }

    public int getRemovedBlankLines() {
        return removedBlankLines;
    }

    public List<WriteFailure> getFailures() {
        return List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * Whether any write reached the buffer.
     */
    public boolean isModified() {
        return modified;
    }

    @Override
    public String toString() {
        return String.format("sorted=%d, normalized=%d, removed=%d, blankLinesRemoved=%d, failures=%d",
                sortedGroups, normalizedGroups, removedElements, removedBlankLines, failures.size());
    }
}
