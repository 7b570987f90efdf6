package com.raditha.sorter.buffer;

import java.util.List;

/**
 * Line-addressed editable text.
 * <p>
 * Lines are 1-indexed and ranges are inclusive. Replacing {@code [start, start - 1]} inserts
 * before {@code start}; replacing a range with an empty list deletes it.
 */
public interface LineBuffer {

    int lineCount();

    /**
     * Lines {@code startLine..endLine}, inclusive.
     *
     * @throws BufferWriteException if the range lies outside the buffer
     */
    List<String> getLines(int startLine, int endLine) throws BufferWriteException;

    /**
     * Replace lines {@code startLine..endLine} with {@code newLines}.
     *
     * @throws BufferWriteException if the range lies outside the buffer or the buffer is read-only
     */
    void setLines(int startLine, int endLine, List<String> newLines) throws BufferWriteException;

    /**
     * Snapshot of every line.
     */
    List<String> lines();

    /**
     * Full text with lines joined by {@code \n}.
     */
    default String text() {
        return String.join("\n", lines());
    }

    /**
     * Counter bumped by every successful {@link #setLines}.
     */
    long version();
}
