package com.raditha.sorter.buffer;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link LineBuffer} backed by a list of strings.
 */
public class InMemoryLineBuffer implements LineBuffer {

    private final List<String> lines;
    private long version;

    public InMemoryLineBuffer(List<String> lines) {
        this.lines = new ArrayList<>(lines);
    }

    /**
     * Split text on {@code \n}, {@code \r\n} or {@code \r}. A trailing newline does not
     * produce an extra empty line.
     */
    public static InMemoryLineBuffer of(String text) {
        return new InMemoryLineBuffer(splitLines(text));
    }

    static List<String> splitLines(String text) {
        List<String> result = new ArrayList<>();
        if (text.isEmpty()) {
            return result;
        }
        for (String line : text.split("\r\n|\r|\n", -1)) {
            result.add(line);
        }
        if (text.endsWith("\n") || text.endsWith("\r")) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    @Override
    public int lineCount() {
        return lines.size();
    }

    @Override
    public List<String> getLines(int startLine, int endLine) throws BufferWriteException {
        checkRange(startLine, endLine);
        return List.copyOf(lines.subList(startLine - 1, endLine));
    }

    @Override
    public void setLines(int startLine, int endLine, List<String> newLines) throws BufferWriteException {
        checkRange(startLine, endLine);
        List<String> target = lines.subList(startLine - 1, endLine);
        target.clear();
        target.addAll(newLines);
        version++;
    }

    @Override
    public List<String> lines() {
        return List.copyOf(lines);
    }

    @Override
    public long version() {
        return version;
    }

    private void checkRange(int startLine, int endLine) throws BufferWriteException {
        if (startLine < 1 || endLine < startLine - 1 || endLine > lines.size()) {
            throw new BufferWriteException(
                    "Invalid line range " + startLine + "-" + endLine + " for buffer of " + lines.size() + " lines");
        }
    }
}
