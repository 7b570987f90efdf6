package com.raditha.sorter.buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * In-memory buffer over a source file.
 * <p>
 * The file is read once; edits stay in memory until {@link #save()}. The original line
 * separator and trailing newline are preserved.
 */
public class FileBuffer extends InMemoryLineBuffer {

    private final Path file;
    private final String lineSeparator;
    private final boolean trailingNewline;
    private final List<String> originalLines;

    private FileBuffer(Path file, String content) {
        super(splitLines(content));
        this.file = file;
        this.lineSeparator = detectSeparator(content);
        this.trailingNewline = content.endsWith("\n") || content.endsWith("\r");
        this.originalLines = lines();
    }

    public static FileBuffer open(Path file) throws IOException {
        return new FileBuffer(file, Files.readString(file, StandardCharsets.UTF_8));
    }

    public Path getFile() {
        return file;
    }

    public List<String> getOriginalLines() {
        return originalLines;
    }

    public boolean isModified() {
        return !originalLines.equals(lines());
    }

    /**
     * Buffer contents as they would be written to disk.
     */
    public String render() {
        String body = String.join(lineSeparator, lines());
        return trailingNewline && lineCount() > 0 ? body + lineSeparator : body;
    }

    public void save() throws IOException {
        Files.writeString(file, render(), StandardCharsets.UTF_8);
    }

    private static String detectSeparator(String content) {
        int newline = content.indexOf('\n');
        if (newline > 0 && content.charAt(newline - 1) == '\r') {
            return "\r\n";
        }
        if (newline < 0 && content.indexOf('\r') >= 0) {
            return "\r";
        }
        return "\n";
    }
}
