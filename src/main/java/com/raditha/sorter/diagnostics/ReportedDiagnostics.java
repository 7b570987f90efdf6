package com.raditha.sorter.diagnostics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.sorter.buffer.LineBuffer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics produced by an external linter and loaded from a JSON report.
 * <p>
 * The report is either an array of {@code {"line": n, "message": "..."}} objects or an object
 * holding such an array under {@code "diagnostics"}. Each entry remembers the text of the line
 * it was reported on, so it keeps pointing at the same statement after earlier lines move.
 */
public class ReportedDiagnostics implements DiagnosticsProvider {

    private static final ObjectMapper mapper = new ObjectMapper();

    private record Anchored(Diagnostic diagnostic, String lineText) {
    }

    private final LineBuffer buffer;
    private final long loadedVersion;
    private final List<Anchored> entries = new ArrayList<>();

    public ReportedDiagnostics(List<Diagnostic> diagnostics, LineBuffer buffer) {
        this.buffer = buffer;
        this.loadedVersion = buffer.version();
        List<String> lines = buffer.lines();
        for (Diagnostic diagnostic : diagnostics) {
            String text = diagnostic.line() <= lines.size() ? lines.get(diagnostic.line() - 1) : null;
            entries.add(new Anchored(diagnostic, text));
        }
    }

    /**
     * Load a report for the given buffer.
     *
     * @throws IOException if the file cannot be read or is not a diagnostics report
     */
    public static ReportedDiagnostics load(Path report, LineBuffer buffer) throws IOException {
        return new ReportedDiagnostics(parse(mapper.readTree(report.toFile())), buffer);
    }

    static List<Diagnostic> parse(JsonNode root) throws IOException {
        JsonNode array = root != null && root.isObject() ? root.get("diagnostics") : root;
        if (array == null || !array.isArray()) {
            throw new IOException("Diagnostics report must be an array or contain a \"diagnostics\" array");
        }
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (JsonNode entry : array) {
            try {
                diagnostics.add(mapper.treeToValue(entry, Diagnostic.class));
            } catch (IOException | IllegalArgumentException e) {
                throw new IOException("Invalid diagnostics entry " + entry + ": " + e.getMessage(), e);
            }
        }
        return diagnostics;
    }

    @Override
    public List<Diagnostic> diagnosticsAt(int line) {
        List<Diagnostic> result = new ArrayList<>();
        if (line < 1 || line > buffer.lineCount()) {
            return result;
        }
        boolean unchanged = buffer.version() == loadedVersion;
        String current = buffer.lines().get(line - 1);
        for (Anchored entry : entries) {
            boolean matches = unchanged
                    ? entry.diagnostic().line() == line
                    : entry.lineText() != null && !entry.lineText().isBlank() && entry.lineText().equals(current);
            if (matches) {
                result.add(new Diagnostic(line, entry.diagnostic().message()));
            }
        }
        return result;
    }

    public int size() {
        return entries.size();
    }
}
