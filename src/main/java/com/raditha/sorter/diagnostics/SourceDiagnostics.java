package com.raditha.sorter.diagnostics;

import com.raditha.sorter.buffer.LineBuffer;
import com.raditha.sorter.syntax.Language;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics computed from the buffer itself, recomputed whenever the buffer changes.
 */
public class SourceDiagnostics implements DiagnosticsProvider {

    private final LineBuffer buffer;
    private final ImportUsageAnalyzer analyzer;
    private long analyzedVersion = -1;
    private List<Diagnostic> diagnostics = List.of();

    public SourceDiagnostics(LineBuffer buffer, ImportUsageAnalyzer analyzer) {
        this.buffer = buffer;
        this.analyzer = analyzer;
    }

    /**
     * Analyzer for the given language.
     */
    public static SourceDiagnostics forLanguage(LineBuffer buffer, Language language) {
        ImportUsageAnalyzer analyzer = switch (language) {
            case PHP -> new PhpImportUsageAnalyzer();
            case JAVA -> new JavaImportUsageAnalyzer();
        };
        return new SourceDiagnostics(buffer, analyzer);
    }

    @Override
    public List<Diagnostic> diagnosticsAt(int line) {
        if (buffer.version() != analyzedVersion) {
            diagnostics = analyzer.findUnusedImports(buffer.text());
            analyzedVersion = buffer.version();
        }
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.line() == line) {
                result.add(diagnostic);
            }
        }
        return result;
    }
}
