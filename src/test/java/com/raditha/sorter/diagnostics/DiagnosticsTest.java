package com.raditha.sorter.diagnostics;

import com.raditha.sorter.buffer.BufferWriteException;
import com.raditha.sorter.buffer.InMemoryLineBuffer;
import com.raditha.sorter.syntax.Language;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DiagnosticsTest {

    @TempDir
    Path tempDir;

    @Test
    void testOracleMatchesUnusedMessages() {
        DiagnosticsProvider provider = line -> switch (line) {
            case 1 -> List.of(new Diagnostic(1, "Symbol 'Foo' is declared but not used."));
            case 2 -> List.of(new Diagnostic(2, "Variable $x is not used"));
            case 3 -> List.of(new Diagnostic(3, "Undefined type 'Bar'."));
            default -> List.of();
        };
        DiagnosticsOracle oracle = new DiagnosticsOracle(provider);

        assertTrue(oracle.isUnused(1));
        assertTrue(oracle.isUnused(2));
        assertFalse(oracle.isUnused(3));
        assertFalse(oracle.isUnused(4));
        assertFalse(new DiagnosticsOracle(DiagnosticsProvider.NONE).isUnused(1));
    }

    @Test
    void testSourceDiagnosticsFollowBufferChanges() throws BufferWriteException {
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(List.of("<?php", "use Foo\\Unused;"));
        SourceDiagnostics diagnostics = SourceDiagnostics.forLanguage(buffer, Language.PHP);

        assertEquals(1, diagnostics.diagnosticsAt(2).size());

        buffer.setLines(2, 1, List.of("// header"));
        assertTrue(diagnostics.diagnosticsAt(2).isEmpty());
        assertEquals(1, diagnostics.diagnosticsAt(3).size());
    }

    @Test
    void testSourceDiagnosticsAnalyzeOncePerVersion() {
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(List.of("<?php", "use A;", "use B;"));
        ImportUsageAnalyzer analyzer = mock(ImportUsageAnalyzer.class);
        when(analyzer.findUnusedImports(anyString())).thenReturn(List.of(new Diagnostic(2, "is not used")));
        SourceDiagnostics diagnostics = new SourceDiagnostics(buffer, analyzer);

        diagnostics.diagnosticsAt(2);
        diagnostics.diagnosticsAt(3);

        verify(analyzer, times(1)).findUnusedImports(anyString());
    }

    @Test
    void testReportedDiagnosticsFromArray() throws IOException {
        Path report = tempDir.resolve("report.json");
        Files.writeString(report, """
                [{"line": 2, "message": "Symbol 'A' is declared but not used.", "severity": "hint"}]
                """);
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(List.of("<?php", "use A;", "use B;"));

        ReportedDiagnostics diagnostics = ReportedDiagnostics.load(report, buffer);

        assertEquals(1, diagnostics.size());
        assertEquals(1, diagnostics.diagnosticsAt(2).size());
        assertTrue(diagnostics.diagnosticsAt(3).isEmpty());
    }

    @Test
    void testReportedDiagnosticsFollowTheirLine() throws IOException, BufferWriteException {
        Path report = tempDir.resolve("report.json");
        Files.writeString(report, """
                {"diagnostics": [{"line": 2, "message": "Symbol 'B' is declared but not used."}]}
                """);
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(List.of("<?php", "use B;", "use A;"));
        ReportedDiagnostics diagnostics = ReportedDiagnostics.load(report, buffer);

        buffer.setLines(2, 3, List.of("use A;", "use B;"));

        assertTrue(diagnostics.diagnosticsAt(2).isEmpty());
        assertEquals(3, diagnostics.diagnosticsAt(3).get(0).line());
        assertTrue(diagnostics.diagnosticsAt(3).get(0).message().contains("'B'"));
    }

    @Test
    void testMalformedReport() throws IOException {
        Path report = tempDir.resolve("bad.json");
        Files.writeString(report, "{\"foo\": 1}");
        InMemoryLineBuffer buffer = new InMemoryLineBuffer(List.of("<?php"));

        assertThrows(IOException.class, () -> ReportedDiagnostics.load(report, buffer));

        Files.writeString(report, "[{\"line\": 0, \"message\": \"x\"}]");
        assertThrows(IOException.class, () -> ReportedDiagnostics.load(report, buffer));
    }
}
