package com.raditha.sorter.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SortElementsCLITest {

    private static final String UNSORTED = """
            <?php

            use B\\Two;
            use A\\One;

            class C
            {
                public $b;
                private $a;

                public function f(One $o, Two $t) {}
            }
            """;

    private static final String SORTED = """
            <?php

            use A\\One;
            use B\\Two;

            class C
            {
                private $a;

                public $b;

                public function f(One $o, Two $t) {}
            }
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private Path source(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testSortsFileInPlace() throws IOException {
        Path file = source("C.php", UNSORTED);

        int exitCode = SortElementsCLI.createCommandLine().execute(file.toString());

        assertEquals(0, exitCode);
        assertEquals(SORTED, Files.readString(file));
        assertTrue(outContent.toString().contains("Sorted: " + file));
        assertTrue(outContent.toString().contains("Files changed: 1"));
    }

    @Test
    void testSortedFileIsReportedUnchanged() throws IOException {
        Path file = source("C.php", SORTED);

        int exitCode = SortElementsCLI.createCommandLine().execute(file.toString());

        assertEquals(0, exitCode);
        assertEquals(SORTED, Files.readString(file));
        assertTrue(outContent.toString().contains("Unchanged: " + file));
    }

    @Test
    void testDryRunPrintsDiffAndKeepsFile() throws IOException {
        Path file = source("C.php", UNSORTED);

        int exitCode = SortElementsCLI.createCommandLine().execute("--dry-run", file.toString());

        assertEquals(0, exitCode);
        assertEquals(UNSORTED, Files.readString(file));
        String output = outContent.toString();
        assertTrue(output.contains("--- a/C.php"));
        assertTrue(output.contains("+++ b/C.php"));
        assertTrue(output.contains("-use B\\Two;"));
        assertTrue(output.contains("+use B\\Two;"));
        assertTrue(output.contains("Files that would change: 1"));
    }

    @Test
    void testDiagnosticsReportDrivesPruning() throws IOException {
        Path file = source("C.php", UNSORTED.replace("One $o, Two $t", "One $o"));
        Path report = source("report.json", "[{\"line\": 3, \"message\": \"Symbol 'Two' is declared but not used.\"}]");

        int exitCode = SortElementsCLI.createCommandLine().execute("--diagnostics", report.toString(), file.toString());

        assertEquals(0, exitCode);
        String content = Files.readString(file);
        assertFalse(content.contains("use B\\Two;"));
        assertTrue(content.contains("use A\\One;"));
    }

    @Test
    void testNoRemoveUnusedKeepsImports() throws IOException {
        Path file = source("C.php", UNSORTED.replace("One $o, Two $t", "One $o"));

        int exitCode = SortElementsCLI.createCommandLine().execute("--no-remove-unused", file.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.readString(file).contains("use B\\Two;"));
    }

    @Test
    void testLanguageMismatchFailsTheFile() throws IOException {
        Path file = source("C.php", UNSORTED);

        int exitCode = SortElementsCLI.createCommandLine().execute("--language", "java", file.toString());

        assertEquals(1, exitCode);
        assertEquals(UNSORTED, Files.readString(file));
        assertTrue(errContent.toString().contains("Error: " + file));
        assertTrue(outContent.toString().contains("Files failed: 1"));
    }

    @Test
    void testInvalidVisibilityIsAConfigurationError() throws IOException {
        Path file = source("C.php", UNSORTED);

        int exitCode = SortElementsCLI.createCommandLine().execute("--default-visibility", "internal", file.toString());

        assertEquals(1, exitCode);
        assertTrue(errContent.toString().contains("Configuration error"));
        assertEquals(UNSORTED, Files.readString(file));
    }

    @Test
    void testConfigFileIsApplied() throws IOException {
        Path file = source("C.php", UNSORTED);
        Path config = source("sorter.yml", "elements_sorter:\n  sort_properties: false\n");

        int exitCode = SortElementsCLI.createCommandLine().execute("--config-file", config.toString(), file.toString());

        assertEquals(0, exitCode);
        String content = Files.readString(file);
        assertTrue(content.indexOf("public $b;") < content.indexOf("private $a;"));
        assertTrue(content.indexOf("use A\\One;") < content.indexOf("use B\\Two;"));
    }

    @Test
    void testMissingFileArgumentIsRejected() {
        int exitCode = SortElementsCLI.createCommandLine().execute();

        assertNotEquals(0, exitCode);
        assertTrue(errContent.toString().contains("Missing required parameter"));
    }
}
