package com.raditha.sorter.cli;

import com.raditha.sorter.buffer.FileBuffer;
import com.raditha.sorter.config.SorterConfig;
import com.raditha.sorter.config.SorterSettings;
import com.raditha.sorter.diagnostics.DiagnosticsProvider;
import com.raditha.sorter.diagnostics.ReportedDiagnostics;
import com.raditha.sorter.diagnostics.SourceDiagnostics;
import com.raditha.sorter.model.ElementSorterException;
import com.raditha.sorter.model.WriteFailure;
import com.raditha.sorter.syntax.Language;
import com.raditha.sorter.workflow.ElementSorter;
import com.raditha.sorter.workflow.SortResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the elements sorter.
 * <p>
 * Usage:
 * java -jar php-elements-sorter.jar [options] &lt;file&gt;...
 * <p>
 * Configuration priority: CLI arguments > config file > defaults
 */
@Command(name = "sort-elements", mixinStandardHelpOptions = true, version = "PHP Elements Sorter v1.0.0",
        description = "Sorts namespace imports, trait uses, constants and properties")
@SuppressWarnings("java:S106")
public class SortElementsCLI implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "<file>", description = "Source files to sort")
    private List<Path> files;

    @Option(names = "--config-file", description = "YAML file with an elements_sorter section", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--dry-run", description = "Print a unified diff instead of writing files")
    private boolean dryRun = false;

    @Option(names = "--diagnostics", description = "JSON linter report used to find unused imports",
            paramLabel = "<json>")
    private Path diagnosticsReport;

    @Option(names = "--default-visibility", description = "Visibility of declarations without a modifier "
            + "(public, protected or private)", paramLabel = "<visibility>")
    private String defaultVisibility;

    @Option(names = "--language", description = "Target language (php or java)", paramLabel = "<language>")
    private String language;

    @Option(names = "--no-remove-unused", description = "Keep imports reported as unused")
    private boolean noRemoveUnused = false;

    private final DiffGenerator diffGenerator = new DiffGenerator();

    @Override
    public Integer call() throws Exception {
        SorterConfig config = SorterSettings.loadConfig(configFile, defaultVisibility, language,
                noRemoveUnused ? Boolean.FALSE : null);
        ElementSorter sorter = new ElementSorter(config);

        int changed = 0;
        int failed = 0;
        for (Path file : files) {
            try {
                if (processFile(file, config, sorter)) {
                    changed++;
                }
            } catch (ElementSorterException e) {
                System.err.println("Error: " + file + ": " + e.getMessage());
                failed++;
            }
        }

        System.out.println();
        System.out.println("=== Sort Summary ===");
        System.out.printf("Files processed: %d%n", files.size());
        System.out.printf("Files %s: %d%n", dryRun ? "that would change" : "changed", changed);
        System.out.printf("Files failed: %d%n", failed);
        return failed == 0 ? 0 : 1;
    }

    /**
     * @return true if the file was (or in dry-run mode would be) changed
     * @throws ElementSorterException if the file cannot be sorted
     */
    private boolean processFile(Path file, SorterConfig config, ElementSorter sorter) throws IOException {
        FileBuffer buffer = FileBuffer.open(file);
        Language fileLanguage = languageOf(file, config);
        DiagnosticsProvider diagnostics = diagnosticsReport != null
                ? ReportedDiagnostics.load(diagnosticsReport, buffer)
                : SourceDiagnostics.forLanguage(buffer, fileLanguage);

        SortResult result = sorter.sortElements(buffer, fileLanguage, diagnostics);
        for (WriteFailure failure : result.getFailures()) {
            System.err.printf("Warning: %s: %s failed at %s: %s%n",
                    file, failure.operation(), failure.range(), failure.error());
        }
        if (result.hasFailures()) {
            throw new ElementSorterException(result.getFailures().size() + " write(s) failed");
        }
        if (!buffer.isModified()) {
            System.out.println("Unchanged: " + file);
            return false;
        }
        if (dryRun) {
            System.out.println(diffGenerator.generateUnifiedDiff(
                    file.getFileName().toString(), buffer.getOriginalLines(), buffer.lines()));
        } else {
            buffer.save();
            System.out.println("Sorted: " + file + " (" + result + ")");
        }
        return true;
    }

    private static Language languageOf(Path file, SorterConfig config) {
        try {
            return Language.fromPath(file);
        } catch (IllegalArgumentException e) {
            return config.language();
        }
    }

    /**
     * Command line with the error handlers installed.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new SortElementsCLI());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
            }
            return 1;
        });
        return cmd;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }
}
