package com.raditha.sorter.diagnostics;

import java.util.List;

/**
 * Source of diagnostics for the buffer being sorted.
 */
@FunctionalInterface
public interface DiagnosticsProvider {

    DiagnosticsProvider NONE = line -> List.of();

    /**
     * Diagnostics reported at a 1-indexed line of the current buffer state.
     */
    List<Diagnostic> diagnosticsAt(int line);
}
