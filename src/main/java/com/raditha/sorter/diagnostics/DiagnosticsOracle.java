package com.raditha.sorter.diagnostics;

import com.raditha.sorter.cleanup.UnusedOracle;

import java.util.regex.Pattern;

/**
 * Treats a line as unused when any diagnostic on it says so.
 */
public class DiagnosticsOracle implements UnusedOracle {

    private static final Pattern UNUSED = Pattern.compile("is not used|is declared but not used");

    private final DiagnosticsProvider provider;

    public DiagnosticsOracle(DiagnosticsProvider provider) {
        this.provider = provider;
    }

    @Override
    public boolean isUnused(int line) {
        for (Diagnostic diagnostic : provider.diagnosticsAt(line)) {
            if (UNUSED.matcher(diagnostic.message()).find()) {
                return true;
            }
        }
        return false;
    }
}
