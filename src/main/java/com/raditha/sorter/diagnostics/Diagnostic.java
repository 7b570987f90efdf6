package com.raditha.sorter.diagnostics;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One message reported against a buffer line.
 *
 * @param line    1-indexed line
 * @param message human readable message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Diagnostic(int line, String message) {

    public Diagnostic {
        if (line < 1) {
            throw new IllegalArgumentException("line must be >= 1, got: " + line);
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }
}
