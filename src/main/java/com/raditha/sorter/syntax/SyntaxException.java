package com.raditha.sorter.syntax;

/**
 * Raised by a {@link SyntaxTreeProvider} that cannot build a tree.
 */
public class SyntaxException extends RuntimeException {

    public SyntaxException(String message) {
        super(message);
    }

    public SyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
