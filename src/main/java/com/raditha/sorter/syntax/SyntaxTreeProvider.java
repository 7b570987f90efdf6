package com.raditha.sorter.syntax;

/**
 * Turns source text into a navigable {@link SyntaxTree}.
 */
public interface SyntaxTreeProvider {

    Language language();

    /**
     * Parse source text.
     *
     * @throws SyntaxException if no tree can be produced for the text
     */
    SyntaxTree parse(String text);
}
