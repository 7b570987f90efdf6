package com.raditha.sorter.model;

/**
 * No syntax tree could be produced for the buffer: either no provider is registered for its
 * language or the provider failed to parse it.
 */
public class MissingParserException extends ElementSorterException {

    public MissingParserException(String message) {
        super(message);
    }

    public MissingParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
