package com.raditha.sorter.model;

/**
 * The buffer is written in a language other than the configured target.
 */
public class LanguageMismatchException extends ElementSorterException {

    public LanguageMismatchException(String message) {
        super(message);
    }
}
