package com.raditha.sorter.model;

/**
 * Fatal sorter failure, raised before the buffer is touched.
 */
public class ElementSorterException extends RuntimeException {

    public ElementSorterException(String message) {
        super(message);
    }

    public ElementSorterException(String message, Throwable cause) {
        super(message, cause);
    }
}
