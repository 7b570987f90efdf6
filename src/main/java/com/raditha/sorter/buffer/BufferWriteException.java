package com.raditha.sorter.buffer;

/**
 * A range read or replacement was rejected by the buffer.
 */
public class BufferWriteException extends Exception {

    public BufferWriteException(String message) {
        super(message);
    }

    public BufferWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
