package com.spreadsheet.calc.exceptions;

/**
 * Thrown when pasting before anything was copied or cut.
 */
public class EmptyBufferException extends RuntimeException {
    public EmptyBufferException(String message) {
        super(message);
    }
}
