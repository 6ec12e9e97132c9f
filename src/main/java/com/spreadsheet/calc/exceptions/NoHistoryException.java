package com.spreadsheet.calc.exceptions;

/**
 * Thrown by undo/redo when there is nothing to undo or redo.
 */
public class NoHistoryException extends RuntimeException {
    public NoHistoryException(String message) {
        super(message);
    }
}
