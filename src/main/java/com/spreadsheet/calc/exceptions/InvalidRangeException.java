package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a command argument names a cell or range that is malformed,
 * outside the grid, or of the wrong shape for the command.
 */
public class InvalidRangeException extends RuntimeException {
    public InvalidRangeException(String message) {
        super(message);
    }
}
