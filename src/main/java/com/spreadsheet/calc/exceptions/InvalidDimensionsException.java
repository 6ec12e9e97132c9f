package com.spreadsheet.calc.exceptions;

/**
 * Thrown when a grid is requested with a row or column count outside the supported limits.
 */
public class InvalidDimensionsException extends RuntimeException {
    public InvalidDimensionsException(String message) {
        super(message);
    }
}
