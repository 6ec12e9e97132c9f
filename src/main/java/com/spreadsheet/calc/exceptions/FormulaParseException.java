package com.spreadsheet.calc.exceptions;

/**
 * Thrown when cell input is neither an integer literal nor a well-formed formula,
 * e.g. "=SUM(B3:A1)" or "=A1+".
 */
public class FormulaParseException extends RuntimeException {
    public FormulaParseException(String message) {
        super(message);
    }

    public FormulaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
