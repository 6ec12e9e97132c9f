package com.spreadsheet.calc.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of every rejected request: an error kind and a message, plus the
 * offending cell when the kind is about one cell. For example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "A1 would depend on itself",
 *   "cell": "A1"
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String cell;

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public ErrorResponse(String code, String message, String cell) {
        this.code = code;
        this.message = message;
        this.cell = cell;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getCell() {
        return cell;
    }
}
