package com.spreadsheet.calc.models;

/**
 * Error state of a cell.
 * DIVIDE_BY_ZERO, INVALID_REFERENCE and OVERFLOW are evaluation results that are
 * stored on the cell and spread to its dependents.
 * CIRCULAR_DEPENDENCY and PARSE_FAILURE describe rejected edits and never end up
 * on a committed cell.
 */
public enum CellError {
    NONE,
    DIVIDE_BY_ZERO,
    INVALID_REFERENCE,
    CIRCULAR_DEPENDENCY,
    PARSE_FAILURE,
    OVERFLOW;

    public boolean isError() {
        return this != NONE;
    }
}
