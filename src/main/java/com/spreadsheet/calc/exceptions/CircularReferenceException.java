package com.spreadsheet.calc.exceptions;

import com.spreadsheet.calc.models.CellRef;

/**
 * Thrown when a formula would make a cell reachable from itself through its
 * dependents (a cell referencing itself, or a multi-cell loop).
 * The edit is rejected before any cell changes.
 */
public class CircularReferenceException extends RuntimeException {
    private final CellRef cell;

    public CircularReferenceException(CellRef cell, String message) {
        super(message);
        this.cell = cell;
    }

    public CellRef getCell() {
        return cell;
    }
}
