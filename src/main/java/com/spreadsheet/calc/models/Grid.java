package com.spreadsheet.calc.models;

import com.spreadsheet.calc.exceptions.InvalidDimensionsException;
import com.spreadsheet.calc.exceptions.InvalidRangeException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Sparse cell store with fixed dimensions.
 * A coordinate that was never written reads as literal 0 without error.
 */
public class Grid {

    public static final int MAX_ROWS = 999;
    public static final int MAX_COLS = 18278;

    private final int rows;
    private final int cols;
    // Key: coordinate -> cell record; absent means untouched
    private final Map<CellRef, Cell> cells = new HashMap<>();

    public Grid(int rows, int cols) {
        if (rows < 1 || rows > MAX_ROWS || cols < 1 || cols > MAX_COLS) {
            throw new InvalidDimensionsException(
                    "Grid must have 1.." + MAX_ROWS + " rows and 1.." + MAX_COLS + " columns, got " + rows + "x" + cols);
        }
        this.rows = rows;
        this.cols = cols;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public boolean contains(CellRef ref) {
        return ref.getRow() < rows && ref.getCol() < cols;
    }

    public boolean contains(CellRange range) {
        return contains(range.getTopLeft()) && contains(range.getBottomRight());
    }

    public void checkBounds(CellRef ref) {
        if (!contains(ref)) {
            throw new InvalidRangeException("Cell " + ref + " is outside the " + rows + "x" + cols + " grid");
        }
    }

    public void checkBounds(CellRange range) {
        if (!contains(range)) {
            throw new InvalidRangeException("Range " + range + " is outside the " + rows + "x" + cols + " grid");
        }
    }

    /**
     * Returns the stored cell, or null when the coordinate was never written.
     */
    public Cell peek(CellRef ref) {
        return cells.get(ref);
    }

    /**
     * Returns the cell at ref, creating an empty literal cell on first access.
     */
    public Cell getCell(CellRef ref) {
        checkBounds(ref);
        return cells.computeIfAbsent(ref, Cell::new);
    }

    /**
     * Drops the record at ref when it is blank, so it reads as untouched again.
     */
    public void release(CellRef ref) {
        Cell cell = cells.get(ref);
        if (cell != null && cell.isBlank()) {
            cells.remove(ref);
        }
    }

    public int valueAt(CellRef ref) {
        Cell cell = cells.get(ref);
        return cell == null ? 0 : cell.getValue();
    }

    public CellError errorAt(CellRef ref) {
        Cell cell = cells.get(ref);
        return cell == null ? CellError.NONE : cell.getError();
    }

    public Collection<Cell> storedCells() {
        return Collections.unmodifiableCollection(cells.values());
    }
}
