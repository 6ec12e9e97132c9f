package com.spreadsheet.calc.models;

import java.util.Objects;

/**
 * Coordinate of a single cell: 0-based row and column.
 * Used as the key into the grid and inside parent/dependent sets,
 * so cells never hold references to each other directly.
 * Ordered row-major.
 */
public final class CellRef implements Comparable<CellRef> {
    private final int row;
    private final int col;

    public CellRef(int row, int col) {
        if (row < 0 || col < 0) {
            throw new IllegalArgumentException("Negative cell coordinate: " + row + "," + col);
        }
        this.row = row;
        this.col = col;
    }

    public static CellRef of(int row, int col) {
        return new CellRef(row, col);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    /**
     * Converts a 0-based column index to its letter form: 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnLabel(int col) {
        StringBuilder sb = new StringBuilder();
        int n = col + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Spreadsheet-style label, e.g. (0,0) -> "A1", (9,27) -> "AB10".
     */
    public String toLabel() {
        return columnLabel(col) + (row + 1);
    }

    @Override
    public int compareTo(CellRef other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(col, other.col);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRef)) {
            return false;
        }
        CellRef other = (CellRef) o;
        return row == other.row && col == other.col;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, col);
    }

    @Override
    public String toString() {
        return toLabel();
    }
}
