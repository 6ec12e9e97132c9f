package com.spreadsheet.calc.models;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rectangular block of cells between a top-left and a bottom-right corner (both inclusive).
 */
public final class CellRange {
    private final CellRef topLeft;
    private final CellRef bottomRight;

    public CellRange(CellRef topLeft, CellRef bottomRight) {
        if (topLeft.getRow() > bottomRight.getRow() || topLeft.getCol() > bottomRight.getCol()) {
            throw new IllegalArgumentException("Range corners out of order: " + topLeft + ":" + bottomRight);
        }
        this.topLeft = topLeft;
        this.bottomRight = bottomRight;
    }

    public static CellRange of(CellRef topLeft, CellRef bottomRight) {
        return new CellRange(topLeft, bottomRight);
    }

    public CellRef getTopLeft() {
        return topLeft;
    }

    public CellRef getBottomRight() {
        return bottomRight;
    }

    public int getHeight() {
        return bottomRight.getRow() - topLeft.getRow() + 1;
    }

    public int getWidth() {
        return bottomRight.getCol() - topLeft.getCol() + 1;
    }

    public boolean isSingleColumn() {
        return topLeft.getCol() == bottomRight.getCol();
    }

    public boolean contains(CellRef ref) {
        return ref.getRow() >= topLeft.getRow() && ref.getRow() <= bottomRight.getRow()
                && ref.getCol() >= topLeft.getCol() && ref.getCol() <= bottomRight.getCol();
    }

    /**
     * All cells of the rectangle in row-major order.
     */
    public List<CellRef> cells() {
        List<CellRef> refs = new ArrayList<>(getHeight() * getWidth());
        for (int r = topLeft.getRow(); r <= bottomRight.getRow(); r++) {
            for (int c = topLeft.getCol(); c <= bottomRight.getCol(); c++) {
                refs.add(new CellRef(r, c));
            }
        }
        return refs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topLeft, bottomRight);
    }

    @Override
    public String toString() {
        return topLeft.toLabel() + ":" + bottomRight.toLabel();
    }
}
