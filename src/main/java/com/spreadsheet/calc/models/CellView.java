package com.spreadsheet.calc.models;

/**
 * Read-only copy of a cell for rendering. Holds no reference back into the grid.
 */
public class CellView {
    private final int row;
    private final int col;
    private final String label;
    private final Integer value;
    private final CellError error;
    private final String formula;

    public CellView(CellRef ref, int value, CellError error, String formula) {
        this.row = ref.getRow();
        this.col = ref.getCol();
        this.label = ref.toLabel();
        // null value signals "not displayable" to JSON clients
        this.value = error.isError() ? null : value;
        this.error = error;
        this.formula = formula;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public String getLabel() {
        return label;
    }

    public Integer getValue() {
        return value;
    }

    public CellError getError() {
        return error;
    }

    public String getFormula() {
        return formula;
    }
}
