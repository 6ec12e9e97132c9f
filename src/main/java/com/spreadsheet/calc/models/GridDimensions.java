package com.spreadsheet.calc.models;

/**
 * JSON body of a create-sheet request: { "rows": 20, "cols": 10 }.
 * Either field may be omitted to fall back to the configured default.
 */
public class GridDimensions {
    private Integer rows;
    private Integer cols;

    // Default constructor needed for JSON (de)serialization
    public GridDimensions() {
    }

    public GridDimensions(Integer rows, Integer cols) {
        this.rows = rows;
        this.cols = cols;
    }

    public Integer getRows() {
        return rows;
    }
    public Integer getCols() {
        return cols;
    }
    public void setRows(Integer rows) {
        this.rows = rows;
    }
    public void setCols(Integer cols) {
        this.cols = cols;
    }
}
