package com.spreadsheet.calc.engine;

/**
 * Rectangle of literal values captured by copy or cut. No formulas, no edges.
 */
public final class CopyBuffer {
    private final int[][] values;

    public CopyBuffer(int[][] values) {
        if (values.length == 0 || values[0].length == 0) {
            throw new IllegalArgumentException("Copy buffer must hold at least one value");
        }
        this.values = new int[values.length][];
        for (int r = 0; r < values.length; r++) {
            this.values[r] = values[r].clone();
        }
    }

    public int getHeight() {
        return values.length;
    }

    public int getWidth() {
        return values[0].length;
    }

    public int valueAt(int row, int col) {
        return values[row][col];
    }
}
