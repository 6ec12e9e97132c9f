package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellError;

import java.util.Objects;

/**
 * Value or error produced by evaluating an expression or reading a cell.
 */
public final class EvaluationResult {
    private final int value;
    private final CellError error;

    private EvaluationResult(int value, CellError error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult of(int value) {
        return new EvaluationResult(value, CellError.NONE);
    }

    /**
     * Narrows a 64-bit intermediate, reporting OVERFLOW when it does not fit.
     */
    public static EvaluationResult ofLong(long value) {
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            return error(CellError.OVERFLOW);
        }
        return of((int) value);
    }

    public static EvaluationResult error(CellError error) {
        return new EvaluationResult(0, error);
    }

    public int getValue() {
        return value;
    }

    public CellError getError() {
        return error;
    }

    public boolean isError() {
        return error.isError();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult other = (EvaluationResult) o;
        return value == other.value && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return isError() ? error.name() : Integer.toString(value);
    }
}
