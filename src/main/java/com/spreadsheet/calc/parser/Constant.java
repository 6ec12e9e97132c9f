package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRef;

import java.util.Collections;
import java.util.Set;

/**
 * A formula that is just a number, e.g. "=42".
 */
public final class Constant implements Expression {
    private final int value;

    public Constant(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public Set<CellRef> references() {
        return Collections.emptySet();
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        return EvaluationResult.of(value);
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
