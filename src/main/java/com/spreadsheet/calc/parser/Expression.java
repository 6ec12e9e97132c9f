package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRef;

import java.util.Set;

/**
 * Parsed formula. Immutable, so the same instance can be kept in undo snapshots.
 */
public interface Expression {

    /**
     * Cells this expression reads, with ranges expanded to every cell inside them.
     * These become the parents of the cell holding the formula.
     */
    Set<CellRef> references();

    /**
     * Computes the result from the current values in {@code context}.
     * The first operand found in an error state decides the result.
     */
    EvaluationResult evaluate(EvaluationContext context);
}
