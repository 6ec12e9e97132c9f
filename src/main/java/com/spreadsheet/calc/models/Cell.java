package com.spreadsheet.calc.models;

import com.spreadsheet.calc.parser.Expression;

import java.util.Set;
import java.util.TreeSet;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its coordinate
 * - value (only meaningful while error is NONE; kept at 0 otherwise)
 * - error state
 * - formulaText as entered ("" for a literal cell) and the parsed expression (null for a literal)
 * - parents (cells its formula reads) and dependents (cells whose formula reads it)
 *
 * Instances are owned by a {@link Grid}; only the engine mutates them.
 */
public class Cell {
    private final CellRef ref;
    private int value;
    private CellError error = CellError.NONE;
    private String formulaText = "";
    private Expression expression;
    private final Set<CellRef> parents = new TreeSet<>();
    private final Set<CellRef> dependents = new TreeSet<>();

    public Cell(CellRef ref) {
        this.ref = ref;
    }

    public CellRef getRef() {
        return ref;
    }

    public int getValue() {
        return value;
    }

    public CellError getError() {
        return error;
    }

    /**
     * Stores an evaluation result; an error result zeroes the value.
     */
    public void setResult(int value, CellError error) {
        this.error = error;
        this.value = error.isError() ? 0 : value;
    }

    public String getFormulaText() {
        return formulaText;
    }

    public Expression getExpression() {
        return expression;
    }

    public boolean isFormula() {
        return expression != null;
    }

    public void setFormula(String formulaText, Expression expression) {
        this.formulaText = formulaText;
        this.expression = expression;
    }

    /**
     * Turns the cell into a plain literal. Edge sets are left to the dependency graph.
     */
    public void setLiteral(int value) {
        this.formulaText = "";
        this.expression = null;
        setResult(value, CellError.NONE);
    }

    /**
     * True when the cell holds nothing an untouched coordinate would not: literal 0, no edges.
     */
    public boolean isBlank() {
        return expression == null && value == 0 && !error.isError() && parents.isEmpty() && dependents.isEmpty();
    }

    // Edge sets are live views; DependencyGraph keeps them as exact inverses
    public Set<CellRef> getParents() {
        return parents;
    }

    public Set<CellRef> getDependents() {
        return dependents;
    }
}
