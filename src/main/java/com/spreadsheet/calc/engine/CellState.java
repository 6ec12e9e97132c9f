package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.parser.Expression;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Saved contents of one cell: everything needed to put it back exactly,
 * except its dependents, which follow from the other cells' parents.
 */
public final class CellState {
    private final CellRef ref;
    private final int value;
    private final CellError error;
    private final String formulaText;
    private final Expression expression;
    private final Set<CellRef> parents;

    private CellState(CellRef ref, int value, CellError error, String formulaText,
                      Expression expression, Set<CellRef> parents) {
        this.ref = ref;
        this.value = value;
        this.error = error;
        this.formulaText = formulaText;
        this.expression = expression;
        this.parents = parents;
    }

    public static CellState of(Cell cell) {
        return new CellState(cell.getRef(), cell.getValue(), cell.getError(), cell.getFormulaText(),
                cell.getExpression(), Collections.unmodifiableSet(new TreeSet<>(cell.getParents())));
    }

    /**
     * State of a coordinate that has never been written: literal 0.
     */
    public static CellState blank(CellRef ref) {
        return new CellState(ref, 0, CellError.NONE, "", null, Collections.emptySet());
    }

    /**
     * Writes this state's own fields and parent set back onto {@code cell}.
     * Dependents of the parents are not touched.
     */
    void applyTo(Cell cell) {
        cell.setFormula(formulaText, expression);
        cell.setResult(value, error);
        cell.getParents().clear();
        cell.getParents().addAll(parents);
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

    public String getFormulaText() {
        return formulaText;
    }

    public Expression getExpression() {
        return expression;
    }

    public Set<CellRef> getParents() {
        return parents;
    }
}
