package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRef;

/**
 * One side of a binary operation or the argument of SLEEP:
 * either an integer literal or a reference to another cell.
 */
public final class Operand {
    private final int literal;
    private final CellRef ref;

    private Operand(int literal, CellRef ref) {
        this.literal = literal;
        this.ref = ref;
    }

    public static Operand literal(int value) {
        return new Operand(value, null);
    }

    public static Operand reference(CellRef ref) {
        return new Operand(0, ref);
    }

    public boolean isReference() {
        return ref != null;
    }

    public CellRef getRef() {
        return ref;
    }

    public int getLiteral() {
        return literal;
    }

    public EvaluationResult evaluate(EvaluationContext context) {
        return ref == null ? EvaluationResult.of(literal) : context.read(ref);
    }

    @Override
    public String toString() {
        return ref == null ? Integer.toString(literal) : ref.toLabel();
    }
}
