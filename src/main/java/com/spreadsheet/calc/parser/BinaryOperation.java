package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRef;

import java.util.Set;
import java.util.TreeSet;

/**
 * "left op right" where each side is a literal or a cell reference.
 * A bare reference "=B2" is parsed as B2+0.
 */
public final class BinaryOperation implements Expression {
    private final Operator operator;
    private final Operand left;
    private final Operand right;

    public BinaryOperation(Operator operator, Operand left, Operand right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Operand getLeft() {
        return left;
    }

    public Operand getRight() {
        return right;
    }

    @Override
    public Set<CellRef> references() {
        Set<CellRef> refs = new TreeSet<>();
        if (left.isReference()) {
            refs.add(left.getRef());
        }
        if (right.isReference()) {
            refs.add(right.getRef());
        }
        return refs;
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        EvaluationResult a = left.evaluate(context);
        if (a.isError()) {
            return a;
        }
        EvaluationResult b = right.evaluate(context);
        if (b.isError()) {
            return b;
        }
        return operator.apply(a.getValue(), b.getValue());
    }

    @Override
    public String toString() {
        return left + String.valueOf(operator.getSymbol()) + right;
    }
}
