package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellError;

/**
 * Arithmetic operators of a binary formula. All arithmetic is on 32-bit integers;
 * results outside that range evaluate to OVERFLOW.
 */
public enum Operator {
    PLUS('+'),
    MINUS('-'),
    MULTIPLY('*'),
    DIVIDE('/');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public char getSymbol() {
        return symbol;
    }

    public static Operator fromSymbol(char symbol) {
        for (Operator op : values()) {
            if (op.symbol == symbol) {
                return op;
            }
        }
        return null;
    }

    public EvaluationResult apply(int left, int right) {
        switch (this) {
            case PLUS:
                return EvaluationResult.ofLong((long) left + right);
            case MINUS:
                return EvaluationResult.ofLong((long) left - right);
            case MULTIPLY:
                return EvaluationResult.ofLong((long) left * right);
            case DIVIDE:
                if (right == 0) {
                    return EvaluationResult.error(CellError.DIVIDE_BY_ZERO);
                }
                // MIN_VALUE / -1 is the one quotient that does not fit
                return EvaluationResult.ofLong((long) left / right);
            default:
                throw new IllegalStateException("Unknown operator " + this);
        }
    }
}
