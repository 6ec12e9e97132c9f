package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRef;

import java.util.Collections;
import java.util.Set;

/**
 * "=SLEEP(n)": evaluates to n after blocking for n sleep units (nothing for n <= 0).
 */
public final class SleepFunction implements Expression {
    private final Operand argument;

    public SleepFunction(Operand argument) {
        this.argument = argument;
    }

    public Operand getArgument() {
        return argument;
    }

    @Override
    public Set<CellRef> references() {
        return argument.isReference() ? Collections.singleton(argument.getRef()) : Collections.emptySet();
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        EvaluationResult result = argument.evaluate(context);
        if (!result.isError() && result.getValue() > 0) {
            context.sleep(result.getValue());
        }
        return result;
    }

    @Override
    public String toString() {
        return "SLEEP(" + argument + ")";
    }
}
