package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRef;

/**
 * What an expression may read while it is evaluated.
 */
public interface EvaluationContext {

    EvaluationResult read(CellRef ref);

    /**
     * Blocks for {@code units} sleep units. Only SLEEP calls this.
     */
    void sleep(int units);
}
