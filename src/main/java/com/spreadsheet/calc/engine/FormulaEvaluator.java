package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.parser.EvaluationContext;
import com.spreadsheet.calc.parser.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Evaluates formula cells against the current grid contents.
 * Reads see whatever value a cell holds right now, so callers must evaluate in
 * dependency order.
 */
public class FormulaEvaluator implements EvaluationContext {

    private static final Logger logger = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final Grid grid;
    private final Duration sleepUnit;

    public FormulaEvaluator(Grid grid, Duration sleepUnit) {
        this.grid = grid;
        this.sleepUnit = sleepUnit;
    }

    /**
     * Re-computes a formula cell and stores the result on it.
     */
    public EvaluationResult evaluate(Cell cell) {
        EvaluationResult result = cell.getExpression().evaluate(this);
        cell.setResult(result.getValue(), result.getError());
        logger.debug("Evaluated {} = {}", cell.getRef(), result);
        return result;
    }

    /**
     * Current value or error of {@code ref}. A coordinate outside the grid reads as
     * INVALID_REFERENCE; formulas entered through the parser never reach one, since it
     * rejects such references up front.
     */
    @Override
    public EvaluationResult read(CellRef ref) {
        if (!grid.contains(ref)) {
            return EvaluationResult.error(CellError.INVALID_REFERENCE);
        }
        CellError error = grid.errorAt(ref);
        if (error.isError()) {
            return EvaluationResult.error(error);
        }
        return EvaluationResult.of(grid.valueAt(ref));
    }

    @Override
    public void sleep(int units) {
        if (sleepUnit.isZero() || units <= 0) {
            return;
        }
        long millis = sleepUnit.multipliedBy(units).toMillis();
        logger.debug("SLEEP blocking for {} ms", millis);
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            // Keep the flag for the caller; the evaluated value is unaffected
            Thread.currentThread().interrupt();
            logger.warn("SLEEP interrupted after less than {} ms", millis);
        }
    }
}
