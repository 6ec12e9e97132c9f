package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellRef;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * SUM/AVG/MIN/MAX/STDEV over a rectangle, e.g. "=SUM(A1:B3)".
 * Any cell of the rectangle in an error state makes the whole result that error.
 */
public final class RangeFunction implements Expression {
    private final RangeFunctionType type;
    private final CellRange range;

    public RangeFunction(RangeFunctionType type, CellRange range) {
        this.type = type;
        this.range = range;
    }

    public RangeFunctionType getType() {
        return type;
    }

    public CellRange getRange() {
        return range;
    }

    @Override
    public Set<CellRef> references() {
        return new TreeSet<>(range.cells());
    }

    @Override
    public EvaluationResult evaluate(EvaluationContext context) {
        List<CellRef> cells = range.cells();
        int[] values = new int[cells.size()];
        for (int i = 0; i < values.length; i++) {
            EvaluationResult r = context.read(cells.get(i));
            if (r.isError()) {
                return r;
            }
            values[i] = r.getValue();
        }
        return type.aggregate(values);
    }

    @Override
    public String toString() {
        return type.name() + "(" + range + ")";
    }
}
