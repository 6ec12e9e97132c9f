package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.exceptions.EmptyBufferException;
import com.spreadsheet.calc.exceptions.InvalidRangeException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.models.SortDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Copy, cut, paste, autofill and sort.
 *
 * These work on values only: every cell they write becomes a plain literal, losing
 * any formula and its incoming edges. Cells that depend on a written cell keep
 * depending on it and are recomputed through the normal propagation path.
 * All argument checks happen before the first write.
 */
public class RangeOperations {

    private static final Logger logger = LoggerFactory.getLogger(RangeOperations.class);

    private final Grid grid;
    private final DependencyGraph graph;
    private final HistoryManager history;

    private CopyBuffer buffer;

    public RangeOperations(Grid grid, DependencyGraph graph, HistoryManager history) {
        this.grid = grid;
        this.graph = graph;
        this.history = history;
    }

    /**
     * Captures the values of {@code range} into the copy buffer. No cell changes.
     */
    public void copy(CellRange range) {
        grid.checkBounds(range);
        buffer = capture(range);
        logger.debug("Copied {} into a {}x{} buffer", range, buffer.getHeight(), buffer.getWidth());
    }

    /**
     * Captures like {@link #copy}, then sets every cell of {@code range} to literal 0.
     */
    public void cut(CellRange range) {
        grid.checkBounds(range);
        buffer = capture(range);
        Map<CellRef, Integer> writes = new LinkedHashMap<>();
        for (CellRef ref : range.cells()) {
            writes.put(ref, 0);
        }
        writeLiterals("cut " + range, writes);
    }

    /**
     * Writes the copy buffer into the same-shaped rectangle anchored at {@code topLeft}.
     * The buffer is kept, so it can be pasted again.
     */
    public void paste(CellRef topLeft) {
        if (buffer == null) {
            throw new EmptyBufferException("Nothing has been copied or cut yet");
        }
        grid.checkBounds(topLeft);
        CellRef bottomRight = new CellRef(topLeft.getRow() + buffer.getHeight() - 1,
                topLeft.getCol() + buffer.getWidth() - 1);
        if (!grid.contains(bottomRight)) {
            throw new InvalidRangeException("Pasting " + buffer.getHeight() + "x" + buffer.getWidth()
                    + " values at " + topLeft + " would run past the grid edge");
        }
        Map<CellRef, Integer> writes = new LinkedHashMap<>();
        for (int r = 0; r < buffer.getHeight(); r++) {
            for (int c = 0; c < buffer.getWidth(); c++) {
                writes.put(new CellRef(topLeft.getRow() + r, topLeft.getCol() + c), buffer.valueAt(r, c));
            }
        }
        writeLiterals("paste " + topLeft, writes);
    }

    /**
     * Extends the series found in a single-column {@code source} up or down to
     * {@code extent}, inclusive.
     */
    public void autofill(CellRange source, CellRef extent) {
        grid.checkBounds(source);
        grid.checkBounds(extent);
        if (!source.isSingleColumn()) {
            throw new InvalidRangeException("Autofill source " + source + " must be a single column");
        }
        int col = source.getTopLeft().getCol();
        if (extent.getCol() != col) {
            throw new InvalidRangeException("Autofill target " + extent + " must be in column " + CellRef.columnLabel(col));
        }
        int top = source.getTopLeft().getRow();
        int bottom = source.getBottomRight().getRow();
        if (source.contains(extent)) {
            throw new InvalidRangeException("Autofill target " + extent + " lies inside the source " + source);
        }

        int[] values = new int[source.getHeight()];
        for (int i = 0; i < values.length; i++) {
            values[i] = grid.valueAt(new CellRef(top + i, col));
        }
        AutofillPattern pattern = AutofillPattern.detect(values);

        Map<CellRef, Integer> writes = new LinkedHashMap<>();
        if (extent.getRow() > bottom) {
            for (int row = bottom + 1; row <= extent.getRow(); row++) {
                writes.put(new CellRef(row, col), seriesValue(pattern, row - top));
            }
        } else {
            for (int row = top - 1; row >= extent.getRow(); row--) {
                writes.put(new CellRef(row, col), seriesValue(pattern, row - top));
            }
        }
        logger.debug("Autofill {} -> {} using {} pattern", source, extent, pattern.getKind());
        writeLiterals("autofill " + source + " to " + extent, writes);
    }

    private static int seriesValue(AutofillPattern pattern, int position) {
        Integer value = pattern.valueAt(position);
        if (value == null) {
            throw new InvalidRangeException("Autofill series leaves the integer range at offset " + position);
        }
        return value;
    }

    /**
     * Stable-sorts the rows spanned by the single-column {@code range} by that column's
     * values. Whole rows move together, as literals.
     */
    public void sort(CellRange range, SortDirection direction) {
        grid.checkBounds(range);
        if (!range.isSingleColumn()) {
            throw new InvalidRangeException("Sort range " + range + " must be a single column");
        }
        int keyCol = range.getTopLeft().getCol();
        int top = range.getTopLeft().getRow();
        int height = range.getHeight();

        List<Integer> order = new ArrayList<>(height);
        for (int i = 0; i < height; i++) {
            order.add(top + i);
        }
        Comparator<Integer> byKey = Comparator.comparingInt(row -> grid.valueAt(new CellRef(row, keyCol)));
        order.sort(direction == SortDirection.ASCENDING ? byKey : byKey.reversed());

        // Columns never written in these rows are blank before and after the move
        TreeSet<Integer> columns = new TreeSet<>();
        columns.add(keyCol);
        for (Cell cell : grid.storedCells()) {
            int row = cell.getRef().getRow();
            if (row >= top && row < top + height) {
                columns.add(cell.getRef().getCol());
            }
        }

        Map<CellRef, Integer> writes = new LinkedHashMap<>();
        for (int i = 0; i < height; i++) {
            int sourceRow = order.get(i);
            for (int col : columns) {
                writes.put(new CellRef(top + i, col), grid.valueAt(new CellRef(sourceRow, col)));
            }
        }
        writeLiterals("sort " + range + " " + direction, writes);
    }

    private CopyBuffer capture(CellRange range) {
        int[][] values = new int[range.getHeight()][range.getWidth()];
        for (int r = 0; r < range.getHeight(); r++) {
            for (int c = 0; c < range.getWidth(); c++) {
                values[r][c] = grid.valueAt(new CellRef(range.getTopLeft().getRow() + r, range.getTopLeft().getCol() + c));
            }
        }
        return new CopyBuffer(values);
    }

    // One snapshot and one propagation pass per command
    private void writeLiterals(String command, Map<CellRef, Integer> writes) {
        history.commit(history.recordBefore(command, writes.keySet()));
        for (Map.Entry<CellRef, Integer> write : writes.entrySet()) {
            graph.detach(write.getKey());
            grid.getCell(write.getKey()).setLiteral(write.getValue());
        }
        graph.propagate(writes.keySet());
        writes.keySet().forEach(grid::release);
        logger.debug("{}: wrote {} literal cells", command, writes.size());
    }
}
