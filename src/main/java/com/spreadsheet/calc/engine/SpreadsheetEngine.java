package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidRangeException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellError;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.models.Grid;
import com.spreadsheet.calc.models.SortDirection;
import com.spreadsheet.calc.parser.CellReferenceParser;
import com.spreadsheet.calc.parser.Expression;
import com.spreadsheet.calc.parser.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Command surface of one spreadsheet: the only owner of its grid.
 *
 * Every mutating command either completes (snapshot recorded, cells changed, dependents
 * recomputed) or throws before touching anything. Reads return detached copies.
 * Not thread-safe; callers serialize commands.
 */
public class SpreadsheetEngine {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetEngine.class);

    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final Duration DEFAULT_SLEEP_UNIT = Duration.ofSeconds(1);

    private final Grid grid;
    private final FormulaParser parser;
    private final DependencyGraph graph;
    private final HistoryManager history;
    private final RangeOperations rangeOperations;

    public SpreadsheetEngine(int rows, int cols) {
        this(rows, cols, DEFAULT_HISTORY_LIMIT, DEFAULT_SLEEP_UNIT);
    }

    public SpreadsheetEngine(int rows, int cols, int historyLimit, Duration sleepUnit) {
        this.grid = new Grid(rows, cols);
        this.parser = new FormulaParser(rows, cols);
        this.graph = new DependencyGraph(grid, new FormulaEvaluator(grid, sleepUnit));
        this.history = new HistoryManager(grid, graph, historyLimit);
        this.rangeOperations = new RangeOperations(grid, graph, history);
    }

    public int getRows() {
        return grid.getRows();
    }

    public int getCols() {
        return grid.getCols();
    }

    // ----------------------------------------------------------------
    // Cell edits
    // ----------------------------------------------------------------

    public void setCell(int row, int col, String text) {
        setCell(toRef(row, col), text);
    }

    public void setCell(String label, String text) {
        setCell(cellAt(label), text);
    }

    /**
     * Sets a cell from user input: "=..." is a formula, anything else must be an integer.
     * Steps:
     * 1) Parse (no grid access).
     * 2) Check that the new parents do not close a cycle.
     * 3) Record the cell's prior state for undo.
     * 4) Swap edges, store the formula or literal, re-evaluate the cell and its dependents.
     *
     * @throws FormulaParseException      malformed input; nothing changed
     * @throws CircularReferenceException the formula would create a cycle; nothing changed
     * @throws InvalidRangeException      the coordinate is outside the grid
     */
    public void setCell(CellRef ref, String text) {
        grid.checkBounds(ref);
        String input = text == null ? "" : text.trim();

        Expression expression = null;
        int literal = 0;
        if (!input.isEmpty() && input.charAt(0) == FormulaParser.FORMULA_PREFIX) {
            expression = parser.parse(input.substring(1));
        } else {
            literal = FormulaParser.parseLiteral(input);
        }
        Set<CellRef> newParents = expression == null ? Collections.emptySet() : expression.references();

        graph.checkAcyclic(ref, newParents);

        history.commit(history.recordBefore("set " + ref, List.of(ref)));
        graph.rewire(ref, newParents);
        Cell cell = grid.getCell(ref);
        if (expression == null) {
            cell.setLiteral(literal);
        } else {
            cell.setFormula(input, expression);
        }
        graph.propagate(ref);
        grid.release(ref);
        logger.debug("Set {} to '{}'", ref, input);
    }

    // ----------------------------------------------------------------
    // History
    // ----------------------------------------------------------------

    public void undo() {
        List<CellRef> restored = history.undo();
        logger.debug("Undo restored {} cells", restored.size());
    }

    public void redo() {
        List<CellRef> restored = history.redo();
        logger.debug("Redo restored {} cells", restored.size());
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    /**
     * Forgets every recorded command, e.g. after bulk-loading a sheet.
     */
    public void clearHistory() {
        history.clear();
    }

    // ----------------------------------------------------------------
    // Range operations
    // ----------------------------------------------------------------

    public void copy(CellRange range) {
        rangeOperations.copy(range);
    }

    public void cut(CellRange range) {
        rangeOperations.cut(range);
    }

    public void paste(CellRef topLeft) {
        rangeOperations.paste(topLeft);
    }

    public void autofill(CellRange source, CellRef extent) {
        rangeOperations.autofill(source, extent);
    }

    public void sort(CellRange range, SortDirection direction) {
        rangeOperations.sort(range, direction);
    }

    // ----------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------

    public CellView getCell(int row, int col) {
        return getCell(toRef(row, col));
    }

    public CellView getCell(String label) {
        return getCell(cellAt(label));
    }

    public CellView getCell(CellRef ref) {
        grid.checkBounds(ref);
        Cell cell = grid.peek(ref);
        if (cell == null) {
            return new CellView(ref, 0, CellError.NONE, "");
        }
        return new CellView(ref, cell.getValue(), cell.getError(), cell.getFormulaText());
    }

    /**
     * Every cell holding a formula, a non-zero value, an error or an edge, in row-major order.
     */
    public Map<CellRef, CellView> storedCells() {
        Map<CellRef, CellView> views = new TreeMap<>();
        for (Cell cell : grid.storedCells()) {
            views.put(cell.getRef(), new CellView(cell.getRef(), cell.getValue(), cell.getError(), cell.getFormulaText()));
        }
        return views;
    }

    public Set<CellRef> parentsOf(CellRef ref) {
        return graph.parentsOf(ref);
    }

    public Set<CellRef> dependentsOf(CellRef ref) {
        return graph.dependentsOf(ref);
    }

    public Map<CellRef, Set<CellRef>> forwardGraph() {
        return graph.forwardGraph();
    }

    public Map<CellRef, Set<CellRef>> reverseGraph() {
        return graph.reverseGraph();
    }

    // ----------------------------------------------------------------
    // Argument parsing for front ends
    // ----------------------------------------------------------------

    /**
     * Resolves a label such as "B7" against this grid.
     *
     * @throws InvalidRangeException if the label is malformed or out of bounds
     */
    public CellRef cellAt(String label) {
        return CellReferenceParser.parseCell(label, grid.getRows(), grid.getCols())
                .orElseThrow(() -> new InvalidRangeException("Invalid cell reference: " + label));
    }

    /**
     * Resolves a range such as "A1:C3" against this grid.
     *
     * @throws InvalidRangeException if the range is malformed, reversed or out of bounds
     */
    public CellRange rangeAt(String text) {
        return CellReferenceParser.parseRange(text, grid.getRows(), grid.getCols())
                .orElseThrow(() -> new InvalidRangeException("Invalid range: " + text));
    }

    private static CellRef toRef(int row, int col) {
        if (row < 0 || col < 0) {
            throw new InvalidRangeException("Negative cell coordinate: " + row + "," + col);
        }
        return new CellRef(row, col);
    }
}
