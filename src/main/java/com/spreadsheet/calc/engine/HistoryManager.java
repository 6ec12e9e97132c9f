package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.exceptions.NoHistoryException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Undo/redo over cell snapshots.
 *
 * Every mutating command records the prior state of exactly the cells it is about to
 * change and commits it before mutating. Undo restores those cells, rebuilds the
 * inverse dependents edges from the restored parent sets and re-propagates from every
 * restored cell; the state it replaced goes to the redo stack. Committing a new
 * snapshot discards the redo stack (no branching history).
 */
public class HistoryManager {

    private static final Logger logger = LoggerFactory.getLogger(HistoryManager.class);

    private final Grid grid;
    private final DependencyGraph graph;
    private final int limit;

    // Most recent first
    private final Deque<Snapshot> undoStack = new ArrayDeque<>();
    private final Deque<Snapshot> redoStack = new ArrayDeque<>();

    public HistoryManager(Grid grid, DependencyGraph graph, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be positive, got " + limit);
        }
        this.grid = grid;
        this.graph = graph;
        this.limit = limit;
    }

    /**
     * Captures the current state of {@code refs} without changing anything.
     */
    public Snapshot recordBefore(String command, Collection<CellRef> refs) {
        List<CellState> states = new ArrayList<>(refs.size());
        for (CellRef ref : new LinkedHashSet<>(refs)) {
            Cell cell = grid.peek(ref);
            states.add(cell == null ? CellState.blank(ref) : CellState.of(cell));
        }
        return new Snapshot(command, states);
    }

    public void commit(Snapshot snapshot) {
        pushBounded(undoStack, snapshot);
        redoStack.clear();
        logger.debug("Recorded '{}' ({} cells), undo depth {}", snapshot.getCommand(), snapshot.size(), undoStack.size());
    }

    /**
     * Reverts the most recent command.
     *
     * @return the restored cells
     * @throws NoHistoryException if there is nothing to undo
     */
    public List<CellRef> undo() {
        if (undoStack.isEmpty()) {
            throw new NoHistoryException("Nothing to undo");
        }
        Snapshot snapshot = undoStack.pop();
        redoStack.push(recordBefore(snapshot.getCommand(), snapshot.refs()));
        restore(snapshot);
        logger.debug("Undid '{}'", snapshot.getCommand());
        return snapshot.refs();
    }

    /**
     * Re-applies the most recently undone command.
     *
     * @return the restored cells
     * @throws NoHistoryException if there is nothing to redo
     */
    public List<CellRef> redo() {
        if (redoStack.isEmpty()) {
            throw new NoHistoryException("Nothing to redo");
        }
        Snapshot snapshot = redoStack.pop();
        pushBounded(undoStack, recordBefore(snapshot.getCommand(), snapshot.refs()));
        restore(snapshot);
        logger.debug("Redid '{}'", snapshot.getCommand());
        return snapshot.refs();
    }

    public boolean canUndo() {
        return !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return !redoStack.isEmpty();
    }

    public void clear() {
        undoStack.clear();
        redoStack.clear();
    }

    public int undoDepth() {
        return undoStack.size();
    }

    public int redoDepth() {
        return redoStack.size();
    }

    private void pushBounded(Deque<Snapshot> stack, Snapshot snapshot) {
        stack.push(snapshot);
        while (stack.size() > limit) {
            Snapshot dropped = stack.pollLast();
            logger.debug("History limit {} reached, dropped '{}'", limit, dropped.getCommand());
        }
    }

    private void restore(Snapshot snapshot) {
        // All touched cells are detached before any parent set is restored
        for (CellState state : snapshot.getStates()) {
            graph.detach(state.getRef());
        }
        for (CellState state : snapshot.getStates()) {
            state.applyTo(grid.getCell(state.getRef()));
        }
        for (CellState state : snapshot.getStates()) {
            graph.attach(state.getRef());
        }
        graph.propagate(snapshot.refs());
        snapshot.refs().forEach(grid::release);
    }
}
