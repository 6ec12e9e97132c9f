package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Parent/dependent edges between cells, cycle detection and recomputation.
 *
 * Edges live on the cells themselves as sets of coordinates:
 * for every P in A.parents, A is in P.dependents, and vice versa.
 * Only this class changes edge sets, which keeps them exact inverses.
 */
public class DependencyGraph {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraph.class);

    private enum Mark { IN_PROGRESS, DONE }

    private final Grid grid;
    private final FormulaEvaluator evaluator;

    public DependencyGraph(Grid grid, FormulaEvaluator evaluator) {
        this.grid = grid;
        this.evaluator = evaluator;
    }

    // ----------------------------------------------------------------
    // Cycle detection
    // ----------------------------------------------------------------

    /**
     * Throws if giving {@code target} the parents {@code newParents} would close a cycle.
     * Runs a three-colour depth-first search from {@code target} over the graph as it
     * would look after the change: current dependents edges, without target's stale
     * incoming edges, plus an edge p -> target for every new parent p.
     * Nothing is modified.
     */
    public void checkAcyclic(CellRef target, Set<CellRef> newParents) {
        if (newParents.contains(target)) {
            throw new CircularReferenceException(target, target + " cannot reference itself");
        }
        Map<CellRef, Mark> marks = new HashMap<>();
        Deque<Map.Entry<CellRef, Iterator<CellRef>>> stack = new ArrayDeque<>();

        marks.put(target, Mark.IN_PROGRESS);
        stack.push(Map.entry(target, tentativeDependents(target, target, newParents).iterator()));

        while (!stack.isEmpty()) {
            Map.Entry<CellRef, Iterator<CellRef>> frame = stack.peek();
            Iterator<CellRef> children = frame.getValue();
            if (!children.hasNext()) {
                marks.put(frame.getKey(), Mark.DONE);
                stack.pop();
                continue;
            }
            CellRef child = children.next();
            Mark mark = marks.get(child);
            if (mark == Mark.IN_PROGRESS) {
                throw new CircularReferenceException(target,
                        "Formula in " + target + " would create a cycle through " + frame.getKey());
            }
            if (mark == null) {
                marks.put(child, Mark.IN_PROGRESS);
                stack.push(Map.entry(child, tentativeDependents(child, target, newParents).iterator()));
            }
        }
    }

    private Set<CellRef> tentativeDependents(CellRef node, CellRef target, Set<CellRef> newParents) {
        Set<CellRef> out = new TreeSet<>(dependentsOf(node));
        if (newParents.contains(node)) {
            out.add(target);
        } else {
            out.remove(target);
        }
        return out;
    }

    // ----------------------------------------------------------------
    // Edge maintenance
    // ----------------------------------------------------------------

    /**
     * Replaces the parents of {@code target}, keeping the dependents sets of old and new
     * parents in step. Callers must have run {@link #checkAcyclic} first.
     */
    public void rewire(CellRef target, Set<CellRef> newParents) {
        detach(target);
        grid.getCell(target).getParents().addAll(newParents);
        attach(target);
    }

    /**
     * Removes {@code target} from its parents' dependents and empties its parent set.
     * A parent left blank is dropped from the grid.
     */
    public void detach(CellRef target) {
        Cell cell = grid.peek(target);
        if (cell == null) {
            return;
        }
        for (CellRef parent : cell.getParents()) {
            Cell parentCell = grid.peek(parent);
            if (parentCell != null) {
                parentCell.getDependents().remove(target);
                grid.release(parent);
            }
        }
        cell.getParents().clear();
    }

    /**
     * Registers {@code target} as a dependent of every cell in its parent set.
     */
    public void attach(CellRef target) {
        Cell cell = grid.peek(target);
        if (cell == null) {
            return;
        }
        for (CellRef parent : cell.getParents()) {
            grid.getCell(parent).getDependents().add(target);
        }
    }

    // ----------------------------------------------------------------
    // Propagation
    // ----------------------------------------------------------------

    public void propagate(CellRef root) {
        propagate(Collections.singleton(root));
    }

    /**
     * Re-evaluates every formula cell reachable from {@code roots} through dependents
     * edges (roots included), each exactly once, parents before dependents.
     */
    public void propagate(Collection<CellRef> roots) {
        Set<CellRef> dirty = dirtySet(roots);
        List<CellRef> order = evaluationOrder(dirty);
        int evaluated = 0;
        for (CellRef ref : order) {
            Cell cell = grid.peek(ref);
            if (cell != null && cell.isFormula()) {
                evaluator.evaluate(cell);
                evaluated++;
            }
        }
        logger.debug("Propagated from {} root(s): {} dirty, {} formulas evaluated", roots.size(), dirty.size(), evaluated);
    }

    /**
     * All cells transitively reachable from {@code roots} via dependents, roots included.
     */
    public Set<CellRef> dirtySet(Collection<CellRef> roots) {
        Set<CellRef> visited = new HashSet<>(roots);
        Deque<CellRef> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            CellRef current = stack.pop();
            for (CellRef dependent : dependentsOf(current)) {
                if (visited.add(dependent)) {
                    stack.push(dependent);
                }
            }
        }
        return visited;
    }

    /**
     * Topological order of {@code dirty} with edges restricted to the set.
     * Among cells that are ready at the same time the row-major smallest goes first.
     */
    public List<CellRef> evaluationOrder(Set<CellRef> dirty) {
        Map<CellRef, Integer> pendingParents = new HashMap<>();
        PriorityQueue<CellRef> ready = new PriorityQueue<>();
        for (CellRef ref : dirty) {
            int count = 0;
            for (CellRef parent : parentsOf(ref)) {
                if (dirty.contains(parent)) {
                    count++;
                }
            }
            pendingParents.put(ref, count);
            if (count == 0) {
                ready.add(ref);
            }
        }

        List<CellRef> order = new ArrayList<>(dirty.size());
        while (!ready.isEmpty()) {
            CellRef current = ready.poll();
            order.add(current);
            for (CellRef dependent : dependentsOf(current)) {
                Integer remaining = pendingParents.get(dependent);
                if (remaining == null) {
                    continue;
                }
                pendingParents.put(dependent, remaining - 1);
                if (remaining - 1 == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != dirty.size()) {
            throw new IllegalStateException("Dependency graph contains a cycle among " + dirty.size() + " dirty cells");
        }
        return order;
    }

    // ----------------------------------------------------------------
    // Read-only views
    // ----------------------------------------------------------------

    public Set<CellRef> parentsOf(CellRef ref) {
        Cell cell = grid.peek(ref);
        return cell == null ? Collections.emptySet() : Collections.unmodifiableSet(cell.getParents());
    }

    public Set<CellRef> dependentsOf(CellRef ref) {
        Cell cell = grid.peek(ref);
        return cell == null ? Collections.emptySet() : Collections.unmodifiableSet(cell.getDependents());
    }

    /**
     * Forward adjacency: cell -> cells it references, for every cell taking part in an edge.
     */
    public Map<CellRef, Set<CellRef>> forwardGraph() {
        Map<CellRef, Set<CellRef>> graph = new TreeMap<>();
        for (Cell cell : grid.storedCells()) {
            if (!cell.getParents().isEmpty() || !cell.getDependents().isEmpty()) {
                graph.put(cell.getRef(), Collections.unmodifiableSet(new TreeSet<>(cell.getParents())));
            }
        }
        return graph;
    }

    /**
     * Reverse adjacency: cell -> cells that reference it, for every cell taking part in an edge.
     */
    public Map<CellRef, Set<CellRef>> reverseGraph() {
        Map<CellRef, Set<CellRef>> graph = new TreeMap<>();
        for (Cell cell : grid.storedCells()) {
            if (!cell.getParents().isEmpty() || !cell.getDependents().isEmpty()) {
                graph.put(cell.getRef(), Collections.unmodifiableSet(new TreeSet<>(cell.getDependents())));
            }
        }
        return graph;
    }
}
