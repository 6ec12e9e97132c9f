package com.spreadsheet.calc.engine;

import com.spreadsheet.calc.models.CellRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prior state of every cell one command touched, in the order they were recorded.
 */
public final class Snapshot {
    private final String command;
    private final List<CellState> states;

    public Snapshot(String command, List<CellState> states) {
        this.command = command;
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
    }

    /** Short description of the command that produced this snapshot, for logging. */
    public String getCommand() {
        return command;
    }

    public List<CellState> getStates() {
        return states;
    }

    public List<CellRef> refs() {
        List<CellRef> refs = new ArrayList<>(states.size());
        for (CellState state : states) {
            refs.add(state.getRef());
        }
        return refs;
    }

    public int size() {
        return states.size();
    }
}
