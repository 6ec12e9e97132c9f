package com.spreadsheet.calc.models;

import com.spreadsheet.calc.engine.SpreadsheetEngine;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One hosted spreadsheet:
 * - a unique ID
 * - the engine that owns its cells, dependency graph, history and copy buffer
 * - a read/write lock, since the engine itself is single-threaded
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final SpreadsheetEngine engine;

    // Write lock for every command that may mutate the engine (copy included, it replaces the buffer)
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(SpreadsheetEngine engine) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.engine = engine;
    }

    public long getId() {
        return id;
    }

    public SpreadsheetEngine getEngine() {
        return engine;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
