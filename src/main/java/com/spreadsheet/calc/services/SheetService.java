package com.spreadsheet.calc.services;

import com.spreadsheet.calc.config.SpreadsheetProperties;
import com.spreadsheet.calc.engine.SpreadsheetEngine;
import com.spreadsheet.calc.exceptions.SheetNotFoundException;
import com.spreadsheet.calc.io.ValuesCsvCodec;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.models.CellView;
import com.spreadsheet.calc.models.Sheet;
import com.spreadsheet.calc.models.SortDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Hosts sheets in memory and runs commands against them.
 * Commands on one sheet are serialized through the sheet's read/write lock;
 * different sheets never block each other.
 */
@Service
public class SheetService {

    private static final Logger logger = LoggerFactory.getLogger(SheetService.class);

    // All sheets live here in memory; nothing is persisted
    private final Map<Long, Sheet> sheets = new ConcurrentHashMap<>();

    private final SpreadsheetProperties properties;

    public SheetService(SpreadsheetProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an empty sheet and returns its ID. Null dimensions fall back to the configured defaults.
     */
    public long createSheet(Integer rows, Integer cols) {
        int r = rows == null ? properties.getDefaultRows() : rows;
        int c = cols == null ? properties.getDefaultCols() : cols;
        Sheet sheet = register(new SpreadsheetEngine(r, c, properties.getHistoryLimit(), properties.getSleepUnit()));
        logger.info("Created sheet {} ({}x{})", sheet.getId(), r, c);
        return sheet.getId();
    }

    /**
     * Retrieves a Sheet by ID. Throws if not found.
     */
    public Sheet getSheet(long sheetId) {
        Sheet sheet = sheets.get(sheetId);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
        return sheet;
    }

    // ----------------------------------------------------------------
    // Commands (write lock)
    // ----------------------------------------------------------------

    public void setCellValue(long sheetId, String label, String rawValue) {
        write(sheetId, "set " + label, engine -> engine.setCell(label, rawValue));
    }

    public void undo(long sheetId) {
        write(sheetId, "undo", SpreadsheetEngine::undo);
    }

    public void redo(long sheetId) {
        write(sheetId, "redo", SpreadsheetEngine::redo);
    }

    // Copy replaces the copy buffer, so it takes the write lock too
    public void copy(long sheetId, String range) {
        write(sheetId, "copy " + range, engine -> engine.copy(engine.rangeAt(range)));
    }

    public void cut(long sheetId, String range) {
        write(sheetId, "cut " + range, engine -> engine.cut(engine.rangeAt(range)));
    }

    public void paste(long sheetId, String label) {
        write(sheetId, "paste " + label, engine -> engine.paste(engine.cellAt(label)));
    }

    public void autofill(long sheetId, String range, String label) {
        write(sheetId, "autofill " + range + " to " + label,
                engine -> engine.autofill(engine.rangeAt(range), engine.cellAt(label)));
    }

    public void sort(long sheetId, String range, SortDirection direction) {
        write(sheetId, "sort " + range + " " + direction, engine -> engine.sort(engine.rangeAt(range), direction));
    }

    /**
     * Creates a sheet holding the values of {@code csv} and returns its ID.
     */
    public long importSheet(String csv) {
        Sheet sheet = register(ValuesCsvCodec.importValues(csv, properties.getHistoryLimit(), properties.getSleepUnit()));
        logger.info("Imported sheet {} ({}x{})", sheet.getId(), sheet.getEngine().getRows(), sheet.getEngine().getCols());
        return sheet.getId();
    }

    // ----------------------------------------------------------------
    // Queries (read lock)
    // ----------------------------------------------------------------

    public CellView getCell(long sheetId, String label) {
        return read(sheetId, engine -> engine.getCell(label));
    }

    /**
     * Returns label -> value for every stored cell, row-major.
     * Cells in an error state map to the error name instead, e.g. { "A1": 5, "B1": "DIVIDE_BY_ZERO" }.
     */
    public Map<String, Object> getSheetData(long sheetId) {
        return read(sheetId, engine -> {
            Map<String, Object> data = new LinkedHashMap<>();
            for (CellView view : engine.storedCells().values()) {
                data.put(view.getLabel(), view.getError().isError() ? view.getError().name() : view.getValue());
            }
            return data;
        });
    }

    public Map<String, Set<String>> getForwardDependencies(long sheetId) {
        return read(sheetId, engine -> toLabels(engine.forwardGraph()));
    }

    public Map<String, Set<String>> getReverseDependencies(long sheetId) {
        return read(sheetId, engine -> toLabels(engine.reverseGraph()));
    }

    public String exportSheet(long sheetId) {
        return read(sheetId, ValuesCsvCodec::export);
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private Sheet register(SpreadsheetEngine engine) {
        Sheet sheet = new Sheet(engine);
        sheets.put(sheet.getId(), sheet);
        return sheet;
    }

    private void write(long sheetId, String command, Consumer<SpreadsheetEngine> action) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().writeLock().lock();
        try {
            action.accept(sheet.getEngine());
            logger.info("Sheet {}: {}", sheetId, command);
        } catch (RuntimeException ex) {
            logger.warn("Sheet {}: rejected {}: {}", sheetId, command, ex.getMessage());
            throw ex; // let the controller handle it
        } finally {
            sheet.getLock().writeLock().unlock();
        }
    }

    private <T> T read(long sheetId, Function<SpreadsheetEngine, T> query) {
        Sheet sheet = getSheet(sheetId);
        sheet.getLock().readLock().lock();
        try {
            return query.apply(sheet.getEngine());
        } finally {
            sheet.getLock().readLock().unlock();
        }
    }

    private static Map<String, Set<String>> toLabels(Map<CellRef, Set<CellRef>> graph) {
        Map<String, Set<String>> labels = new LinkedHashMap<>();
        for (Map.Entry<CellRef, Set<CellRef>> entry : graph.entrySet()) {
            Set<String> targets = new LinkedHashSet<>();
            for (CellRef ref : entry.getValue()) {
                targets.add(ref.toLabel());
            }
            labels.put(entry.getKey().toLabel(), targets);
        }
        return labels;
    }
}
