package com.spreadsheet.calc.io;

import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvException;
import com.spreadsheet.calc.engine.SpreadsheetEngine;
import com.spreadsheet.calc.exceptions.FormulaParseException;
import com.spreadsheet.calc.exceptions.InvalidDimensionsException;
import com.spreadsheet.calc.models.CellRef;
import com.spreadsheet.calc.parser.FormulaParser;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and loads the displayed values of a sheet as CSV.
 * One record per grid row, one field per column. Error cells are written as 0,
 * and formulas are not kept: a loaded sheet holds literals only.
 */
public final class ValuesCsvCodec {

    private ValuesCsvCodec() {
    }

    public static String export(SpreadsheetEngine engine) {
        StringWriter out = new StringWriter();
        try (CSVWriter writer = new CSVWriter(out)) {
            String[] fields = new String[engine.getCols()];
            for (int row = 0; row < engine.getRows(); row++) {
                for (int col = 0; col < engine.getCols(); col++) {
                    Integer value = engine.getCell(CellRef.of(row, col)).getValue();
                    fields[col] = Integer.toString(value == null ? 0 : value);
                }
                // Plain integers never need quoting
                writer.writeNext(fields, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
        return out.toString();
    }

    public static SpreadsheetEngine importValues(String text) {
        return importValues(text, SpreadsheetEngine.DEFAULT_HISTORY_LIMIT, SpreadsheetEngine.DEFAULT_SLEEP_UNIT);
    }

    /**
     * Builds a new sheet sized to {@code text}: one row per record, as many columns as the
     * widest record. Short records are padded with 0. The returned sheet has no undo history.
     *
     * @throws FormulaParseException       if the text is not valid CSV or a field is not a signed integer
     * @throws InvalidDimensionsException  if the text is empty or larger than a grid allows
     */
    public static SpreadsheetEngine importValues(String text, int historyLimit, Duration sleepUnit) {
        List<String[]> records = readRecords(text);
        int width = 0;
        for (String[] fields : records) {
            width = Math.max(width, fields.length);
        }
        if (records.isEmpty() || width == 0) {
            throw new InvalidDimensionsException("Cannot load a sheet from empty text");
        }

        // Validate every field before building anything
        int[][] values = new int[records.size()][width];
        for (int row = 0; row < records.size(); row++) {
            String[] fields = records.get(row);
            for (int col = 0; col < fields.length; col++) {
                try {
                    values[row][col] = FormulaParser.parseLiteral(fields[col]);
                } catch (FormulaParseException e) {
                    throw new FormulaParseException("Line " + (row + 1) + ", field " + (col + 1) + ": " + e.getMessage());
                }
            }
        }

        SpreadsheetEngine engine = new SpreadsheetEngine(records.size(), width, historyLimit, sleepUnit);
        for (int row = 0; row < values.length; row++) {
            for (int col = 0; col < width; col++) {
                if (values[row][col] != 0) {
                    engine.setCell(row, col, Integer.toString(values[row][col]));
                }
            }
        }
        engine.clearHistory();
        return engine;
    }

    private static List<String[]> readRecords(String text) {
        List<String[]> raw;
        try (CSVReader reader = new CSVReader(new StringReader(text == null ? "" : text))) {
            raw = reader.readAll();
        } catch (IOException | CsvException e) {
            throw new FormulaParseException("Malformed CSV: " + e.getMessage(), e);
        }

        List<String[]> records = new ArrayList<>(raw.size());
        for (String[] fields : raw) {
            // A blank line inside the text is a row of zeros
            records.add(isBlank(fields) ? new String[0] : fields);
        }
        // Trailing blank lines are not rows
        while (!records.isEmpty() && records.get(records.size() - 1).length == 0) {
            records.remove(records.size() - 1);
        }
        return records;
    }

    private static boolean isBlank(String[] fields) {
        return fields.length == 0 || (fields.length == 1 && fields[0].trim().isEmpty());
    }
}
