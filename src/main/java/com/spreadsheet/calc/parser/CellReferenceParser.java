package com.spreadsheet.calc.parser;

import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.CellRef;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses cell labels ("A1", "ZZ999") and ranges ("A1:C4") against grid bounds.
 * Labels are upper-case column letters followed by a 1-based row number.
 */
public final class CellReferenceParser {

    // Three letters already reach column ZZZ, the widest grid allowed
    private static final Pattern CELL_PATTERN = Pattern.compile("^([A-Z]{1,3})([0-9]{1,9})$");

    private CellReferenceParser() {
    }

    /**
     * Returns the 0-based coordinate for {@code label}, or empty if the label is
     * malformed or falls outside a {@code rows} x {@code cols} grid.
     */
    public static Optional<CellRef> parseCell(String label, int rows, int cols) {
        if (label == null) {
            return Optional.empty();
        }
        Matcher matcher = CELL_PATTERN.matcher(label.trim().toUpperCase());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int col = 0;
        for (char c : matcher.group(1).toCharArray()) {
            col = col * 26 + (c - 'A' + 1);
        }
        int row = Integer.parseInt(matcher.group(2));
        if (row < 1 || row > rows || col > cols) {
            return Optional.empty();
        }
        return Optional.of(new CellRef(row - 1, col - 1));
    }

    /**
     * Parses "TL:BR". The top-left corner must not be below or right of the bottom-right one.
     */
    public static Optional<CellRange> parseRange(String text, int rows, int cols) {
        if (text == null) {
            return Optional.empty();
        }
        int colon = text.indexOf(':');
        if (colon < 0 || colon != text.lastIndexOf(':')) {
            return Optional.empty();
        }
        Optional<CellRef> topLeft = parseCell(text.substring(0, colon), rows, cols);
        Optional<CellRef> bottomRight = parseCell(text.substring(colon + 1), rows, cols);
        if (topLeft.isEmpty() || bottomRight.isEmpty()) {
            return Optional.empty();
        }
        CellRef tl = topLeft.get();
        CellRef br = bottomRight.get();
        if (tl.getRow() > br.getRow() || tl.getCol() > br.getCol()) {
            return Optional.empty();
        }
        return Optional.of(new CellRange(tl, br));
    }
}
