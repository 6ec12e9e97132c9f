package com.spreadsheet.calc.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Enumerates sort orders for the sort command:
 * ASCENDING, DESCENDING.
 */
public enum SortDirection {
    ASCENDING,
    DESCENDING;

    /**
     * Allows lenient input.
     * For example, "asc", "a", "Ascending" -> ASCENDING; "desc", "d" -> DESCENDING.
     */
    @JsonCreator
    public static SortDirection fromValue(String value) {
        String normalized = value.trim().toUpperCase();
        if (normalized.equals("A") || normalized.equals("ASC")) {
            return ASCENDING;
        }
        if (normalized.equals("D") || normalized.equals("DESC")) {
            return DESCENDING;
        }
        return SortDirection.valueOf(normalized);
    }
}
