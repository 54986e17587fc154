package com.repo.formulas.parser;

/**
 * How a cell reference is anchored, derived from the {@code $} markers in
 * front of its column and row.
 */
public enum ReferenceType {
    /** A1 */
    RELATIVE,
    /** $A$1 */
    ABSOLUTE,
    /** $A1 */
    MIXED_COLUMN,
    /** A$1 */
    MIXED_ROW;

    public static ReferenceType of(boolean absoluteColumn, boolean absoluteRow) {
        if (absoluteColumn && absoluteRow)
            return ABSOLUTE;
        if (absoluteColumn)
            return MIXED_COLUMN;
        if (absoluteRow)
            return MIXED_ROW;
        return RELATIVE;
    }

    public boolean isColumnAbsolute() {
        return this == ABSOLUTE || this == MIXED_COLUMN;
    }

    public boolean isRowAbsolute() {
        return this == ABSOLUTE || this == MIXED_ROW;
    }
}
