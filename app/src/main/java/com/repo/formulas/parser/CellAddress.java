package com.repo.formulas.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A fully or partially qualified cell position.
 * Workbook and sheet are optional; a workbook makes the address external.
 */
public record CellAddress(
        /** External workbook name, e.g. "Budget.xlsx"; null for the current workbook */
        String workbook,

        /** Sheet name without quotes; null when unqualified */
        String sheet,

        /** Column letters, A through ZZZ */
        String column,

        /** 1-based row */
        int row) {

    public static final int MAX_ROW = 1_048_576;

    private static final Pattern COLUMN = Pattern.compile("[A-Z]{1,3}");

    private static final Pattern CELL = Pattern.compile("^\\$?([A-Z]{1,3})\\$?(\\d{1,7})$");

    public CellAddress {
        if (column == null || !COLUMN.matcher(column).matches()) {
            throw new IllegalArgumentException("Invalid column: " + column);
        }
        if (row < 1 || row > MAX_ROW) {
            throw new IllegalArgumentException("Row out of range (1.." + MAX_ROW + "): " + row);
        }
        if (workbook != null && workbook.isBlank()) {
            workbook = null;
        }
        if (sheet != null && sheet.isBlank()) {
            sheet = null;
        }
    }

    public static CellAddress of(String sheet, String column, int row) {
        return new CellAddress(null, sheet, column, row);
    }

    /**
     * Parse "A1", "Sheet1!A1", "'My Sheet'!$B$2" or "[Book.xlsx]Sheet1!A1".
     * Absolute markers are accepted and dropped.
     *
     * @throws IllegalArgumentException if the text is not a cell address
     */
    public static CellAddress parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Address is empty");
        }
        String rest = text.trim();
        String workbook = null;
        if (rest.startsWith("[")) {
            int close = rest.indexOf(']');
            if (close < 0) {
                throw new IllegalArgumentException("Unclosed workbook bracket: " + text);
            }
            workbook = rest.substring(1, close);
            rest = rest.substring(close + 1);
        }

        String sheet = null;
        int bang = rest.lastIndexOf('!');
        if (bang >= 0) {
            sheet = rest.substring(0, bang);
            if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
                sheet = sheet.substring(1, sheet.length() - 1).replace("''", "'");
            }
            rest = rest.substring(bang + 1);
        }

        Matcher m = CELL.matcher(rest);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a cell address: " + text);
        }
        return new CellAddress(workbook, sheet, m.group(1), Integer.parseInt(m.group(2)));
    }

    public boolean isExternal() {
        return workbook != null;
    }

    /**
     * Same cell on the given sheet, unless this address already names one.
     */
    public CellAddress withDefaultSheet(String defaultSheet) {
        if (sheet != null || defaultSheet == null) {
            return this;
        }
        return new CellAddress(workbook, defaultSheet, column, row);
    }

    public String coordinate() {
        return column + row;
    }

    /**
     * Canonical form used for interning and display: {@code [Book]Sheet!A1}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (workbook != null) {
            sb.append('[').append(workbook).append(']');
        }
        if (sheet != null) {
            sb.append(sheet).append('!');
        }
        return sb.append(column).append(row).toString();
    }
}
