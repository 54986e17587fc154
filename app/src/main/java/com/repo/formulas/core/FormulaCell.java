package com.repo.formulas.core;

/**
 * One formula cell handed over by whatever reads the workbook.
 */
public record FormulaCell(
        /** Owning sheet name */
        String sheet,

        /** Cell coordinate such as "B7" */
        String coordinate,

        /** Formula text, with or without the leading '=' */
        String formula) {

    /**
     * Address in {@code Sheet!A1} form, quoting the sheet name when needed.
     */
    public String fullAddress() {
        if (sheet == null || sheet.isBlank()) {
            return coordinate;
        }
        boolean plain = sheet.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_' || c == '.');
        String name = plain ? sheet : "'" + sheet.replace("'", "''") + "'";
        return name + "!" + coordinate;
    }
}
