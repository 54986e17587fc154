package com.repo.formulas.core;

/**
 * A problem found while analyzing one formula cell.
 */
public record FormulaIssue(
        /** Full cell address */
        String address,

        /** Formula text, cut to {@value #FORMULA_PREVIEW_LENGTH} characters */
        String formula,

        String message) {

    public static final int FORMULA_PREVIEW_LENGTH = 100;

    public static FormulaIssue of(String address, String formula, String message) {
        String preview = formula == null ? "" : formula;
        if (preview.length() > FORMULA_PREVIEW_LENGTH) {
            preview = preview.substring(0, FORMULA_PREVIEW_LENGTH);
        }
        return new FormulaIssue(address, preview, message);
    }
}
