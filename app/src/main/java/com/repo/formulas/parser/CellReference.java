package com.repo.formulas.parser;

/**
 * A cell reference found in formula text.
 */
public record CellReference(
        CellAddress address,
        ReferenceType referenceType,

        /** The text the reference was parsed from, e.g. "Sheet1!$A$1" */
        String originalText,

        /** Offset of {@code originalText} in the normalized formula */
        int position) {

    public boolean isExternal() {
        return address.isExternal();
    }

    public boolean isSheetQualified() {
        return address.sheet() != null;
    }

    /**
     * Resolve the target against the sheet that owns the formula.
     * Unqualified references inherit {@code currentSheet}.
     */
    public CellAddress resolve(String currentSheet) {
        return address.withDefaultSheet(currentSheet);
    }
}
