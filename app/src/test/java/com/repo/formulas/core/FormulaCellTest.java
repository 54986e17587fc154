package com.repo.formulas.core;

import com.repo.formulas.parser.CellAddress;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FormulaCellTest {

    @Test
    void testFullAddress() {
        assertEquals("Sheet1!B7", new FormulaCell("Sheet1", "B7", "=1").fullAddress());
        assertEquals("'Q1 Sales'!A1", new FormulaCell("Q1 Sales", "A1", "=1").fullAddress());
        assertEquals("A1", new FormulaCell(null, "A1", "=1").fullAddress());
    }

    @Test
    void testQuotedAddressRoundTripsThroughParse() {
        FormulaCell cell = new FormulaCell("Bob's Data", "C3", "=1");
        assertEquals(CellAddress.of("Bob's Data", "C", 3), CellAddress.parse(cell.fullAddress()));
    }

    @Test
    void testIssuePreviewIsTruncated() {
        String formula = "=" + "A1+".repeat(60) + "1";
        FormulaIssue issue = FormulaIssue.of("S!A1", formula, "problem");

        assertEquals(FormulaIssue.FORMULA_PREVIEW_LENGTH, issue.formula().length());
        assertEquals("", FormulaIssue.of("S!A1", null, "problem").formula());
    }
}
