package com.repo.formulas.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellAddressTest {

    @Test
    void testParseForms() {
        CellAddress bare = CellAddress.parse("B12");
        assertNull(bare.sheet());
        assertEquals("B", bare.column());
        assertEquals(12, bare.row());

        CellAddress qualified = CellAddress.parse("Sheet1!$C$3");
        assertEquals("Sheet1", qualified.sheet());
        assertEquals("C3", qualified.coordinate());

        CellAddress quoted = CellAddress.parse("'Bob''s Sheet'!A1");
        assertEquals("Bob's Sheet", quoted.sheet());

        CellAddress external = CellAddress.parse("[Budget.xlsx]Sheet1!A1");
        assertTrue(external.isExternal());
        assertEquals("Budget.xlsx", external.workbook());
        assertEquals("[Budget.xlsx]Sheet1!A1", external.toString());
    }

    @Test
    void testMalformedAddressesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse(""));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("1A"));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("ABCD1"));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("Sheet1!A0"));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.parse("[Book.xlsx Sheet1!A1"));
        assertThrows(IllegalArgumentException.class, () -> CellAddress.of("Sheet1", "A", CellAddress.MAX_ROW + 1));
    }

    @Test
    void testMaxRowIsAccepted() {
        assertEquals(CellAddress.MAX_ROW, CellAddress.parse("XFD1048576").row());
    }

    @Test
    void testDefaultSheet() {
        assertEquals(CellAddress.of("Main", "A", 1), CellAddress.parse("A1").withDefaultSheet("Main"));
        assertEquals(CellAddress.of("Other", "A", 1), CellAddress.parse("Other!A1").withDefaultSheet("Main"));
    }

    @Test
    void testEqualityIgnoresAbsoluteMarkers() {
        assertEquals(CellAddress.parse("Sheet1!A1"), CellAddress.parse("Sheet1!$A$1"));
        assertNotEquals(CellAddress.parse("Sheet1!A1"), CellAddress.parse("Sheet2!A1"));
    }
}
