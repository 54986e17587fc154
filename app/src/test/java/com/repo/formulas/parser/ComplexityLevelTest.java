package com.repo.formulas.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityLevelTest {

    @Test
    void testBandBoundaries() {
        assertEquals(ComplexityLevel.SIMPLE, ComplexityLevel.fromScore(0));
        assertEquals(ComplexityLevel.SIMPLE, ComplexityLevel.fromScore(25));
        assertEquals(ComplexityLevel.MODERATE, ComplexityLevel.fromScore(25.01));
        assertEquals(ComplexityLevel.MODERATE, ComplexityLevel.fromScore(50));
        assertEquals(ComplexityLevel.COMPLEX, ComplexityLevel.fromScore(75));
        assertEquals(ComplexityLevel.CRITICAL, ComplexityLevel.fromScore(75.5));
        assertEquals("critical", ComplexityLevel.CRITICAL.label());
    }
}
