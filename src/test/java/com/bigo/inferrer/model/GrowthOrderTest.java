package com.bigo.inferrer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GrowthOrderTest {

    @Test
    void productsAddExponents() {
        assertEquals(GrowthOrder.LINEARITHMIC, GrowthOrder.LINEAR.times(GrowthOrder.LOGARITHMIC));
        assertEquals(GrowthOrder.QUADRATIC, GrowthOrder.LINEAR.times(GrowthOrder.LINEAR));
        assertEquals(GrowthOrder.LINEAR, GrowthOrder.CONSTANT.times(GrowthOrder.LINEAR));
        assertEquals(GrowthOrder.polynomial(2, 2), GrowthOrder.LINEARITHMIC.times(GrowthOrder.LINEARITHMIC));
    }

    @Test
    void fasterFamiliesAbsorbPolynomialFactors() {
        assertEquals(GrowthOrder.EXPONENTIAL, GrowthOrder.EXPONENTIAL.times(GrowthOrder.QUADRATIC));
        assertEquals(GrowthOrder.FACTORIAL, GrowthOrder.EXPONENTIAL.times(GrowthOrder.FACTORIAL));
        assertTrue(GrowthOrder.UNKNOWN.times(GrowthOrder.CONSTANT).isUnknown());
        assertTrue(GrowthOrder.FACTORIAL.max(GrowthOrder.UNKNOWN).isUnknown());
    }

    @Test
    void maxKeepsTheDominantOrder() {
        assertEquals(GrowthOrder.QUADRATIC, GrowthOrder.LINEARITHMIC.max(GrowthOrder.QUADRATIC));
        assertEquals(GrowthOrder.LINEAR, GrowthOrder.LINEAR.max(GrowthOrder.SQUARE_ROOT));
        assertSame(GrowthOrder.LINEAR, GrowthOrder.LINEAR.max(GrowthOrder.polynomial(1, 0)));
    }

    @Test
    void roundsUpToCanonicalClasses() {
        assertEquals(ComplexityClass.CONSTANT, GrowthOrder.CONSTANT.toComplexityClass());
        assertEquals(ComplexityClass.LOGARITHMIC, GrowthOrder.LOGARITHMIC.toComplexityClass());
        assertEquals(ComplexityClass.SQUARE_ROOT, GrowthOrder.polynomial(0, 2).toComplexityClass());
        assertEquals(ComplexityClass.LINEARITHMIC, GrowthOrder.polynomial(1, 1).toComplexityClass());
        assertEquals(ComplexityClass.QUADRATIC, GrowthOrder.polynomial(1, 2).toComplexityClass());
        assertEquals(ComplexityClass.QUADRATIC, GrowthOrder.polynomial(1.58, 0).toComplexityClass());
        assertEquals(ComplexityClass.CUBIC, GrowthOrder.polynomial(2, 1).toComplexityClass());
        assertEquals(ComplexityClass.POLYNOMIAL, GrowthOrder.polynomial(4, 0).toComplexityClass());
        assertEquals(ComplexityClass.FACTORIAL, GrowthOrder.FACTORIAL.toComplexityClass());
        assertEquals(ComplexityClass.UNKNOWN, GrowthOrder.UNKNOWN.toComplexityClass());
    }

    @Test
    void rendersExactNotation() {
        assertEquals("O(1)", GrowthOrder.CONSTANT.toNotation());
        assertEquals("O(sqrt n)", GrowthOrder.SQUARE_ROOT.toNotation());
        assertEquals("O(n log n)", GrowthOrder.LINEARITHMIC.toNotation());
        assertEquals("O(n^2 log n)", GrowthOrder.polynomial(2, 1).toNotation());
        assertEquals("O(log^2 n)", GrowthOrder.polynomial(0, 2).toNotation());
        assertEquals("O(n^1.58)", GrowthOrder.polynomial(1.58496, 0).toNotation());
        assertEquals("O(2^n)", GrowthOrder.EXPONENTIAL.toNotation());
        assertEquals("Unknown", GrowthOrder.UNKNOWN.toNotation());
    }

    @Test
    void ordersFamiliesBeforeDegrees() {
        assertTrue(GrowthOrder.polynomial(10, 3).compareTo(GrowthOrder.EXPONENTIAL) < 0);
        assertTrue(GrowthOrder.EXPONENTIAL.compareTo(GrowthOrder.FACTORIAL) < 0);
        assertTrue(GrowthOrder.FACTORIAL.compareTo(GrowthOrder.UNKNOWN) < 0);
        assertTrue(GrowthOrder.LINEAR.compareTo(GrowthOrder.LINEARITHMIC) < 0);
    }

    @Test
    void classRoundTripsThroughItsOrder() {
        for (ComplexityClass complexityClass : ComplexityClass.values()) {
            assertEquals(complexityClass, GrowthOrder.fromClass(complexityClass).toComplexityClass());
        }
    }

    @Test
    void rejectsNegativeDegrees() {
        assertThrows(IllegalArgumentException.class, () -> GrowthOrder.polynomial(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> GrowthOrder.polynomial(1, -1));
    }
}
