package com.bigo.inferrer.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityClassTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "O(1)        | CONSTANT",
            "o(LOG N)    | LOGARITHMIC",
            "O(n log n)  | LINEARITHMIC",
            "O(nlogn)    | LINEARITHMIC",
            "O(n^2)      | QUADRATIC",
            "O(n²)       | QUADRATIC",
            "O(√n)       | SQUARE_ROOT",
            "O(sqrt(n))  | SQUARE_ROOT",
            "O(n!)       | FACTORIAL",
            "Unknown     | UNKNOWN"
    })
    void parsesNotation(String notation, ComplexityClass expected) {
        assertEquals(expected, ComplexityClass.fromNotation(notation));
    }

    @Test
    void rejectsUnrecognizedNotation() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ComplexityClass.fromNotation("O(n^n)"));
        assertTrue(e.getMessage().contains("O(n^n)"));
    }

    @Test
    void unknownIsTheTopElement() {
        for (ComplexityClass complexityClass : ComplexityClass.values()) {
            assertEquals(ComplexityClass.UNKNOWN, ComplexityClass.max(complexityClass, ComplexityClass.UNKNOWN));
        }
        assertTrue(ComplexityClass.UNKNOWN.isUnknown());
        assertFalse(ComplexityClass.FACTORIAL.isUnknown());
    }

    @Test
    void maxNeverEscalatesEqualClasses() {
        assertEquals(ComplexityClass.LINEAR, ComplexityClass.max(ComplexityClass.LINEAR, ComplexityClass.LINEAR));
        assertEquals(ComplexityClass.QUADRATIC, ComplexityClass.max(ComplexityClass.LINEAR, ComplexityClass.QUADRATIC));
    }

    @Test
    void declaredInIncreasingOrder() {
        assertTrue(ComplexityClass.CONSTANT.compareTo(ComplexityClass.LOGARITHMIC) < 0);
        assertTrue(ComplexityClass.LOGARITHMIC.compareTo(ComplexityClass.SQUARE_ROOT) < 0);
        assertTrue(ComplexityClass.LINEARITHMIC.compareTo(ComplexityClass.QUADRATIC) < 0);
        assertTrue(ComplexityClass.POLYNOMIAL.compareTo(ComplexityClass.EXPONENTIAL) < 0);
        assertEquals("O(n log n)", ComplexityClass.LINEARITHMIC.toString());
    }
}
