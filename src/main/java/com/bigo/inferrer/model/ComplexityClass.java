package com.bigo.inferrer.model;

import java.util.Locale;

/**
 * Canonical Big-O classes, declared in increasing order of growth.
 * {@link #UNKNOWN} is the top element: it compares above every real class so
 * that sums and maxima containing it stay Unknown.
 */
public enum ComplexityClass {
    CONSTANT("O(1)"),
    LOGARITHMIC("O(log n)"),
    SQUARE_ROOT("O(sqrt n)"),
    LINEAR("O(n)"),
    LINEARITHMIC("O(n log n)"),
    QUADRATIC("O(n^2)"),
    CUBIC("O(n^3)"),
    POLYNOMIAL("O(n^k)"),
    EXPONENTIAL("O(2^n)"),
    FACTORIAL("O(n!)"),
    UNKNOWN("Unknown");

    private final String notation;

    ComplexityClass(String notation) {
        this.notation = notation;
    }

    public String getNotation() {
        return notation;
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    /**
     * The larger of two classes; equal classes never escalate.
     */
    public static ComplexityClass max(ComplexityClass a, ComplexityClass b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public GrowthOrder toOrder() {
        return GrowthOrder.fromClass(this);
    }

    /**
     * Parses Big-O notation such as {@code "O(n log n)"}, {@code "O(n^2)"} or
     * {@code "O(n²)"}. Whitespace and case are ignored.
     *
     * @param text The notation to parse
     * @return The matching class
     * @throws IllegalArgumentException If the text names no known class
     */
    public static ComplexityClass fromNotation(String text) {
        String normalized = normalize(text);
        for (ComplexityClass complexityClass : values()) {
            if (normalize(complexityClass.notation).equals(normalized)) {
                return complexityClass;
            }
        }
        switch (normalized) {
            case "o(√n)":
            case "o(sqrt(n))":
                return SQUARE_ROOT;
            case "o(n²)":
                return QUADRATIC;
            case "o(n³)":
                return CUBIC;
            case "o(2ⁿ)":
                return EXPONENTIAL;
            default:
                throw new IllegalArgumentException("Unrecognized complexity notation: " + text);
        }
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return notation;
    }
}
