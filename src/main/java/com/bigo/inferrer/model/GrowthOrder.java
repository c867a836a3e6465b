package com.bigo.inferrer.model;

import java.util.Objects;

/**
 * Symbolic growth order used while composing costs. Polynomial-logarithmic
 * orders have the form {@code n^degree * log^logPower n}; products add the
 * exponents, which the enum cannot express directly. Exponential absorbs any
 * polynomial factor, factorial absorbs exponential, and Unknown absorbs
 * everything.
 */
public final class GrowthOrder implements Comparable<GrowthOrder> {

    /**
     * Growth families in increasing order; UNKNOWN is the top element.
     */
    public enum Shape {
        POLYNOMIAL, EXPONENTIAL, FACTORIAL, UNKNOWN
    }

    private static final double EPSILON = 1e-9;

    public static final GrowthOrder CONSTANT = polynomial(0, 0);
    public static final GrowthOrder LOGARITHMIC = polynomial(0, 1);
    public static final GrowthOrder SQUARE_ROOT = polynomial(0.5, 0);
    public static final GrowthOrder LINEAR = polynomial(1, 0);
    public static final GrowthOrder LINEARITHMIC = polynomial(1, 1);
    public static final GrowthOrder QUADRATIC = polynomial(2, 0);
    public static final GrowthOrder CUBIC = polynomial(3, 0);
    public static final GrowthOrder EXPONENTIAL = new GrowthOrder(Shape.EXPONENTIAL, 0, 0);
    public static final GrowthOrder FACTORIAL = new GrowthOrder(Shape.FACTORIAL, 0, 0);
    public static final GrowthOrder UNKNOWN = new GrowthOrder(Shape.UNKNOWN, 0, 0);

    private final Shape shape;
    private final double degree;
    private final int logPower;

    private GrowthOrder(Shape shape, double degree, int logPower) {
        this.shape = shape;
        this.degree = degree;
        this.logPower = logPower;
    }

    /**
     * Creates the order {@code n^degree * log^logPower n}.
     */
    public static GrowthOrder polynomial(double degree, int logPower) {
        if (degree < -EPSILON || logPower < 0 || Double.isNaN(degree) || Double.isInfinite(degree)) {
            throw new IllegalArgumentException("Invalid polynomial order: n^" + degree + " log^" + logPower);
        }
        return new GrowthOrder(Shape.POLYNOMIAL, Math.max(0, degree), logPower);
    }

    public static GrowthOrder fromClass(ComplexityClass complexityClass) {
        return switch (complexityClass) {
            case CONSTANT -> CONSTANT;
            case LOGARITHMIC -> LOGARITHMIC;
            case SQUARE_ROOT -> SQUARE_ROOT;
            case LINEAR -> LINEAR;
            case LINEARITHMIC -> LINEARITHMIC;
            case QUADRATIC -> QUADRATIC;
            case CUBIC -> CUBIC;
            case POLYNOMIAL -> polynomial(4, 0);
            case EXPONENTIAL -> EXPONENTIAL;
            case FACTORIAL -> FACTORIAL;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public Shape getShape() {
        return shape;
    }

    public double getDegree() {
        return degree;
    }

    public int getLogPower() {
        return logPower;
    }

    public boolean isUnknown() {
        return shape == Shape.UNKNOWN;
    }

    public boolean isPolynomial() {
        return shape == Shape.POLYNOMIAL;
    }

    public boolean isConstant() {
        return isPolynomial() && degree < EPSILON && logPower == 0;
    }

    /**
     * Order of the product of two costs.
     */
    public GrowthOrder times(GrowthOrder other) {
        if (isUnknown() || other.isUnknown()) {
            return UNKNOWN;
        }
        if (isPolynomial() && other.isPolynomial()) {
            return polynomial(degree + other.degree, logPower + other.logPower);
        }
        return shape.compareTo(other.shape) >= 0 ? this : other;
    }

    /**
     * Order of a sum or of a worst-case choice: the dominant operand. Ties keep this order.
     */
    public GrowthOrder max(GrowthOrder other) {
        return compareTo(other) >= 0 ? this : other;
    }

    /**
     * Compares the polynomial degree against {@code n^p}, ignoring log factors.
     */
    public int compareDegree(double p) {
        if (Math.abs(degree - p) < EPSILON) {
            return 0;
        }
        return degree < p ? -1 : 1;
    }

    /**
     * Rounds up to the nearest canonical class at or above this order.
     */
    public ComplexityClass toComplexityClass() {
        switch (shape) {
            case UNKNOWN:
                return ComplexityClass.UNKNOWN;
            case FACTORIAL:
                return ComplexityClass.FACTORIAL;
            case EXPONENTIAL:
                return ComplexityClass.EXPONENTIAL;
            default:
                break;
        }
        if (compareDegree(0) == 0) {
            if (logPower == 0) {
                return ComplexityClass.CONSTANT;
            }
            return logPower == 1 ? ComplexityClass.LOGARITHMIC : ComplexityClass.SQUARE_ROOT;
        }
        if (atMost(0.5)) {
            return ComplexityClass.SQUARE_ROOT;
        }
        if (atMost(1)) {
            return ComplexityClass.LINEAR;
        }
        if (compareDegree(1) == 0 && logPower == 1) {
            return ComplexityClass.LINEARITHMIC;
        }
        if (atMost(2)) {
            return ComplexityClass.QUADRATIC;
        }
        if (atMost(3)) {
            return ComplexityClass.CUBIC;
        }
        return ComplexityClass.POLYNOMIAL;
    }

    // n^degree log^k n <= n^bound, up to the next class
    private boolean atMost(double bound) {
        int cmp = compareDegree(bound);
        return cmp < 0 || (cmp == 0 && logPower == 0);
    }

    /**
     * Exact Big-O notation of this order, e.g. {@code O(n^2 log n)}.
     */
    public String toNotation() {
        switch (shape) {
            case UNKNOWN:
                return "Unknown";
            case FACTORIAL:
                return "O(n!)";
            case EXPONENTIAL:
                return "O(2^n)";
            default:
                break;
        }
        StringBuilder text = new StringBuilder();
        if (compareDegree(0) != 0) {
            if (compareDegree(0.5) == 0) {
                text.append("sqrt n");
            } else if (compareDegree(1) == 0) {
                text.append("n");
            } else if (Math.abs(degree - Math.rint(degree)) < EPSILON) {
                text.append("n^").append((long) Math.rint(degree));
            } else {
                text.append("n^").append(formatDegree(degree));
            }
        }
        if (logPower > 0) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(logPower == 1 ? "log n" : "log^" + logPower + " n");
        }
        return "O(" + (text.length() == 0 ? "1" : text) + ")";
    }

    private static String formatDegree(double value) {
        String formatted = String.format(java.util.Locale.ROOT, "%.2f", value);
        return formatted.replaceAll("0+$", "").replaceAll("\\.$", "");
    }

    @Override
    public int compareTo(GrowthOrder other) {
        int byShape = shape.compareTo(other.shape);
        if (byShape != 0 || !isPolynomial()) {
            return byShape;
        }
        int byDegree = compareDegree(other.degree);
        return byDegree != 0 ? byDegree : Integer.compare(logPower, other.logPower);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof GrowthOrder && compareTo((GrowthOrder) o) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, Math.round(degree * 1_000_000), logPower);
    }

    @Override
    public String toString() {
        return toNotation();
    }
}
