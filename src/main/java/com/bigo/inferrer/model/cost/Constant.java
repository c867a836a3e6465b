package com.bigo.inferrer.model.cost;

import java.util.List;

/**
 * Fixed cost independent of input size. {@code Constant(0)} is the cost of a
 * loop that never runs.
 */
public final class Constant extends CostExpression {

    public static final Constant ZERO = new Constant(0);
    public static final Constant ONE = new Constant(1);

    private final long value;

    public Constant(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative cost: " + value);
        }
        this.value = value;
    }

    public static Constant of(long value) {
        if (value == 0) {
            return ZERO;
        }
        return value == 1 ? ONE : new Constant(value);
    }

    /**
     * Sum of two non-negative costs, clamped at {@link Long#MAX_VALUE}. A clamped
     * constant is still a constant.
     */
    public static long saturatedAdd(long left, long right) {
        long result = left + right;
        return result < 0 ? Long.MAX_VALUE : result;
    }

    /**
     * Product of two non-negative costs, clamped at {@link Long#MAX_VALUE}.
     */
    public static long saturatedMultiply(long left, long right) {
        if (left != 0 && right > Long.MAX_VALUE / left) {
            return Long.MAX_VALUE;
        }
        return left * right;
    }

    public long getValue() {
        return value;
    }

    public boolean isZero() {
        return value == 0;
    }

    @Override
    public Kind getKind() {
        return Kind.CONSTANT;
    }

    @Override
    public List<CostExpression> getChildren() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Constant && ((Constant) o).value == value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
