package com.bigo.inferrer.model;

import java.util.Objects;

/**
 * Iteration count of one loop as a symbolic function of input size, e.g.
 * {@code n}, {@code n/2}, {@code log_2(n)}, an exact literal count, or Unknown.
 */
public final class SymbolicBound {

    private final GrowthOrder order;
    private final long count;
    private final String expression;
    private final String reason;

    private SymbolicBound(GrowthOrder order, long count, String expression, String reason) {
        this.order = order;
        this.count = count;
        this.expression = expression;
        this.reason = reason;
    }

    /**
     * Exact iteration count known statically. Zero means the body never runs.
     */
    public static SymbolicBound constant(long count) {
        if (count < 0) {
            throw new IllegalArgumentException("Negative iteration count: " + count);
        }
        return new SymbolicBound(GrowthOrder.CONSTANT, count, Long.toString(count), null);
    }

    public static SymbolicBound zero() {
        return constant(0);
    }

    /**
     * Iteration count that grows with input size.
     *
     * @param order The growth of the count
     * @param expression Its symbolic text, e.g. {@code "n"} or {@code "log_2(n)"}
     */
    public static SymbolicBound of(GrowthOrder order, String expression) {
        Objects.requireNonNull(order, "order");
        if (order.isUnknown()) {
            return unknown("unresolvable bound " + expression);
        }
        return new SymbolicBound(order, -1, Objects.requireNonNull(expression, "expression"), null);
    }

    public static SymbolicBound unknown(String reason) {
        return new SymbolicBound(GrowthOrder.UNKNOWN, -1, "?", Objects.requireNonNull(reason, "reason"));
    }

    public GrowthOrder getOrder() {
        return order;
    }

    public boolean isUnknown() {
        return order.isUnknown();
    }

    /**
     * Whether the count is a statically known number.
     */
    public boolean isExact() {
        return count >= 0;
    }

    public boolean isZero() {
        return count == 0;
    }

    public long getCount() {
        return count;
    }

    public String getExpression() {
        return expression;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return expression;
    }
}
