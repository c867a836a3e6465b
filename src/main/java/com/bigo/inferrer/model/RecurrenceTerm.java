package com.bigo.inferrer.model;

import com.bigo.inferrer.model.cost.Constant;

import java.util.Objects;

/**
 * One additive recursive term {@code a*T(g(n))} of a recurrence, where the
 * argument reduction {@code g} is a division, a decrement, no reduction at all,
 * or a shape the engine does not recognise.
 */
public final class RecurrenceTerm {

    public enum Reduction {
        DIVIDE, SUBTRACT, UNCHANGED, UNRECOGNIZED
    }

    private final Reduction reduction;
    private final long amount;
    private final long coefficient;
    private final boolean inputScaled;
    private final String description;

    private RecurrenceTerm(Reduction reduction, long amount, long coefficient, boolean inputScaled,
                           String description) {
        this.reduction = reduction;
        this.amount = amount;
        this.coefficient = coefficient;
        this.inputScaled = inputScaled;
        this.description = description;
    }

    /**
     * {@code T(n/divisor)}.
     */
    public static RecurrenceTerm divide(long divisor) {
        if (divisor <= 1) {
            throw new IllegalArgumentException("Divisor must exceed 1: " + divisor);
        }
        return new RecurrenceTerm(Reduction.DIVIDE, divisor, 1, false, null);
    }

    /**
     * {@code T(n-amount)}.
     */
    public static RecurrenceTerm subtract(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Decrement must be positive: " + amount);
        }
        return new RecurrenceTerm(Reduction.SUBTRACT, amount, 1, false, null);
    }

    /**
     * {@code T(n)}: the call passes its size through untouched.
     */
    public static RecurrenceTerm unchanged() {
        return new RecurrenceTerm(Reduction.UNCHANGED, 0, 1, false, null);
    }

    public static RecurrenceTerm unrecognized(String description) {
        return new RecurrenceTerm(Reduction.UNRECOGNIZED, 0, 1, false,
                Objects.requireNonNull(description, "description"));
    }

    /**
     * This term repeated {@code times} times, e.g. by a loop with a constant bound.
     */
    public RecurrenceTerm times(long times) {
        if (times <= 0) {
            throw new IllegalArgumentException("Repetition must be positive: " + times);
        }
        return new RecurrenceTerm(reduction, amount, Constant.saturatedMultiply(coefficient, times), inputScaled,
                description);
    }

    /**
     * This term repeated a number of times that grows linearly with the input.
     */
    public RecurrenceTerm scaledByInput() {
        return new RecurrenceTerm(reduction, amount, coefficient, true, description);
    }

    /**
     * Whether {@code other} reduces the argument the same way, so their coefficients can be summed.
     */
    public boolean sameShape(RecurrenceTerm other) {
        return reduction == other.reduction && amount == other.amount && inputScaled == other.inputScaled
                && Objects.equals(description, other.description);
    }

    public RecurrenceTerm plus(RecurrenceTerm other) {
        if (!sameShape(other)) {
            throw new IllegalArgumentException("Cannot merge " + this + " with " + other);
        }
        return new RecurrenceTerm(reduction, amount, Constant.saturatedAdd(coefficient, other.coefficient), inputScaled,
                description);
    }

    public Reduction getReduction() {
        return reduction;
    }

    /**
     * Divisor of a DIVIDE term, decrement of a SUBTRACT term.
     */
    public long getAmount() {
        return amount;
    }

    public long getCoefficient() {
        return coefficient;
    }

    public boolean isInputScaled() {
        return inputScaled;
    }

    public String getDescription() {
        return description;
    }

    public String argumentText() {
        return switch (reduction) {
            case DIVIDE -> "n/" + amount;
            case SUBTRACT -> "n-" + amount;
            case UNCHANGED -> "n";
            case UNRECOGNIZED -> "?";
        };
    }

    @Override
    public String toString() {
        String prefix = (inputScaled ? "n*" : "") + (coefficient != 1 ? Long.toString(coefficient) : "");
        return prefix + "T(" + argumentText() + ")";
    }
}
