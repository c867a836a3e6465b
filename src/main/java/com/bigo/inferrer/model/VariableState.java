package com.bigo.inferrer.model;

import com.bigo.inferrer.syntax.SyntaxNode;

import java.util.Objects;

/**
 * How a variable's value evolves across the statements of one scope.
 * The lattice is deliberately small: {@link Kind#UNKNOWN} is the top element
 * and absorbs every assignment the tracker has no rule for.
 */
public final class VariableState {

    public enum Kind {
        CONSTANT, LINEAR_STEP, MULTIPLICATIVE_STEP, UNKNOWN
    }

    private final Kind kind;
    private final SyntaxNode value;
    private final long step;
    private final boolean shrinking;
    private final String reason;

    private VariableState(Kind kind, SyntaxNode value, long step, boolean shrinking, String reason) {
        this.kind = kind;
        this.value = value;
        this.step = step;
        this.shrinking = shrinking;
        this.reason = reason;
    }

    /**
     * The variable holds a value fixed within the scope: a literal or an input-size expression.
     */
    public static VariableState constant(SyntaxNode value) {
        return new VariableState(Kind.CONSTANT, Objects.requireNonNull(value, "value"), 0, false, null);
    }

    /**
     * The variable changes by {@code delta} per pass ({@code x = x + delta}).
     */
    public static VariableState linearStep(long delta) {
        return new VariableState(Kind.LINEAR_STEP, null, delta, false, null);
    }

    /**
     * The variable is multiplied ({@code x = x * factor}) or divided ({@code x = x / factor}) per pass.
     */
    public static VariableState multiplicativeStep(long factor, boolean shrinking) {
        if (factor <= 1) {
            throw new IllegalArgumentException("Multiplicative factor must exceed 1: " + factor);
        }
        return new VariableState(Kind.MULTIPLICATIVE_STEP, null, factor, shrinking, null);
    }

    public static VariableState unknown(String reason) {
        return new VariableState(Kind.UNKNOWN, null, 0, false, reason);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConstant() {
        return kind == Kind.CONSTANT;
    }

    public boolean isLinearStep() {
        return kind == Kind.LINEAR_STEP;
    }

    public boolean isMultiplicativeStep() {
        return kind == Kind.MULTIPLICATIVE_STEP;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    /**
     * The fixed value of a {@link Kind#CONSTANT} state.
     */
    public SyntaxNode getValue() {
        return value;
    }

    /**
     * Signed per-pass delta of a {@link Kind#LINEAR_STEP} state.
     */
    public long getDelta() {
        return kind == Kind.LINEAR_STEP ? step : 0;
    }

    /**
     * Factor of a {@link Kind#MULTIPLICATIVE_STEP} state.
     */
    public long getFactor() {
        return kind == Kind.MULTIPLICATIVE_STEP ? step : 1;
    }

    public boolean isShrinking() {
        return shrinking;
    }

    /**
     * Why the state is Unknown, for warnings. Null for modeled states.
     */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof VariableState)) {
            return false;
        }
        VariableState other = (VariableState) o;
        return kind == other.kind && step == other.step && shrinking == other.shrinking
                && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, step, shrinking);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CONSTANT -> "Constant(" + value + ")";
            case LINEAR_STEP -> "LinearStep(" + (step >= 0 ? "+" : "") + step + ")";
            case MULTIPLICATIVE_STEP -> "MultiplicativeStep(" + (shrinking ? "/" : "*") + step + ")";
            case UNKNOWN -> "Unknown";
        };
    }
}
