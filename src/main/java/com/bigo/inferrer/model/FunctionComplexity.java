package com.bigo.inferrer.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of analyzing one function: its canonical class, the exact growth
 * order behind it, the symbolic cost formula, and every warning raised while
 * degrading to Unknown.
 */
public final class FunctionComplexity {

    private final String functionName;
    private final String signature;
    private final ComplexityClass complexity;
    private final GrowthOrder order;
    private final String expression;
    private final String recurrence;
    private final List<String> warnings;

    public FunctionComplexity(String functionName, String signature, GrowthOrder order, String expression,
                              String recurrence, List<String> warnings) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.order = Objects.requireNonNull(order, "order");
        this.complexity = order.toComplexityClass();
        this.expression = expression;
        this.recurrence = recurrence;
        this.warnings = List.copyOf(warnings);
    }

    /**
     * A result for a function that could not be analyzed at all.
     */
    public static FunctionComplexity unknown(String functionName, String signature, List<String> warnings) {
        return new FunctionComplexity(functionName, signature, GrowthOrder.UNKNOWN, "?", null, warnings);
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getSignature() {
        return signature;
    }

    public ComplexityClass getComplexity() {
        return complexity;
    }

    public GrowthOrder getOrder() {
        return order;
    }

    /**
     * Symbolic cost formula, e.g. {@code n*(log_2(n))}.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * The solved recurrence in text form, or null for non-recursive functions.
     */
    public String getRecurrence() {
        return recurrence;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return functionName + ": " + complexity.getNotation()
                + (warnings.isEmpty() ? "" : " (" + warnings.size() + " warning(s))");
    }
}
