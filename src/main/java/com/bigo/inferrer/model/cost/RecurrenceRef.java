package com.bigo.inferrer.model.cost;

import com.bigo.inferrer.model.RecurrenceTerm;

import java.util.List;
import java.util.Objects;

/**
 * Reference to the cost {@code T(g(n))} of a recursive function, left
 * symbolic instead of inlining the callee's body. The whole-function
 * reference uses an {@link RecurrenceTerm#unchanged() unchanged} argument.
 */
public final class RecurrenceRef extends CostExpression {

    private final String functionId;
    private final RecurrenceTerm argument;

    /**
     * @param functionId Signature of the recursive function, {@code name/arity}
     * @param argument How this call reduces the input
     */
    public RecurrenceRef(String functionId, RecurrenceTerm argument) {
        this.functionId = Objects.requireNonNull(functionId, "functionId");
        this.argument = Objects.requireNonNull(argument, "argument");
    }

    public String getFunctionId() {
        return functionId;
    }

    public RecurrenceTerm getArgument() {
        return argument;
    }

    @Override
    public Kind getKind() {
        return Kind.RECURRENCE_REF;
    }

    @Override
    public List<CostExpression> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return "T(" + argument.argumentText() + ")";
    }
}
