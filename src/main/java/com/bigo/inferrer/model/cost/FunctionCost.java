package com.bigo.inferrer.model.cost;

import com.bigo.inferrer.model.RecurrenceRelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cost of one function body: the composed expression and, for a self-recursive
 * function, the recurrence extracted from it.
 */
public final class FunctionCost {

    private final CostExpression expression;
    private final RecurrenceRelation recurrence;
    private final List<String> warnings;

    public FunctionCost(CostExpression expression, RecurrenceRelation recurrence, List<String> warnings) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.recurrence = recurrence;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public CostExpression getExpression() {
        return expression;
    }

    public Optional<RecurrenceRelation> getRecurrence() {
        return Optional.ofNullable(recurrence);
    }

    public boolean isRecursive() {
        return recurrence != null;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return recurrence != null ? recurrence.toString() : expression.toString();
    }
}
