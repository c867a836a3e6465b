package com.bigo.inferrer.model.cost;

import com.bigo.inferrer.model.GrowthOrder;

import java.util.List;
import java.util.Objects;

/**
 * Leaf cost that grows with the input: a loop bound such as {@code n} or
 * {@code log_2(n)}, or the resolved class of a called function.
 */
public final class GrowthTerm extends CostExpression {

    private final GrowthOrder order;
    private final String label;

    public GrowthTerm(GrowthOrder order, String label) {
        this.order = Objects.requireNonNull(order, "order");
        this.label = Objects.requireNonNull(label, "label");
    }

    public GrowthOrder getOrder() {
        return order;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public Kind getKind() {
        return Kind.GROWTH_TERM;
    }

    @Override
    public List<CostExpression> getChildren() {
        return List.of();
    }

    @Override
    public String toString() {
        return label;
    }
}
