package com.bigo.inferrer.model.cost;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Worst case over alternative branches.
 */
public final class Max extends CostExpression {

    private final List<CostExpression> children;

    public Max(List<CostExpression> children) {
        if (children.size() < 2) {
            throw new IllegalArgumentException("Max needs at least two branches, got " + children.size());
        }
        this.children = List.copyOf(children);
    }

    @Override
    public Kind getKind() {
        return Kind.MAX;
    }

    @Override
    public List<CostExpression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return children.stream().map(CostExpression::toString).collect(Collectors.joining(", ", "max(", ")"));
    }
}
