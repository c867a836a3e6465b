package com.bigo.inferrer.model.cost;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cost of statements executed one after another.
 */
public final class Sum extends CostExpression {

    private final List<CostExpression> children;

    public Sum(List<CostExpression> children) {
        if (children.size() < 2) {
            throw new IllegalArgumentException("Sum needs at least two terms, got " + children.size());
        }
        this.children = List.copyOf(children);
    }

    @Override
    public Kind getKind() {
        return Kind.SUM;
    }

    @Override
    public List<CostExpression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return children.stream().map(CostExpression::toString).collect(Collectors.joining(" + "));
    }
}
