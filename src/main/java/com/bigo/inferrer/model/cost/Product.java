package com.bigo.inferrer.model.cost;

import java.util.List;

/**
 * Cost of a nested block: a loop bound times the cost of one pass of its body.
 */
public final class Product extends CostExpression {

    private final List<CostExpression> children;

    public Product(List<CostExpression> children) {
        if (children.size() < 2) {
            throw new IllegalArgumentException("Product needs at least two factors, got " + children.size());
        }
        this.children = List.copyOf(children);
    }

    @Override
    public Kind getKind() {
        return Kind.PRODUCT;
    }

    @Override
    public List<CostExpression> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(children.get(0).toString());
        for (int i = 1; i < children.size(); i++) {
            text.append("*(").append(children.get(i)).append(')');
        }
        return text.toString();
    }
}
