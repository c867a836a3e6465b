package com.bigo.inferrer.model.cost;

import java.util.List;

/**
 * Symbolic cost of a block of code. The tree mirrors the block structure of
 * the analyzed function: sequential statements become a {@link Sum}, a loop
 * body nested under its bound becomes a {@link Product}, and alternative
 * branches become a {@link Max}.
 */
public abstract class CostExpression {

    public enum Kind {
        CONSTANT, GROWTH_TERM, SUM, PRODUCT, MAX, RECURRENCE_REF
    }

    public abstract Kind getKind();

    public abstract List<CostExpression> getChildren();

    /**
     * Whether a recursive reference occurs anywhere in this subtree.
     */
    public boolean containsRecurrence() {
        if (getKind() == Kind.RECURRENCE_REF) {
            return true;
        }
        for (CostExpression child : getChildren()) {
            if (child.containsRecurrence()) {
                return true;
            }
        }
        return false;
    }

    public boolean isConstant() {
        return getKind() == Kind.CONSTANT;
    }

    /**
     * Renders the symbolic formula, e.g. {@code n*(log_2(n)) + 1}.
     */
    @Override
    public abstract String toString();
}
