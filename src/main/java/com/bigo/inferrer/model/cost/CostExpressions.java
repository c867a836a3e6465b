package com.bigo.inferrer.model.cost;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Simplifying constructors for cost trees. Nested nodes of the same kind are
 * flattened and constant terms folded, so redundant {@code 1}s disappear from
 * the rendered formula.
 */
public final class CostExpressions {

    private CostExpressions() {
    }

    public static CostExpression sum(CostExpression... terms) {
        return sum(Arrays.asList(terms));
    }

    public static CostExpression sum(List<CostExpression> terms) {
        List<CostExpression> flat = new ArrayList<>();
        long constant = 0;
        boolean sawConstant = false;
        for (CostExpression term : flatten(terms, CostExpression.Kind.SUM)) {
            if (term.isConstant()) {
                constant = Constant.saturatedAdd(constant, ((Constant) term).getValue());
                sawConstant = true;
            } else {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            return Constant.of(sawConstant ? constant : 0);
        }
        // a constant is lower-order next to a growing term, but stays beside recursive
        // references so the non-recursive residual keeps its cost
        boolean onlyRecursive = flat.stream().allMatch(CostExpression::containsRecurrence);
        if (sawConstant && constant > 0 && onlyRecursive) {
            flat.add(Constant.of(constant));
        }
        return flat.size() == 1 ? flat.get(0) : new Sum(flat);
    }

    public static CostExpression product(CostExpression... factors) {
        return product(Arrays.asList(factors));
    }

    public static CostExpression product(List<CostExpression> factors) {
        List<CostExpression> flat = new ArrayList<>();
        long constant = 1;
        for (CostExpression factor : flatten(factors, CostExpression.Kind.PRODUCT)) {
            if (factor.isConstant()) {
                long value = ((Constant) factor).getValue();
                if (value == 0) {
                    return Constant.ZERO;
                }
                constant = Constant.saturatedMultiply(constant, value);
            } else {
                flat.add(factor);
            }
        }
        if (flat.isEmpty()) {
            return Constant.of(constant);
        }
        if (constant != 1) {
            flat.add(0, Constant.of(constant));
        }
        return flat.size() == 1 ? flat.get(0) : new Product(flat);
    }

    public static CostExpression max(CostExpression... branches) {
        return max(Arrays.asList(branches));
    }

    public static CostExpression max(List<CostExpression> branches) {
        List<CostExpression> flat = new ArrayList<>();
        long constant = 0;
        boolean sawConstant = false;
        for (CostExpression branch : flatten(branches, CostExpression.Kind.MAX)) {
            if (branch.isConstant()) {
                constant = Math.max(constant, ((Constant) branch).getValue());
                sawConstant = true;
            } else {
                flat.add(branch);
            }
        }
        if (flat.isEmpty()) {
            return Constant.of(sawConstant ? constant : 0);
        }
        return flat.size() == 1 ? flat.get(0) : new Max(flat);
    }

    /**
     * Copy of {@code expression} with every recursive reference replaced by
     * {@code Constant(0)}: the non-recursive residual {@code f(n)} of a recurrence.
     */
    public static CostExpression withoutRecurrences(CostExpression expression) {
        List<CostExpression> children = new ArrayList<>();
        for (CostExpression child : expression.getChildren()) {
            children.add(withoutRecurrences(child));
        }
        return switch (expression.getKind()) {
            case RECURRENCE_REF -> Constant.ZERO;
            case SUM -> sum(children);
            case PRODUCT -> product(children);
            case MAX -> max(children);
            case CONSTANT, GROWTH_TERM -> expression;
        };
    }

    private static List<CostExpression> flatten(List<CostExpression> nodes, CostExpression.Kind kind) {
        List<CostExpression> flat = new ArrayList<>();
        for (CostExpression node : nodes) {
            if (node.getKind() == kind) {
                flat.addAll(node.getChildren());
            } else {
                flat.add(node);
            }
        }
        return flat;
    }
}
