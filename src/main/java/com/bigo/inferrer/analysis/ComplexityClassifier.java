package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.RecurrenceRelation;
import com.bigo.inferrer.model.cost.CostExpression;
import com.bigo.inferrer.model.cost.GrowthTerm;
import com.bigo.inferrer.model.cost.RecurrenceRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces a cost expression to its dominant growth order: sums and maxima keep
 * the dominant operand, products multiply, and recurrence references are
 * delegated to the {@link RecurrenceSolver}. Deterministic and idempotent.
 */
public class ComplexityClassifier {

    private final RecurrenceSolver solver;

    public ComplexityClassifier() {
        this(new RecurrenceSolver());
    }

    public ComplexityClassifier(RecurrenceSolver solver) {
        this.solver = solver;
    }

    public ComplexityClass classify(CostExpression expression) {
        return order(expression).toComplexityClass();
    }

    /**
     * Order of an expression without recurrence references.
     *
     * @throws IllegalStateException If the expression refers to a recurrence
     */
    public GrowthOrder order(CostExpression expression) {
        return order(expression, new RecurrenceCache(), new ArrayList<>());
    }

    /**
     * Order of an expression whose recurrence references are registered in {@code recurrences}.
     *
     * @param expression The cost expression
     * @param recurrences The recurrences of the current run
     * @param warnings Receives warnings from solving referenced recurrences
     * @return The dominant growth order
     */
    public GrowthOrder order(CostExpression expression, RecurrenceCache recurrences, List<String> warnings) {
        switch (expression.getKind()) {
            case CONSTANT:
                return GrowthOrder.CONSTANT;
            case GROWTH_TERM:
                return ((GrowthTerm) expression).getOrder();
            case SUM:
            case MAX:
                GrowthOrder dominant = GrowthOrder.CONSTANT;
                for (CostExpression child : expression.getChildren()) {
                    dominant = dominant.max(order(child, recurrences, warnings));
                }
                return dominant;
            case PRODUCT:
                GrowthOrder product = GrowthOrder.CONSTANT;
                for (CostExpression child : expression.getChildren()) {
                    product = product.times(order(child, recurrences, warnings));
                }
                return product;
            case RECURRENCE_REF:
                return solve((RecurrenceRef) expression, recurrences, warnings);
            default:
                throw new IllegalStateException("Unhandled cost expression: " + expression.getKind());
        }
    }

    private GrowthOrder solve(RecurrenceRef reference, RecurrenceCache recurrences, List<String> warnings) {
        String functionId = reference.getFunctionId();
        RecurrenceCache.Solution cached = recurrences.getSolution(functionId).orElse(null);
        if (cached == null) {
            RecurrenceRelation relation = recurrences.getRelation(functionId)
                    .orElseThrow(() -> new IllegalStateException("No recurrence registered for " + functionId));
            List<String> solverWarnings = new ArrayList<>();
            GrowthOrder order = solver.solveOrder(relation, solverWarnings);
            cached = new RecurrenceCache.Solution(order, solverWarnings);
            recurrences.putSolution(functionId, cached);
        }
        for (String warning : cached.getWarnings()) {
            if (!warnings.contains(warning)) {
                warnings.add(warning);
            }
        }
        return cached.getOrder();
    }
}
