package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.RecurrenceRelation;
import com.bigo.inferrer.model.RecurrenceTerm;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecurrenceSolverTest {

    private final RecurrenceSolver solver = new RecurrenceSolver();

    private static RecurrenceRelation relation(GrowthOrder f, RecurrenceTerm... terms) {
        return new RecurrenceRelation("f", List.of(terms), f);
    }

    private ComplexityClass solve(GrowthOrder f, RecurrenceTerm... terms) {
        return solver.solve(relation(f, terms));
    }

    @Test
    void mergeSortShape() {
        assertEquals(ComplexityClass.LINEARITHMIC,
                solve(GrowthOrder.LINEAR, RecurrenceTerm.divide(2), RecurrenceTerm.divide(2)));
    }

    @Test
    void binarySearchShape() {
        assertEquals(ComplexityClass.LOGARITHMIC, solve(GrowthOrder.CONSTANT, RecurrenceTerm.divide(2)));
    }

    @Test
    void leafWorkDominates() {
        assertEquals(ComplexityClass.QUADRATIC, solve(GrowthOrder.LINEAR, RecurrenceTerm.divide(2).times(4)));
        assertEquals(ComplexityClass.LINEAR, solve(GrowthOrder.CONSTANT, RecurrenceTerm.divide(2).times(2)));
    }

    @Test
    void rootWorkDominates() {
        assertEquals(ComplexityClass.LINEAR, solve(GrowthOrder.LINEAR, RecurrenceTerm.divide(2)));
        assertEquals(ComplexityClass.QUADRATIC, solve(GrowthOrder.QUADRATIC, RecurrenceTerm.divide(2).times(2)));
    }

    @Test
    void fractionalCriticalExponent() {
        GrowthOrder order = solver.solveOrder(relation(GrowthOrder.LINEAR, RecurrenceTerm.divide(2).times(3)),
                new ArrayList<>());
        assertEquals(1.585, order.getDegree(), 1e-3);
        assertEquals("O(n^1.58)", order.toNotation());
        assertEquals(ComplexityClass.QUADRATIC, order.toComplexityClass());
    }

    @Test
    void unequalDivisorsUseAkraBazzi() {
        double p = RecurrenceSolver.criticalExponent(List.of(RecurrenceTerm.divide(2), RecurrenceTerm.divide(3)));
        assertTrue(p > 0.78 && p < 0.79, "p = " + p);
        assertEquals(ComplexityClass.LINEAR,
                solve(GrowthOrder.LINEAR, RecurrenceTerm.divide(2), RecurrenceTerm.divide(3)));
    }

    @Test
    void singleDecrementMultipliesByN() {
        assertEquals(ComplexityClass.LINEAR, solve(GrowthOrder.CONSTANT, RecurrenceTerm.subtract(1)));
        assertEquals(ComplexityClass.QUADRATIC, solve(GrowthOrder.LINEAR, RecurrenceTerm.subtract(1)));
    }

    @Test
    void branchingDecrementIsExponential() {
        assertEquals(ComplexityClass.EXPONENTIAL,
                solve(GrowthOrder.CONSTANT, RecurrenceTerm.subtract(1), RecurrenceTerm.subtract(2)));
        assertEquals(ComplexityClass.EXPONENTIAL, solve(GrowthOrder.CONSTANT, RecurrenceTerm.subtract(1).times(2)));
    }

    @Test
    void inputScaledDecrementIsFactorial() {
        assertEquals(ComplexityClass.FACTORIAL,
                solve(GrowthOrder.LINEAR, RecurrenceTerm.subtract(1).scaledByInput()));
    }

    @Test
    void unrecognizedArgumentIsUnknownWithWarning() {
        List<String> warnings = new ArrayList<>();
        GrowthOrder order = solver.solveOrder(
                relation(GrowthOrder.CONSTANT, RecurrenceTerm.unrecognized("f(g(n))")), warnings);
        assertTrue(order.isUnknown());
        assertEquals(List.of("unrecognized recursive call in f: f(g(n))"), warnings);
    }

    @Test
    void nonShrinkingRecursionIsUnknown() {
        List<String> warnings = new ArrayList<>();
        assertTrue(solver.solveOrder(relation(GrowthOrder.CONSTANT, RecurrenceTerm.unchanged()), warnings).isUnknown());
        assertTrue(warnings.get(0).contains("does not shrink"));
    }

    @Test
    void mixedReductionsAreUnknown() {
        List<String> warnings = new ArrayList<>();
        GrowthOrder order = solver.solveOrder(
                relation(GrowthOrder.CONSTANT, RecurrenceTerm.divide(2), RecurrenceTerm.subtract(1)), warnings);
        assertTrue(order.isUnknown());
        assertTrue(warnings.get(0).contains("mixed"));
    }

    @Test
    void unknownResidualIsUnknown() {
        List<String> warnings = new ArrayList<>();
        assertTrue(solver.solveOrder(relation(GrowthOrder.UNKNOWN, RecurrenceTerm.divide(2)), warnings).isUnknown());
        assertEquals(1, warnings.size());
    }

    @Test
    void relationMergesTermsOfTheSameShape() {
        RecurrenceRelation relation = relation(GrowthOrder.LINEAR, RecurrenceTerm.divide(2), RecurrenceTerm.divide(2));
        assertEquals(1, relation.getTerms().size());
        assertEquals(2, relation.totalCoefficient());
        assertEquals("T(n) = 2T(n/2) + O(n)", relation.toString());
    }

    @Test
    void relationNeedsARecursiveTerm() {
        assertThrows(IllegalStateException.class, () -> new RecurrenceRelation("f", List.of(), GrowthOrder.LINEAR));
    }
}
