package com.bigo.inferrer.model.cost;

import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.RecurrenceTerm;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bigo.inferrer.model.cost.CostExpressions.*;
import static org.junit.jupiter.api.Assertions.*;

class CostExpressionsTest {

    private static final GrowthTerm N = new GrowthTerm(GrowthOrder.LINEAR, "n");
    private static final GrowthTerm M = new GrowthTerm(GrowthOrder.LINEAR, "m");
    private static final RecurrenceRef HALF = new RecurrenceRef("f/1", RecurrenceTerm.divide(2));

    @Test
    void sumFoldsConstants() {
        assertEquals(Constant.of(3), sum(Constant.ONE, Constant.of(2)));
        assertEquals(Constant.ZERO, sum(List.of()));
    }

    @Test
    void sumDropsConstantsNextToGrowingTerms() {
        CostExpression cost = sum(Constant.ONE, N, Constant.of(4));
        assertSame(N, cost);
    }

    @Test
    void sumKeepsConstantBesideRecursiveTerms() {
        CostExpression cost = sum(HALF, Constant.ONE);
        assertEquals(CostExpression.Kind.SUM, cost.getKind());
        assertEquals("T(n/2) + 1", cost.toString());
        assertTrue(cost.containsRecurrence());
    }

    @Test
    void sumFlattensNestedSums() {
        CostExpression cost = sum(N, sum(M, HALF));
        assertEquals(3, cost.getChildren().size());
        assertEquals("n + m + T(n/2)", cost.toString());
    }

    @Test
    void constantFoldingSaturates() {
        Constant max = Constant.of(Long.MAX_VALUE);
        assertEquals(max, sum(max, Constant.ONE));
        assertEquals(max, product(Constant.of(1_000_000_000_000L), Constant.of(1_000_000_000L)));
        assertEquals(max, product(max, sum(max, Constant.of(7))));
        assertEquals(Constant.ZERO, product(max, Constant.ZERO));
        assertEquals(Constant.of(6_000_000), product(Constant.of(2_000), Constant.of(3_000)));
    }

    @Test
    void recurrenceCoefficientsSaturate() {
        RecurrenceTerm repeated = RecurrenceTerm.divide(2).times(Long.MAX_VALUE / 2).times(3);
        assertEquals(Long.MAX_VALUE, repeated.getCoefficient());
        assertEquals(Long.MAX_VALUE, repeated.plus(RecurrenceTerm.divide(2)).getCoefficient());
    }

    @Test
    void productWithZeroIsZero() {
        assertSame(Constant.ZERO, product(N, Constant.ZERO, M));
    }

    @Test
    void productFoldsConstantsToTheFront() {
        CostExpression cost = product(N, product(M, Constant.of(3)));
        assertEquals("3*(n)*(m)", cost.toString());
        assertSame(N, product(Constant.ONE, N));
    }

    @Test
    void maxKeepsTheLargestConstantOnlyWithoutGrowingBranches() {
        assertEquals(Constant.of(5), max(Constant.of(2), Constant.of(5)));
        assertSame(N, max(Constant.of(7), N));
        assertEquals("max(n, m)", max(N, M).toString());
    }

    @Test
    void withoutRecurrencesLeavesTheNonRecursiveResidual() {
        CostExpression body = sum(HALF, HALF, N);
        assertSame(N, withoutRecurrences(body));
        assertEquals(Constant.ONE, withoutRecurrences(sum(HALF, Constant.ONE)));
    }

    @Test
    void rejectsDegenerateNodes() {
        assertThrows(IllegalArgumentException.class, () -> new Sum(List.of(N)));
        assertThrows(IllegalArgumentException.class, () -> new Product(List.of(N)));
        assertThrows(IllegalArgumentException.class, () -> new Constant(-1));
    }
}
