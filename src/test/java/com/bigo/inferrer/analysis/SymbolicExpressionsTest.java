package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.VariableState;
import com.bigo.inferrer.syntax.BinaryOperation.Operator;
import com.bigo.inferrer.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.bigo.inferrer.syntax.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class SymbolicExpressionsTest {

    private static final Set<String> SIZE = Set.of("len", "size");

    @Test
    void foldsLiteralArithmetic() {
        assertEquals(literal(5), SymbolicExpressions.fold(add(literal(2), literal(3))));
        assertEquals(literal(12), SymbolicExpressions.fold(multiply(add(literal(1), literal(2)), literal(4))));
    }

    @Test
    void dropsNeutralOperands() {
        assertEquals(identifier("n"), SymbolicExpressions.fold(add(identifier("n"), literal(0))));
        assertEquals(identifier("n"), SymbolicExpressions.fold(multiply(literal(1), identifier("n"))));
        assertEquals(identifier("n"), SymbolicExpressions.fold(divide(identifier("n"), literal(1))));
        assertEquals(identifier("n"), SymbolicExpressions.fold(subtract(identifier("n"), subtract(literal(2), literal(2)))));
    }

    @Test
    void substitutesBoundIdentifiers() {
        Map<String, SyntaxNode> bindings = Map.of("i", identifier("n"));
        assertEquals(add(identifier("n"), literal(1)),
                SymbolicExpressions.substitute(add(identifier("i"), literal(1)), bindings));
        assertEquals(call("len", identifier("n")),
                SymbolicExpressions.substitute(call("len", identifier("i")), bindings));
    }

    @Test
    void constantBindingsOnlyExposeFixedValues() {
        Map<String, VariableState> states = new LinkedHashMap<>();
        states.put("a", VariableState.constant(literal(3)));
        states.put("b", VariableState.linearStep(1));
        states.put("c", VariableState.unknown("opaque"));
        assertEquals(Map.of("a", literal(3)), SymbolicExpressions.constantBindings(states));
    }

    @Test
    void evaluateRefusesInexactResults() {
        assertNull(SymbolicExpressions.evaluate(Operator.DIVIDE, 1, 0));
        assertNull(SymbolicExpressions.evaluate(Operator.MULTIPLY, Long.MAX_VALUE, 2));
        assertEquals(8L, SymbolicExpressions.evaluate(Operator.LEFT_SHIFT, 1, 3));
        assertEquals(2L, SymbolicExpressions.evaluate(Operator.RIGHT_SHIFT, 9, 2));
    }

    @Test
    void estimatesGrowthOfValues() {
        assertEquals(GrowthOrder.CONSTANT, SymbolicExpressions.orderOf(literal(42), SIZE));
        assertEquals(GrowthOrder.LINEAR, SymbolicExpressions.orderOf(identifier("n"), SIZE));
        assertEquals(GrowthOrder.LINEAR, SymbolicExpressions.orderOf(call("len", identifier("xs")), SIZE));
        assertEquals(GrowthOrder.QUADRATIC, SymbolicExpressions.orderOf(multiply(identifier("n"), identifier("n")), SIZE));
        assertEquals(GrowthOrder.LINEAR, SymbolicExpressions.orderOf(divide(identifier("n"), literal(2)), SIZE));
        assertEquals(GrowthOrder.SQUARE_ROOT, SymbolicExpressions.orderOf(call("sqrt", identifier("n")), SIZE));
        assertEquals(GrowthOrder.LOGARITHMIC, SymbolicExpressions.orderOf(call("log", identifier("n")), SIZE));
    }

    @Test
    void unsizeableValuesAreUnknown() {
        assertTrue(SymbolicExpressions.orderOf(divide(identifier("n"), identifier("m")), SIZE).isUnknown());
        assertTrue(SymbolicExpressions.orderOf(literal("\"text\""), SIZE).isUnknown());
        assertTrue(SymbolicExpressions.orderOf(call("compute", identifier("n")), SIZE).isUnknown());
    }

    @Test
    void arithmeticExcludesCallsAndComparisons() {
        assertTrue(SymbolicExpressions.isArithmetic(add(identifier("n"), call("len", identifier("xs"))), SIZE));
        assertFalse(SymbolicExpressions.isArithmetic(call("compute", identifier("n")), SIZE));
        assertFalse(SymbolicExpressions.isArithmetic(less(identifier("n"), identifier("m")), SIZE));
        assertFalse(SymbolicExpressions.isArithmetic(opaque("a[i]", identifier("a"), identifier("i")), SIZE));
    }

    @Test
    void mentionsLooksThroughNestedNodes() {
        SyntaxNode value = add(call("len", identifier("xs")), multiply(identifier("k"), literal(2)));
        assertTrue(SymbolicExpressions.mentions(value, "xs"));
        assertTrue(SymbolicExpressions.mentions(value, "k"));
        assertFalse(SymbolicExpressions.mentions(value, "n"));
        assertTrue(SymbolicExpressions.mentionsAny(value, Set.of("n", "k")));
    }

    @Test
    void rendersDifferences() {
        assertEquals("n", SymbolicExpressions.difference(identifier("n"), literal(0)));
        assertEquals("n - i", SymbolicExpressions.difference(identifier("n"), identifier("i")));
    }
}
