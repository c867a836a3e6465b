package com.bigo.inferrer.syntax;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.bigo.inferrer.syntax.SyntaxTrees.*;
import static org.junit.jupiter.api.Assertions.*;

class SyntaxTreesTest {

    @Test
    void rangeAscendsOrDescendsWithItsStep() {
        ForLoop up = range("i", literal(0), identifier("n"), 2);
        assertEquals(BinaryOperation.Operator.LESS, up.getComparison());
        assertEquals(add(identifier("i"), literal(2)), up.getUpdate().getValue());

        ForLoop down = range("i", identifier("n"), literal(0), -1);
        assertEquals(BinaryOperation.Operator.GREATER, down.getComparison());
        assertEquals(subtract(identifier("i"), literal(1)), down.getUpdate().getValue());
        assertEquals("i = i - 1", down.getUpdate().toString());
    }

    @Test
    void loopUpdateMustTargetTheIterator() {
        assertThrows(IllegalArgumentException.class,
                () -> new ForLoop("i", literal(0), identifier("n"), BinaryOperation.Operator.LESS,
                        assign("j", add(identifier("j"), literal(1))), sequence()));
        assertThrows(IllegalArgumentException.class,
                () -> new ForLoop("i", literal(0), identifier("n"), BinaryOperation.Operator.EQUALS,
                        assign("i", add(identifier("i"), literal(1))), sequence()));
    }

    @Test
    void callSignaturesAndQualification() {
        assertEquals("merge/3", call("merge", identifier("a"), identifier("lo"), identifier("hi")).getSignature());
        assertTrue(call("f").isUnqualified());
        assertTrue(methodCall(identifier("this"), "f").isUnqualified());
        assertFalse(methodCall(identifier("xs"), "size").isUnqualified());
        assertEquals("xs.size()", methodCall(identifier("xs"), "size").toString());
        assertEquals("f/2", function("f", List.of("a", "b")).getSignature());
    }

    @Test
    void literalsKnowWhetherTheyAreIntegers() {
        assertTrue(literal(-7).isInteger());
        assertEquals(-7, literal(-7).asLong());
        assertFalse(literal("\"text\"").isInteger());
        assertThrows(IllegalStateException.class, () -> literal("1.5").asLong());
    }

    @Test
    void findAllWalksInPreOrder() {
        SyntaxNode body = sequence(
                call("a", call("b")),
                conditional(identifier("flag"), sequence(call("c")), sequence(call("d"))));

        List<String> callees = new ArrayList<>();
        for (Call call : body.findAll(Call.class)) {
            callees.add(call.getCallee());
        }
        assertEquals(List.of("a", "b", "c", "d"), callees);
        assertEquals(1, body.findAll(Conditional.class).size());
    }

    @Test
    void visitorAdapterReachesNestedNodes() {
        FunctionDefinition function = function("f", List.of("n"),
                range("i", literal(0), identifier("n"), 1,
                        whileLoop(less(identifier("j"), identifier("n")),
                                assign("j", add(identifier("j"), literal(1))))),
                returns(identifier("j")));

        List<String> targets = new ArrayList<>();
        function.accept(new SyntaxVisitorAdapter<Void>() {
            @Override
            public Void visit(Assignment node, Void arg) {
                targets.add(node.getTarget());
                return super.visit(node, arg);
            }
        }, null);

        // the loop update comes before the body
        assertEquals(List.of("i", "j"), targets);
    }
}
