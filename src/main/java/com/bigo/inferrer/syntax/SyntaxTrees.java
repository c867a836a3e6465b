package com.bigo.inferrer.syntax;

import java.util.Arrays;
import java.util.List;

/**
 * Static factory for building language-neutral trees by hand, used by adapters and tests.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    public static FunctionDefinition function(String name, List<String> parameters, SyntaxNode... body) {
        return new FunctionDefinition(name, parameters, sequence(body));
    }

    public static Sequence sequence(SyntaxNode... statements) {
        return new Sequence(Arrays.asList(statements));
    }

    public static Conditional conditional(SyntaxNode condition, SyntaxNode thenBranch) {
        return new Conditional(condition, thenBranch, null);
    }

    public static Conditional conditional(SyntaxNode condition, SyntaxNode thenBranch, SyntaxNode elseBranch) {
        return new Conditional(condition, thenBranch, elseBranch);
    }

    /**
     * Range-style loop {@code for iterator in range(start, stop, step)}: the
     * iterator advances by {@code step} and runs while it has not passed {@code stop}.
     */
    public static ForLoop range(String iterator, SyntaxNode start, SyntaxNode stop, long step, SyntaxNode... body) {
        BinaryOperation.Operator comparison = step < 0 ? BinaryOperation.Operator.GREATER : BinaryOperation.Operator.LESS;
        SyntaxNode next = step < 0
                ? subtract(identifier(iterator), literal(-step))
                : add(identifier(iterator), literal(step));
        return new ForLoop(iterator, start, stop, comparison, new Assignment(iterator, next), sequence(body));
    }

    public static ForLoop forLoop(String iterator, SyntaxNode start, BinaryOperation.Operator comparison,
                                  SyntaxNode stop, SyntaxNode nextValue, SyntaxNode... body) {
        return new ForLoop(iterator, start, stop, comparison, new Assignment(iterator, nextValue), sequence(body));
    }

    public static WhileLoop whileLoop(SyntaxNode condition, SyntaxNode... body) {
        return new WhileLoop(condition, sequence(body));
    }

    public static Call call(String callee, SyntaxNode... arguments) {
        return new Call(callee, null, Arrays.asList(arguments));
    }

    public static Call methodCall(SyntaxNode receiver, String callee, SyntaxNode... arguments) {
        return new Call(callee, receiver, Arrays.asList(arguments));
    }

    public static Assignment assign(String target, SyntaxNode value) {
        return new Assignment(target, value);
    }

    public static Literal literal(long value) {
        return Literal.of(value);
    }

    public static Literal literal(String text) {
        return new Literal(text);
    }

    public static Identifier identifier(String name) {
        return new Identifier(name);
    }

    public static Return returns(SyntaxNode value) {
        return new Return(value);
    }

    public static Return returns() {
        return new Return(null);
    }

    public static OpaqueValue opaque(String text, SyntaxNode... operands) {
        return new OpaqueValue(text, Arrays.asList(operands));
    }

    public static BinaryOperation binary(BinaryOperation.Operator operator, SyntaxNode left, SyntaxNode right) {
        return new BinaryOperation(operator, left, right);
    }

    public static BinaryOperation add(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.PLUS, left, right);
    }

    public static BinaryOperation subtract(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.MINUS, left, right);
    }

    public static BinaryOperation multiply(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.MULTIPLY, left, right);
    }

    public static BinaryOperation divide(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.DIVIDE, left, right);
    }

    public static BinaryOperation less(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.LESS, left, right);
    }

    public static BinaryOperation lessOrEqual(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.LESS_EQUALS, left, right);
    }

    public static BinaryOperation greater(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.GREATER, left, right);
    }

    public static BinaryOperation greaterOrEqual(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.GREATER_EQUALS, left, right);
    }

    public static BinaryOperation and(SyntaxNode left, SyntaxNode right) {
        return binary(BinaryOperation.Operator.AND, left, right);
    }
}
