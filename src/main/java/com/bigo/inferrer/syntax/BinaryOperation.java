package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Arithmetic, comparison or logical operation on two operands.
 */
public final class BinaryOperation extends SyntaxNode {

    public enum Operator {
        PLUS("+"),
        MINUS("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        REMAINDER("%"),
        LEFT_SHIFT("<<"),
        RIGHT_SHIFT(">>"),
        LESS("<"),
        LESS_EQUALS("<="),
        GREATER(">"),
        GREATER_EQUALS(">="),
        EQUALS("=="),
        NOT_EQUALS("!="),
        AND("&&"),
        OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String asString() {
            return symbol;
        }

        public boolean isComparison() {
            return switch (this) {
                case LESS, LESS_EQUALS, GREATER, GREATER_EQUALS, EQUALS, NOT_EQUALS -> true;
                default -> false;
            };
        }

        /**
         * The comparison that holds when the operands are swapped ({@code a < b} iff {@code b > a}).
         */
        public Operator mirror() {
            return switch (this) {
                case LESS -> GREATER;
                case LESS_EQUALS -> GREATER_EQUALS;
                case GREATER -> LESS;
                case GREATER_EQUALS -> LESS_EQUALS;
                default -> this;
            };
        }

        public boolean isUpperBound() {
            return this == LESS || this == LESS_EQUALS;
        }

        public boolean isLowerBound() {
            return this == GREATER || this == GREATER_EQUALS;
        }
    }

    private final Operator operator;
    private final SyntaxNode left;
    private final SyntaxNode right;

    public BinaryOperation(Operator operator, SyntaxNode left, SyntaxNode right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator getOperator() {
        return operator;
    }

    public SyntaxNode getLeft() {
        return left;
    }

    public SyntaxNode getRight() {
        return right;
    }

    @Override
    public Kind getKind() {
        return Kind.BINARY_OPERATION;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of(left, right);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOperation)) {
            return false;
        }
        BinaryOperation other = (BinaryOperation) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return operand(left) + " " + operator.asString() + " " + operand(right);
    }

    private static String operand(SyntaxNode node) {
        return node.isBinaryOperation() ? "(" + node + ")" : node.toString();
    }
}
