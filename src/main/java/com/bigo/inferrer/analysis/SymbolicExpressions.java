package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.VariableState;
import com.bigo.inferrer.syntax.BinaryOperation;
import com.bigo.inferrer.syntax.BinaryOperation.Operator;
import com.bigo.inferrer.syntax.Call;
import com.bigo.inferrer.syntax.Identifier;
import com.bigo.inferrer.syntax.Literal;
import com.bigo.inferrer.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Substitution, constant folding and growth estimation over value expressions.
 */
public final class SymbolicExpressions {

    private static final Set<String> SQRT_FUNCTIONS = Set.of("sqrt", "isqrt");
    private static final Set<String> LOG_FUNCTIONS = Set.of("log", "log2", "log10");

    private SymbolicExpressions() {
    }

    /**
     * Values of the variables currently known to hold a loop-invariant value.
     */
    public static Map<String, SyntaxNode> constantBindings(Map<String, VariableState> states) {
        Map<String, SyntaxNode> bindings = new LinkedHashMap<>();
        states.forEach((name, state) -> {
            if (state.isConstant()) {
                bindings.put(name, state.getValue());
            }
        });
        return bindings;
    }

    /**
     * Replaces bound identifiers with their values. Each binding is applied once.
     */
    public static SyntaxNode substitute(SyntaxNode node, Map<String, SyntaxNode> bindings) {
        if (bindings.isEmpty()) {
            return node;
        }
        switch (node.getKind()) {
            case IDENTIFIER:
                SyntaxNode bound = bindings.get(node.asIdentifier().getName());
                return bound != null ? bound : node;
            case BINARY_OPERATION:
                BinaryOperation operation = node.asBinaryOperation();
                SyntaxNode left = substitute(operation.getLeft(), bindings);
                SyntaxNode right = substitute(operation.getRight(), bindings);
                if (left == operation.getLeft() && right == operation.getRight()) {
                    return node;
                }
                return new BinaryOperation(operation.getOperator(), left, right);
            case CALL:
                Call call = node.asCall();
                List<SyntaxNode> arguments = new ArrayList<>();
                for (SyntaxNode argument : call.getArguments()) {
                    arguments.add(substitute(argument, bindings));
                }
                SyntaxNode receiver = call.getReceiver().map(r -> substitute(r, bindings)).orElse(null);
                return new Call(call.getCallee(), receiver, arguments);
            default:
                return node;
        }
    }

    /**
     * Folds integer arithmetic between literals and drops {@code +0}, {@code *1} and {@code /1}.
     */
    public static SyntaxNode fold(SyntaxNode node) {
        if (!node.isBinaryOperation()) {
            return node;
        }
        BinaryOperation operation = node.asBinaryOperation();
        SyntaxNode left = fold(operation.getLeft());
        SyntaxNode right = fold(operation.getRight());
        Operator operator = operation.getOperator();
        if (left.isIntegerLiteral() && right.isIntegerLiteral()) {
            Long value = evaluate(operator, left.asLiteral().asLong(), right.asLiteral().asLong());
            if (value != null) {
                return Literal.of(value);
            }
        }
        if (isLiteralValue(right, 0) && (operator == Operator.PLUS || operator == Operator.MINUS)) {
            return left;
        }
        if (isLiteralValue(left, 0) && operator == Operator.PLUS) {
            return right;
        }
        if (isLiteralValue(right, 1) && (operator == Operator.MULTIPLY || operator == Operator.DIVIDE)) {
            return left;
        }
        if (isLiteralValue(left, 1) && operator == Operator.MULTIPLY) {
            return right;
        }
        if (left == operation.getLeft() && right == operation.getRight()) {
            return node;
        }
        return new BinaryOperation(operator, left, right);
    }

    /**
     * Evaluates an integer operation, or returns null when it has no exact long result.
     */
    static Long evaluate(Operator operator, long left, long right) {
        try {
            switch (operator) {
                case PLUS:
                    return Math.addExact(left, right);
                case MINUS:
                    return Math.subtractExact(left, right);
                case MULTIPLY:
                    return Math.multiplyExact(left, right);
                case DIVIDE:
                    return right == 0 ? null : left / right;
                case REMAINDER:
                    return right == 0 ? null : left % right;
                case LEFT_SHIFT:
                    return right < 0 || right > 62 ? null : Math.multiplyExact(left, 1L << right);
                case RIGHT_SHIFT:
                    return right < 0 || right > 63 ? null : left >> right;
                default:
                    return null;
            }
        } catch (ArithmeticException overflow) {
            return null;
        }
    }

    /**
     * Evaluates a comparison between integers.
     */
    static boolean compare(Operator operator, long left, long right) {
        return switch (operator) {
            case LESS -> left < right;
            case LESS_EQUALS -> left <= right;
            case GREATER -> left > right;
            case GREATER_EQUALS -> left >= right;
            case EQUALS -> left == right;
            case NOT_EQUALS -> left != right;
            default -> throw new IllegalArgumentException("Not a comparison: " + operator);
        };
    }

    public static boolean isLiteralValue(SyntaxNode node, long value) {
        return node.isIntegerLiteral() && node.asLiteral().asLong() == value;
    }

    /**
     * Whether {@code node} reads the variable {@code name}.
     */
    public static boolean mentions(SyntaxNode node, String name) {
        if (node.isIdentifier()) {
            return node.asIdentifier().getName().equals(name);
        }
        for (Identifier identifier : node.findAll(Identifier.class)) {
            if (identifier.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code node} reads any of {@code names}.
     */
    public static boolean mentionsAny(SyntaxNode node, Set<String> names) {
        for (Identifier identifier : node.findAll(Identifier.class)) {
            if (names.contains(identifier.getName())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether {@code node} is plain arithmetic over literals, variables and size calls,
     * i.e. a value that does not change unless one of its variables does.
     */
    public static boolean isArithmetic(SyntaxNode node, Set<String> sizeFunctions) {
        switch (node.getKind()) {
            case LITERAL:
            case IDENTIFIER:
                return true;
            case CALL:
                Call call = node.asCall();
                if (!sizeFunctions.contains(call.getCallee()) && !SQRT_FUNCTIONS.contains(call.getCallee())
                        && !LOG_FUNCTIONS.contains(call.getCallee())) {
                    return false;
                }
                return call.getArguments().stream().allMatch(a -> isArithmetic(a, sizeFunctions))
                        && call.getReceiver().map(r -> isArithmetic(r, sizeFunctions)).orElse(true);
            case BINARY_OPERATION:
                BinaryOperation operation = node.asBinaryOperation();
                return !operation.getOperator().isComparison()
                        && operation.getOperator() != Operator.AND && operation.getOperator() != Operator.OR
                        && isArithmetic(operation.getLeft(), sizeFunctions)
                        && isArithmetic(operation.getRight(), sizeFunctions);
            default:
                return false;
        }
    }

    /**
     * Growth of a value expression in the input size: literals are constant,
     * free variables and size calls linear, products multiply and sums take the
     * dominant operand.
     *
     * @param node The value expression
     * @param sizeFunctions Names of functions returning a collection size
     * @return The order, or Unknown when the value cannot be estimated
     */
    public static GrowthOrder orderOf(SyntaxNode node, Set<String> sizeFunctions) {
        switch (node.getKind()) {
            case LITERAL:
                return node.asLiteral().isInteger() ? GrowthOrder.CONSTANT : GrowthOrder.UNKNOWN;
            case IDENTIFIER:
                return GrowthOrder.LINEAR;
            case CALL:
                return orderOfCall(node.asCall(), sizeFunctions);
            case BINARY_OPERATION:
                return orderOfOperation(node.asBinaryOperation(), sizeFunctions);
            default:
                return GrowthOrder.UNKNOWN;
        }
    }

    private static GrowthOrder orderOfCall(Call call, Set<String> sizeFunctions) {
        String callee = call.getCallee();
        if (sizeFunctions.contains(callee)) {
            return GrowthOrder.LINEAR;
        }
        if (call.getArguments().size() != 1) {
            return GrowthOrder.UNKNOWN;
        }
        GrowthOrder argument = orderOf(call.getArguments().get(0), sizeFunctions);
        if (!argument.isPolynomial()) {
            return GrowthOrder.UNKNOWN;
        }
        if (SQRT_FUNCTIONS.contains(callee)) {
            return GrowthOrder.polynomial(argument.getDegree() / 2, 0);
        }
        if (LOG_FUNCTIONS.contains(callee)) {
            return argument.isConstant() ? GrowthOrder.CONSTANT : GrowthOrder.LOGARITHMIC;
        }
        return GrowthOrder.UNKNOWN;
    }

    private static GrowthOrder orderOfOperation(BinaryOperation operation, Set<String> sizeFunctions) {
        GrowthOrder left = orderOf(operation.getLeft(), sizeFunctions);
        GrowthOrder right = orderOf(operation.getRight(), sizeFunctions);
        switch (operation.getOperator()) {
            case PLUS:
            case MINUS:
                return left.max(right);
            case MULTIPLY:
                return left.times(right);
            case DIVIDE:
            case RIGHT_SHIFT:
            case LEFT_SHIFT:
                // scaling by a constant keeps the order
                return operation.getRight().isIntegerLiteral() ? left : GrowthOrder.UNKNOWN;
            case REMAINDER:
                return right;
            default:
                return GrowthOrder.UNKNOWN;
        }
    }

    /**
     * Renders {@code a - b} for bound expressions, omitting a zero {@code b}.
     */
    static String difference(SyntaxNode minuend, SyntaxNode subtrahend) {
        if (isLiteralValue(subtrahend, 0)) {
            return minuend.toString();
        }
        return fold(new BinaryOperation(Operator.MINUS, minuend, subtrahend)).toString();
    }
}
