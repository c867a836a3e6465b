package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.SymbolicBound;
import com.bigo.inferrer.model.VariableState;
import com.bigo.inferrer.syntax.BinaryOperation;
import com.bigo.inferrer.syntax.BinaryOperation.Operator;
import com.bigo.inferrer.syntax.ForLoop;
import com.bigo.inferrer.syntax.Identifier;
import com.bigo.inferrer.syntax.Literal;
import com.bigo.inferrer.syntax.SyntaxNode;
import com.bigo.inferrer.syntax.WhileLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.bigo.inferrer.analysis.SymbolicExpressions.*;

/**
 * Derives the iteration count of a loop from its condition and from how one
 * iteration changes the condition variable.
 */
public class BoundResolver {

    private static final Logger logger = LoggerFactory.getLogger(BoundResolver.class);

    private static final long SIMULATION_LIMIT = 1_000_000;

    private final VariableStateTracker tracker;
    private final Set<String> sizeFunctions;

    public BoundResolver() {
        this(AnalysisOptions.defaults());
    }

    public BoundResolver(AnalysisOptions options) {
        this(new VariableStateTracker(options), options);
    }

    public BoundResolver(VariableStateTracker tracker, AnalysisOptions options) {
        this.tracker = tracker;
        this.sizeFunctions = options.getSizeFunctions();
    }

    /**
     * Resolves the number of iterations of {@code loop}.
     *
     * @param loop A {@link ForLoop} or {@link WhileLoop}
     * @param variableStates States of the variables on entry to the loop
     * @return The bound; Unknown carries the reason it could not be resolved
     * @throws IllegalArgumentException If {@code loop} is not a loop
     */
    public SymbolicBound resolve(SyntaxNode loop, Map<String, VariableState> variableStates) {
        SymbolicBound bound;
        if (loop instanceof ForLoop) {
            bound = resolveFor((ForLoop) loop, variableStates);
        } else if (loop instanceof WhileLoop) {
            bound = resolveWhile((WhileLoop) loop, variableStates);
        } else {
            throw new IllegalArgumentException("Not a loop: " + loop.getKind());
        }
        logger.debug("Bound of {}: {}", loop, bound);
        return bound;
    }

    private SymbolicBound resolveFor(ForLoop loop, Map<String, VariableState> entry) {
        String iterator = loop.getIterator();
        Scope scope = Scope.function("for " + iterator).loopBody("body");
        Map<String, VariableState> body = tracker.track(scope, List.of(loop.getBody()));
        if (body.containsKey(iterator)) {
            return SymbolicBound.unknown("loop variable " + iterator + " is reassigned inside the loop body");
        }
        VariableState step = tracker.track(scope, List.of(loop.getUpdate())).get(iterator);
        if (step == null) {
            return SymbolicBound.unknown("loop variable " + iterator + " does not progress");
        }
        Map<String, SyntaxNode> bindings = constantBindings(entry);
        SyntaxNode start = fold(substitute(loop.getStart(), bindings));
        SyntaxNode stop = fold(substitute(loop.getStop(), bindings));
        if (mentionsAny(stop, body.keySet())) {
            return SymbolicBound.unknown("loop bound " + stop + " changes inside the loop body");
        }
        return bound(iterator, start, loop.getComparison(), stop, step);
    }

    private SymbolicBound resolveWhile(WhileLoop loop, Map<String, VariableState> entry) {
        Scope scope = Scope.function("while").loopBody("body");
        Map<String, VariableState> body = tracker.track(scope, List.of(loop.getBody()));
        return condition(fold(loop.getCondition()), entry, body);
    }

    private SymbolicBound condition(SyntaxNode condition, Map<String, VariableState> entry,
                                    Map<String, VariableState> body) {
        if (condition.isBinaryOperation()) {
            BinaryOperation operation = condition.asBinaryOperation();
            if (operation.getOperator() == Operator.AND) {
                // the loop stops as soon as either conjunct fails
                return tighter(condition(operation.getLeft(), entry, body),
                        condition(operation.getRight(), entry, body));
            }
            if (operation.getOperator() == Operator.OR) {
                return SymbolicBound.unknown("disjunctive loop condition " + condition);
            }
            if (operation.getOperator().isComparison()) {
                return comparison(operation, entry, body);
            }
        }
        return SymbolicBound.unknown("unsupported loop condition " + condition);
    }

    private static SymbolicBound tighter(SymbolicBound first, SymbolicBound second) {
        if (first.isUnknown()) {
            return second;
        }
        if (second.isUnknown()) {
            return first;
        }
        if (first.isExact() && second.isExact()) {
            return first.getCount() <= second.getCount() ? first : second;
        }
        if (first.isExact() || second.isExact()) {
            return first.isExact() ? first : second;
        }
        return second.getOrder().compareTo(first.getOrder()) < 0 ? second : first;
    }

    private SymbolicBound comparison(BinaryOperation operation, Map<String, VariableState> entry,
                                     Map<String, VariableState> body) {
        SyntaxNode left = operation.getLeft();
        SyntaxNode right = operation.getRight();
        Operator operator = operation.getOperator();

        String squared = squaredVariable(left);
        if (squared != null && body.containsKey(squared)) {
            return squareRoot(squared, operator, right, entry, body);
        }

        String variable;
        SyntaxNode limit;
        if (isChanging(left, body)) {
            variable = left.asIdentifier().getName();
            limit = right;
        } else if (isChanging(right, body)) {
            variable = right.asIdentifier().getName();
            limit = left;
            operator = operator.mirror();
        } else {
            return SymbolicBound.unknown("loop condition " + operation + " does not change inside the loop");
        }

        VariableState state = body.get(variable);
        SyntaxNode start = startValue(variable, entry);
        if (start == null) {
            return SymbolicBound.unknown("initial value of " + variable + " is unknown: "
                    + entry.get(variable).getReason());
        }
        if (isChanging(limit, body)) {
            // two pointers closing in on each other: track their difference
            String other = limit.asIdentifier().getName();
            VariableState otherState = body.get(other);
            SyntaxNode otherStart = startValue(other, entry);
            if (!state.isLinearStep() || !otherState.isLinearStep() || otherStart == null) {
                return SymbolicBound.unknown("loop bounds " + variable + " and " + other + " both change");
            }
            VariableState relative = VariableState.linearStep(state.getDelta() - otherState.getDelta());
            return bound(variable, start, operator, otherStart, relative);
        }
        if (mentionsAny(limit, body.keySet())) {
            return SymbolicBound.unknown("loop bound " + limit + " changes inside the loop body");
        }
        SyntaxNode stop = fold(substitute(limit, constantBindings(entry)));
        return bound(variable, start, operator, stop, state);
    }

    private static boolean isChanging(SyntaxNode node, Map<String, VariableState> body) {
        return node.isIdentifier() && body.containsKey(node.asIdentifier().getName());
    }

    // value on loop entry; a variable never assigned before the loop is an input-size symbol
    private static SyntaxNode startValue(String variable, Map<String, VariableState> entry) {
        VariableState state = entry.get(variable);
        if (state == null || state.isLinearStep() || state.isMultiplicativeStep()) {
            return new Identifier(variable);
        }
        return state.isConstant() ? state.getValue() : null;
    }

    private static String squaredVariable(SyntaxNode node) {
        if (!node.isBinaryOperation()) {
            return null;
        }
        BinaryOperation operation = node.asBinaryOperation();
        if (operation.getOperator() == Operator.MULTIPLY && operation.getLeft().isIdentifier()
                && operation.getLeft().equals(operation.getRight())) {
            return operation.getLeft().asIdentifier().getName();
        }
        return null;
    }

    private SymbolicBound squareRoot(String variable, Operator operator, SyntaxNode limit,
                                     Map<String, VariableState> entry, Map<String, VariableState> body) {
        VariableState state = body.get(variable);
        if (!state.isLinearStep() || state.getDelta() <= 0 || !operator.isUpperBound()) {
            return SymbolicBound.unknown("unsupported square-root loop on " + variable);
        }
        if (mentionsAny(limit, body.keySet())) {
            return SymbolicBound.unknown("loop bound " + limit + " changes inside the loop body");
        }
        SyntaxNode start = startValue(variable, entry);
        SyntaxNode stop = fold(substitute(limit, constantBindings(entry)));
        if (start != null && start.isIntegerLiteral() && stop.isIntegerLiteral()) {
            long value = start.asLiteral().asLong();
            long target = stop.asLiteral().asLong();
            long count = 0;
            while (count < SIMULATION_LIMIT && compare(operator, value * value, target)) {
                value += state.getDelta();
                count++;
            }
            return SymbolicBound.constant(count);
        }
        GrowthOrder order = orderOf(stop, sizeFunctions);
        if (!order.isPolynomial()) {
            return SymbolicBound.unknown("cannot size square-root bound " + stop);
        }
        return SymbolicBound.of(GrowthOrder.polynomial(order.getDegree() / 2, 0), "sqrt(" + stop + ")");
    }

    private SymbolicBound bound(String variable, SyntaxNode start, Operator operator, SyntaxNode stop,
                                VariableState state) {
        switch (state.getKind()) {
            case LINEAR_STEP:
                return linear(variable, start, operator, stop, state.getDelta());
            case MULTIPLICATIVE_STEP:
                return multiplicative(variable, start, operator, stop, state.getFactor(), state.isShrinking());
            case UNKNOWN:
                return SymbolicBound.unknown("loop variable " + variable + ": " + state.getReason());
            default:
                return SymbolicBound.unknown("loop variable " + variable + " does not progress");
        }
    }

    private SymbolicBound linear(String variable, SyntaxNode start, Operator operator, SyntaxNode stop, long delta) {
        if (delta == 0) {
            return SymbolicBound.unknown("loop variable " + variable + " does not progress");
        }
        boolean upward = delta > 0;
        long step = Math.abs(delta);
        Long offset = offset(start, stop);
        boolean literal = offset != null;
        long from = 0;
        long to = offset != null ? offset : 0;
        if (start.isIntegerLiteral() && stop.isIntegerLiteral()) {
            from = start.asLiteral().asLong();
            to = stop.asLiteral().asLong();
            literal = true;
        }
        if (operator == Operator.NOT_EQUALS) {
            if (literal && Math.floorMod(to, step) != Math.floorMod(from, step)) {
                return SymbolicBound.unknown("loop variable " + variable + " steps over its bound");
            }
            operator = upward ? Operator.LESS : Operator.GREATER;
        }
        boolean towards = upward ? operator.isUpperBound() : operator.isLowerBound();
        if (literal && !compare(operator, from, to)) {
            return SymbolicBound.zero();
        }
        if (!towards) {
            return SymbolicBound.unknown("loop variable " + variable + " moves away from its bound");
        }
        boolean inclusive = operator == Operator.LESS_EQUALS || operator == Operator.GREATER_EQUALS;
        if (literal) {
            return SymbolicBound.constant(count(upward ? from : to, upward ? to : from, inclusive, step));
        }
        SyntaxNode minuend = upward ? stop : start;
        SyntaxNode subtrahend = upward ? start : stop;
        if (minuend.isIntegerLiteral() && !orderOf(subtrahend, sizeFunctions).isConstant()) {
            return fixedEnd(variable, minuend.asLiteral().asLong(), subtrahend, upward, operator);
        }
        GrowthOrder order = orderOf(start, sizeFunctions).max(orderOf(stop, sizeFunctions));
        if (order.isUnknown()) {
            return SymbolicBound.unknown("cannot size loop range " + start + " to " + stop);
        }
        String expression = upward ? difference(stop, start) : difference(start, stop);
        if (step != 1) {
            expression = (expression.contains(" ") ? "(" + expression + ")" : expression) + "/" + step;
        }
        return SymbolicBound.of(order, expression);
    }

    // ceil((high - low + inclusive) / step), clamped at Long.MAX_VALUE
    private static long count(long low, long high, boolean inclusive, long step) {
        try {
            long distance = Math.addExact(Math.subtractExact(high, low), inclusive ? 1 : 0);
            return distance / step + (distance % step == 0 ? 0 : 1);
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * A loop running from an input size towards a literal, e.g. {@code i = n; i < 5}.
     * Sizes are never negative, so the count is at most the literal and is zero when
     * the literal is not past zero.
     */
    private SymbolicBound fixedEnd(String variable, long end, SyntaxNode size, boolean upward, Operator operator) {
        if (size.isBinaryOperation()) {
            return SymbolicBound.unknown("loop variable " + variable + " is bounded by " + size
                    + ", which may be negative");
        }
        if (!(upward ? compare(operator, 0, end) : compare(operator, end, 0))) {
            return SymbolicBound.zero();
        }
        if (orderOf(size, sizeFunctions).isUnknown()) {
            return SymbolicBound.unknown("cannot size loop range to " + end);
        }
        return SymbolicBound.of(GrowthOrder.CONSTANT, "max(0, " + difference(Literal.of(end), size) + ")");
    }

    // stop - start when it is a literal, e.g. start i and stop i + 3
    private static Long offset(SyntaxNode start, SyntaxNode stop) {
        if (start.equals(stop)) {
            return 0L;
        }
        Long ahead = literalOffset(stop, start);
        if (ahead != null) {
            return ahead;
        }
        Long behind = literalOffset(start, stop);
        return behind != null ? -behind : null;
    }

    private static Long literalOffset(SyntaxNode value, SyntaxNode base) {
        if (!value.isBinaryOperation()) {
            return null;
        }
        BinaryOperation operation = value.asBinaryOperation();
        if (!operation.getLeft().equals(base) || !operation.getRight().isIntegerLiteral()) {
            return null;
        }
        long amount = operation.getRight().asLiteral().asLong();
        if (operation.getOperator() == Operator.PLUS) {
            return amount;
        }
        return operation.getOperator() == Operator.MINUS ? -amount : null;
    }

    private SymbolicBound multiplicative(String variable, SyntaxNode start, Operator operator, SyntaxNode stop,
                                         long factor, boolean shrinking) {
        if (operator == Operator.NOT_EQUALS) {
            operator = shrinking ? Operator.GREATER : Operator.LESS;
        }
        boolean literal = start.isIntegerLiteral() && stop.isIntegerLiteral();
        boolean towards = shrinking ? operator.isLowerBound() : operator.isUpperBound();
        if (literal && !compare(operator, start.asLiteral().asLong(), stop.asLiteral().asLong())) {
            return SymbolicBound.zero();
        }
        if (!towards) {
            return SymbolicBound.unknown("loop variable " + variable + " moves away from its bound");
        }
        if (!shrinking && start.isIntegerLiteral() && start.asLiteral().asLong() <= 0) {
            return SymbolicBound.unknown("loop variable " + variable + " starts at "
                    + start.asLiteral().asLong() + " and never grows");
        }
        if (literal) {
            return simulate(variable, start.asLiteral().asLong(), operator, stop.asLiteral().asLong(), factor,
                    shrinking);
        }
        if (shrinking && stop.isIntegerLiteral() && compare(operator, 0, stop.asLiteral().asLong())) {
            return SymbolicBound.unknown("loop variable " + variable + " never drops past " + stop);
        }
        SyntaxNode size = shrinking ? start : stop;
        GrowthOrder order = orderOf(size, sizeFunctions);
        if (!order.isPolynomial() || order.isConstant()) {
            return SymbolicBound.unknown("cannot size loop range " + start + " to " + stop);
        }
        return SymbolicBound.of(GrowthOrder.LOGARITHMIC, "log_" + factor + "(" + size + ")");
    }

    private static SymbolicBound simulate(String variable, long value, Operator operator, long stop, long factor,
                                          boolean shrinking) {
        long count = 0;
        while (compare(operator, value, stop)) {
            long next;
            if (shrinking) {
                next = value / factor;
            } else if (Math.abs(value) > Long.MAX_VALUE / factor) {
                return SymbolicBound.constant(count + 1);
            } else {
                next = value * factor;
            }
            if (next == value) {
                return SymbolicBound.unknown("loop variable " + variable + " stops changing at " + value);
            }
            value = next;
            count++;
        }
        return SymbolicBound.constant(count);
    }
}
