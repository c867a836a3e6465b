package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.VariableState;
import com.bigo.inferrer.syntax.Assignment;
import com.bigo.inferrer.syntax.BinaryOperation;
import com.bigo.inferrer.syntax.BinaryOperation.Operator;
import com.bigo.inferrer.syntax.Conditional;
import com.bigo.inferrer.syntax.ForLoop;
import com.bigo.inferrer.syntax.Literal;
import com.bigo.inferrer.syntax.Sequence;
import com.bigo.inferrer.syntax.SyntaxNode;
import com.bigo.inferrer.syntax.SyntaxVisitorAdapter;
import com.bigo.inferrer.syntax.WhileLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Abstract interpretation of assignments over the {@link VariableState} lattice.
 * Walking a loop body from an empty scope yields what a single iteration does
 * to each variable; walking straight-line code from a function scope yields the
 * values variables hold when a loop is entered.
 */
public class VariableStateTracker extends SyntaxVisitorAdapter<Map<String, VariableState>> {

    private static final Logger logger = LoggerFactory.getLogger(VariableStateTracker.class);

    private final Set<String> sizeFunctions;

    public VariableStateTracker() {
        this(AnalysisOptions.defaults());
    }

    public VariableStateTracker(AnalysisOptions options) {
        this.sizeFunctions = options.getSizeFunctions();
    }

    /**
     * Tracks the states produced by running {@code statements} in order from the scope's entry states.
     *
     * @param scope The scope the statements run in
     * @param statements The statements, in execution order
     * @return The state of every variable assigned so far; unassigned variables are absent
     */
    public Map<String, VariableState> track(Scope scope, List<SyntaxNode> statements) {
        Map<String, VariableState> states = new LinkedHashMap<>(scope.getEntryStates());
        for (SyntaxNode statement : statements) {
            statement.accept(this, states);
        }
        logger.trace("Tracked {}: {}", scope.getName(), states);
        return states;
    }

    /**
     * Every variable assigned anywhere inside {@code node}, loop iterators included.
     */
    public static Set<String> assignedVariables(SyntaxNode node) {
        Set<String> names = new LinkedHashSet<>();
        if (node instanceof Assignment) {
            names.add(((Assignment) node).getTarget());
        }
        if (node instanceof ForLoop) {
            names.add(((ForLoop) node).getIterator());
        }
        for (Assignment assignment : node.findAll(Assignment.class)) {
            names.add(assignment.getTarget());
        }
        for (ForLoop loop : node.findAll(ForLoop.class)) {
            names.add(loop.getIterator());
        }
        return names;
    }

    /**
     * Join at the end of a conditional: states the branches agree on survive, the rest become Unknown.
     */
    public static Map<String, VariableState> join(Map<String, VariableState> first, Map<String, VariableState> second) {
        Map<String, VariableState> joined = new LinkedHashMap<>();
        Set<String> names = new LinkedHashSet<>(first.keySet());
        names.addAll(second.keySet());
        for (String name : names) {
            VariableState a = first.get(name);
            VariableState b = second.get(name);
            if (Objects.equals(a, b)) {
                joined.put(name, a);
            } else {
                joined.put(name, VariableState.unknown("branches disagree on " + name));
            }
        }
        return joined;
    }

    @Override
    public Void visit(Sequence node, Map<String, VariableState> states) {
        for (SyntaxNode statement : node.getStatements()) {
            statement.accept(this, states);
        }
        return null;
    }

    @Override
    public Void visit(Conditional node, Map<String, VariableState> states) {
        Map<String, VariableState> thenStates = new LinkedHashMap<>(states);
        node.getThenBranch().accept(this, thenStates);
        Map<String, VariableState> elseStates = new LinkedHashMap<>(states);
        node.getElseBranch().ifPresent(branch -> branch.accept(this, elseStates));
        Map<String, VariableState> joined = join(thenStates, elseStates);
        states.clear();
        states.putAll(joined);
        return null;
    }

    @Override
    public Void visit(ForLoop node, Map<String, VariableState> states) {
        invalidateLoopCarried(node, states);
        return null;
    }

    @Override
    public Void visit(WhileLoop node, Map<String, VariableState> states) {
        invalidateLoopCarried(node, states);
        return null;
    }

    // after a nested loop the number of iterations is not known here
    private void invalidateLoopCarried(SyntaxNode loop, Map<String, VariableState> states) {
        for (String name : assignedVariables(loop)) {
            assign(name, VariableState.unknown(name + " is assigned inside a nested loop"), states);
        }
    }

    @Override
    public Void visit(Assignment node, Map<String, VariableState> states) {
        String target = node.getTarget();
        VariableState next = transfer(target, node.getValue(), states);
        if (next != null) {
            assign(target, next, states);
        }
        return null;
    }

    private void assign(String target, VariableState next, Map<String, VariableState> states) {
        states.put(target, next);
        // values computed from the old value of target can no longer be substituted
        for (Map.Entry<String, VariableState> entry : states.entrySet()) {
            VariableState state = entry.getValue();
            if (!entry.getKey().equals(target) && state.isConstant()
                    && SymbolicExpressions.mentions(state.getValue(), target)) {
                entry.setValue(VariableState.unknown(entry.getKey() + " depends on reassigned " + target));
            }
        }
    }

    /**
     * New state of {@code target} after {@code target = value}, or null if the assignment leaves it unchanged.
     */
    VariableState transfer(String target, SyntaxNode value, Map<String, VariableState> states) {
        VariableState previous = states.get(target);
        SyntaxNode resolved = SymbolicExpressions.fold(
                SymbolicExpressions.substitute(value, SymbolicExpressions.constantBindings(states)));

        if (resolved.isIdentifier() && resolved.asIdentifier().getName().equals(target)) {
            return previous;
        }
        if (!SymbolicExpressions.mentions(resolved, target)) {
            return loopInvariant(resolved, states);
        }
        if (resolved.isBinaryOperation()) {
            VariableState step = step(target, resolved.asBinaryOperation(), previous);
            if (step != null) {
                return step;
            }
        }
        return VariableState.unknown("non-linear update of " + target + ": " + value);
    }

    private VariableState loopInvariant(SyntaxNode value, Map<String, VariableState> states) {
        if (!SymbolicExpressions.isArithmetic(value, sizeFunctions)) {
            return VariableState.unknown("assigned from " + (value.isCall() ? "call result " : "") + value);
        }
        for (String name : states.keySet()) {
            if (SymbolicExpressions.mentions(value, name)) {
                return VariableState.unknown("depends on changing variable " + name);
            }
        }
        return VariableState.constant(value);
    }

    // target op c, c op target
    private VariableState step(String target, BinaryOperation operation, VariableState previous) {
        SyntaxNode left = operation.getLeft();
        SyntaxNode right = operation.getRight();
        boolean targetLeft = left.isIdentifier() && left.asIdentifier().getName().equals(target);
        boolean targetRight = right.isIdentifier() && right.asIdentifier().getName().equals(target);
        SyntaxNode other = targetLeft ? right : left;
        if (!(targetLeft || targetRight) || !other.isIntegerLiteral()) {
            return null;
        }
        long c = other.asLiteral().asLong();
        switch (operation.getOperator()) {
            case PLUS:
                return addDelta(previous, c);
            case MINUS:
                return targetLeft ? addDelta(previous, -c) : null;
            case MULTIPLY:
                return scale(previous, c, false);
            case DIVIDE:
                return targetLeft ? scale(previous, c, true) : null;
            case LEFT_SHIFT:
            case RIGHT_SHIFT:
                if (!targetLeft || c < 0 || c > 62) {
                    return null;
                }
                return scale(previous, 1L << c, operation.getOperator() == Operator.RIGHT_SHIFT);
            default:
                return null;
        }
    }

    private static VariableState addDelta(VariableState previous, long delta) {
        if (previous == null) {
            return VariableState.linearStep(delta);
        }
        switch (previous.getKind()) {
            case LINEAR_STEP:
                try {
                    return VariableState.linearStep(Math.addExact(previous.getDelta(), delta));
                } catch (ArithmeticException overflow) {
                    return VariableState.unknown("step overflows a long");
                }
            case MULTIPLICATIVE_STEP:
                return VariableState.unknown("mixes additive and multiplicative updates");
            case UNKNOWN:
                return previous;
            default:
                // a constant previous value is substituted before reaching here
                return VariableState.unknown("unsupported additive update of " + previous);
        }
    }

    private static VariableState scale(VariableState previous, long factor, boolean shrinking) {
        if (factor == 1) {
            return previous;
        }
        if (factor == 0) {
            return shrinking ? VariableState.unknown("division by zero") : VariableState.constant(Literal.of(0));
        }
        if (factor < 0) {
            return VariableState.unknown("sign-alternating update by " + factor);
        }
        if (previous == null) {
            return VariableState.multiplicativeStep(factor, shrinking);
        }
        switch (previous.getKind()) {
            case MULTIPLICATIVE_STEP:
                if (previous.isShrinking() != shrinking) {
                    return VariableState.unknown("mixes growing and shrinking updates");
                }
                try {
                    return VariableState.multiplicativeStep(Math.multiplyExact(previous.getFactor(), factor),
                            shrinking);
                } catch (ArithmeticException overflow) {
                    return VariableState.unknown("step factor overflows a long");
                }
            case LINEAR_STEP:
                return VariableState.unknown("mixes additive and multiplicative updates");
            case UNKNOWN:
                return previous;
            default:
                return VariableState.unknown("unsupported multiplicative update of " + previous);
        }
    }
}
