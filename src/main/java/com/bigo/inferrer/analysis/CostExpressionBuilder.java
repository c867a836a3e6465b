package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.FunctionComplexity;
import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.RecurrenceRelation;
import com.bigo.inferrer.model.RecurrenceTerm;
import com.bigo.inferrer.model.SymbolicBound;
import com.bigo.inferrer.model.VariableState;
import com.bigo.inferrer.model.cost.Constant;
import com.bigo.inferrer.model.cost.CostExpression;
import com.bigo.inferrer.model.cost.FunctionCost;
import com.bigo.inferrer.model.cost.GrowthTerm;
import com.bigo.inferrer.model.cost.RecurrenceRef;
import com.bigo.inferrer.syntax.*;
import com.bigo.inferrer.syntax.BinaryOperation.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.bigo.inferrer.analysis.SymbolicExpressions.*;
import static com.bigo.inferrer.model.cost.CostExpressions.max;
import static com.bigo.inferrer.model.cost.CostExpressions.product;
import static com.bigo.inferrer.model.cost.CostExpressions.sum;
import static com.bigo.inferrer.model.cost.CostExpressions.withoutRecurrences;

/**
 * Builds the cost expression of a function body bottom-up. Sequences add,
 * conditionals take the worse branch, loops multiply their body by the
 * resolved bound, calls to analyzed functions contribute that function's
 * class, and self-recursive calls stay symbolic as {@link RecurrenceRef}s from
 * which the function's recurrence is extracted.
 */
public class CostExpressionBuilder implements SyntaxVisitor<CostExpression, CostExpressionBuilder.Frame> {

    private static final Logger logger = LoggerFactory.getLogger(CostExpressionBuilder.class);

    private final AnalysisOptions options;
    private final VariableStateTracker tracker;
    private final BoundResolver boundResolver;
    private final ComplexityClassifier classifier;

    public CostExpressionBuilder() {
        this(AnalysisOptions.defaults());
    }

    public CostExpressionBuilder(AnalysisOptions options) {
        this(options, new VariableStateTracker(options), new ComplexityClassifier());
    }

    public CostExpressionBuilder(AnalysisOptions options, VariableStateTracker tracker,
                                 ComplexityClassifier classifier) {
        this.options = options;
        this.tracker = tracker;
        this.boundResolver = new BoundResolver(tracker, options);
        this.classifier = classifier;
    }

    /**
     * Builds the cost of a function analyzed on its own.
     */
    public FunctionCost build(FunctionDefinition function) {
        return build(function, AnalysisRun.of(List.of(function), CancellationToken.none()));
    }

    /**
     * Builds the cost of {@code function} within a run. A recursive function's
     * recurrence is registered in the run under the function's signature.
     *
     * @param function The function to cost
     * @param run The run supplying callee results and cancellation
     * @return The body's cost expression, with its recurrence when the function recurses
     * @throws UnsupportedConstructException If the function takes part in mutual recursion
     * @throws AnalysisCancelledException If the run is cancelled
     */
    public FunctionCost build(FunctionDefinition function, AnalysisRun run) {
        Frame frame = new Frame(function, run);
        CostExpression expression = sequence(statements(function.getBody()), frame, true);
        if (!expression.containsRecurrence()) {
            return new FunctionCost(expression, null, frame.warnings);
        }

        GrowthOrder nonRecursive = classifier.order(withoutRecurrences(expression));
        RecurrenceRelation relation = new RecurrenceRelation(function.getName(), recursiveTerms(expression),
                nonRecursive);
        run.getRecurrences().register(function.getSignature(), relation);
        logger.debug("Recurrence of {}: {}", function.getSignature(), relation);
        return new FunctionCost(expression, relation, frame.warnings);
    }

    private static List<SyntaxNode> statements(SyntaxNode body) {
        return body instanceof Sequence ? ((Sequence) body).getStatements() : List.of(body);
    }

    // costs one statement, then advances the entry states seen by later loops
    private CostExpression statement(SyntaxNode statement, Frame frame) {
        CostExpression cost = statement.accept(this, frame);
        frame.environment = tracker.track(frame.scope.withStates(frame.environment), List.of(statement));
        return cost;
    }

    @Override
    public CostExpression visit(Sequence node, Frame frame) {
        return sequence(node.getStatements(), frame, false);
    }

    /**
     * Sums the statements. A conditional with exactly one branch that always
     * returns splits the sequence: the statements after it run only on the
     * other path, so they join that branch inside the {@code max}.
     */
    private CostExpression sequence(List<SyntaxNode> statements, Frame frame, boolean topLevel) {
        List<CostExpression> costs = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            if (topLevel) {
                frame.run.getCancellationToken().throwIfCancelled();
            }
            SyntaxNode statement = statements.get(i);
            if (statement instanceof Conditional && i + 1 < statements.size()) {
                Conditional conditional = (Conditional) statement;
                boolean thenExits = alwaysReturns(conditional.getThenBranch());
                boolean elseExits = conditional.getElseBranch().map(CostExpressionBuilder::alwaysReturns).orElse(false);
                if (thenExits != elseExits) {
                    List<SyntaxNode> rest = statements.subList(i + 1, statements.size());
                    costs.add(earlyExit(conditional, thenExits, rest, frame, topLevel));
                    return sum(costs);
                }
            }
            costs.add(statement(statement, frame));
        }
        return sum(costs);
    }

    private CostExpression earlyExit(Conditional conditional, boolean thenExits, List<SyntaxNode> rest, Frame frame,
                                     boolean topLevel) {
        SyntaxNode exiting = thenExits ? conditional.getThenBranch() : conditional.getElseBranch().get();
        List<SyntaxNode> continuing = new ArrayList<>();
        if (thenExits) {
            conditional.getElseBranch().ifPresent(branch -> continuing.addAll(statements(branch)));
        } else {
            continuing.addAll(statements(conditional.getThenBranch()));
        }
        continuing.addAll(rest);

        CostExpression condition = conditional.getCondition().accept(this, frame);
        Map<String, VariableState> entry = frame.environment;
        CostExpression exitCost = exiting.accept(this, frame);
        frame.environment = entry;
        CostExpression continueCost = sequence(continuing, frame, topLevel);
        frame.environment = entry;
        return sum(condition, max(exitCost, continueCost));
    }

    private static boolean alwaysReturns(SyntaxNode node) {
        if (node instanceof Return) {
            return true;
        }
        if (node instanceof Sequence) {
            List<SyntaxNode> statements = ((Sequence) node).getStatements();
            return !statements.isEmpty() && alwaysReturns(statements.get(statements.size() - 1));
        }
        if (node instanceof Conditional) {
            Conditional conditional = (Conditional) node;
            return alwaysReturns(conditional.getThenBranch())
                    && conditional.getElseBranch().map(CostExpressionBuilder::alwaysReturns).orElse(false);
        }
        return false;
    }

    @Override
    public CostExpression visit(Conditional node, Frame frame) {
        CostExpression condition = node.getCondition().accept(this, frame);
        Map<String, VariableState> entry = frame.environment;
        CostExpression thenCost = node.getThenBranch().accept(this, frame);
        frame.environment = entry;
        CostExpression elseCost = Constant.ZERO;
        if (node.getElseBranch().isPresent()) {
            elseCost = node.getElseBranch().get().accept(this, frame);
            frame.environment = entry;
        }
        return sum(condition, max(thenCost, elseCost));
    }

    @Override
    public CostExpression visit(ForLoop node, Frame frame) {
        SymbolicBound bound = resolve(node, "for loop over " + node.getIterator(), frame);
        CostExpression start = node.getStart().accept(this, frame);
        CostExpression stop = node.getStop().accept(this, frame);
        CostExpression body = loopBody(node, frame);
        return sum(start, product(boundCost(bound), sum(Constant.ONE, body, stop)));
    }

    @Override
    public CostExpression visit(WhileLoop node, Frame frame) {
        SymbolicBound bound = resolve(node, "while loop on " + node.getCondition(), frame);
        CostExpression condition = node.getCondition().accept(this, frame);
        CostExpression body = loopBody(node, frame);
        return product(boundCost(bound), sum(Constant.ONE, condition, body));
    }

    private SymbolicBound resolve(SyntaxNode loop, String description, Frame frame) {
        SymbolicBound bound = boundResolver.resolve(loop, frame.environment);
        if (bound.isUnknown()) {
            frame.warn("unresolved bound for " + description + ": " + bound.getReason());
        }
        return bound;
    }

    // inside the body, anything the loop assigns is loop-carried and has no fixed entry value
    private CostExpression loopBody(SyntaxNode loop, Frame frame) {
        Map<String, VariableState> entry = frame.environment;
        Map<String, VariableState> carried = new LinkedHashMap<>(entry);
        carried.keySet().removeAll(VariableStateTracker.assignedVariables(loop));
        frame.environment = carried;
        CostExpression body = (loop instanceof ForLoop ? ((ForLoop) loop).getBody() : ((WhileLoop) loop).getBody())
                .accept(this, frame);
        frame.environment = entry;
        return body;
    }

    private static CostExpression boundCost(SymbolicBound bound) {
        if (bound.isUnknown()) {
            return new GrowthTerm(GrowthOrder.UNKNOWN, "?");
        }
        if (bound.isExact()) {
            return Constant.of(bound.getCount());
        }
        return new GrowthTerm(bound.getOrder(), bound.getExpression());
    }

    @Override
    public CostExpression visit(Call node, Frame frame) {
        List<CostExpression> parts = new ArrayList<>();
        parts.add(Constant.ONE);
        node.getReceiver().ifPresent(receiver -> parts.add(receiver.accept(this, frame)));
        for (SyntaxNode argument : node.getArguments()) {
            parts.add(argument.accept(this, frame));
        }
        parts.add(calleeCost(node, frame));
        return sum(parts);
    }

    private CostExpression calleeCost(Call call, Frame frame) {
        String callee = call.getCallee();
        if (call.isUnqualified()) {
            String signature = call.getSignature();
            if (signature.equals(frame.signature)) {
                return new RecurrenceRef(signature, reduction(call, frame));
            }
            CallGraph callGraph = frame.run.getCallGraph();
            if (callGraph.isDefined(signature) && callGraph.isMutuallyRecursive(frame.signature, signature)) {
                throw new UnsupportedConstructException("mutual recursion");
            }
            Optional<FunctionComplexity> known = frame.run.getResults().get(signature);
            if (known.isPresent()) {
                if (known.get().getOrder().isUnknown()) {
                    frame.warn("call to " + callee + " whose complexity is Unknown");
                }
                return orderCost(known.get().getOrder(), callee + "(...)");
            }
        }
        if (options.isSizeFunction(callee)) {
            return Constant.ONE;
        }
        Optional<ComplexityClass> configured = options.callCost(callee);
        if (configured.isPresent()) {
            return orderCost(GrowthOrder.fromClass(configured.get()), callee + "(...)");
        }
        if (options.getUnknownCallPolicy() == AnalysisOptions.UnknownCallPolicy.UNKNOWN) {
            frame.warn("call to unresolved function " + callee);
            return new GrowthTerm(GrowthOrder.UNKNOWN, callee + "(...)");
        }
        logger.debug("Treating unresolved call {} as O(1)", callee);
        return Constant.ONE;
    }

    private static CostExpression orderCost(GrowthOrder order, String label) {
        return order.isConstant() ? Constant.ONE : new GrowthTerm(order, label);
    }

    @Override
    public CostExpression visit(Assignment node, Frame frame) {
        return sum(Constant.ONE, node.getValue().accept(this, frame));
    }

    @Override
    public CostExpression visit(Return node, Frame frame) {
        CostExpression value = node.getValue().map(v -> v.accept(this, frame)).orElse(Constant.ZERO);
        return sum(Constant.ONE, value);
    }

    @Override
    public CostExpression visit(Literal node, Frame frame) {
        return Constant.ZERO;
    }

    @Override
    public CostExpression visit(Identifier node, Frame frame) {
        return Constant.ZERO;
    }

    @Override
    public CostExpression visit(BinaryOperation node, Frame frame) {
        return sum(node.getLeft().accept(this, frame), node.getRight().accept(this, frame));
    }

    @Override
    public CostExpression visit(OpaqueValue node, Frame frame) {
        List<CostExpression> operands = new ArrayList<>();
        for (SyntaxNode operand : node.getOperands()) {
            operands.add(operand.accept(this, frame));
        }
        return sum(operands);
    }

    /**
     * A nested definition is not executed where it appears.
     */
    @Override
    public CostExpression visit(FunctionDefinition node, Frame frame) {
        return Constant.ZERO;
    }

    // ---- argument reduction of a self-recursive call ----

    private RecurrenceTerm reduction(Call call, Frame frame) {
        List<String> parameters = frame.function.getParameters();
        Set<String> parameterNames = new HashSet<>(parameters);
        Map<String, SyntaxNode> bindings = constantBindings(frame.environment);
        List<SyntaxNode> arguments = new ArrayList<>();
        for (SyntaxNode argument : call.getArguments()) {
            arguments.add(fold(substitute(argument, bindings)));
        }

        // a division anywhere in an argument wins over a decrement
        for (SyntaxNode argument : arguments) {
            Long divisor = divisor(argument, parameterNames);
            if (divisor != null) {
                return RecurrenceTerm.divide(divisor);
            }
        }
        for (SyntaxNode argument : arguments) {
            Long decrement = decrement(argument, parameterNames);
            if (decrement != null) {
                return RecurrenceTerm.subtract(decrement);
            }
        }
        // a parameter already shrunk earlier in the body, e.g. n = n - 1; f(n)
        for (SyntaxNode argument : arguments) {
            if (argument.isIdentifier() && parameterNames.contains(argument.asIdentifier().getName())) {
                VariableState state = frame.environment.get(argument.asIdentifier().getName());
                if (state != null && state.isLinearStep() && state.getDelta() < 0) {
                    return RecurrenceTerm.subtract(-state.getDelta());
                }
                if (state != null && state.isMultiplicativeStep() && state.isShrinking()) {
                    return RecurrenceTerm.divide(state.getFactor());
                }
            }
        }
        boolean passThrough = arguments.stream()
                .allMatch(a -> a.isIdentifier() && parameterNames.contains(a.asIdentifier().getName())
                        && !frame.environment.containsKey(a.asIdentifier().getName()));
        if (passThrough) {
            return RecurrenceTerm.unchanged();
        }
        return RecurrenceTerm.unrecognized(call.toString());
    }

    private static Long divisor(SyntaxNode argument, Set<String> parameters) {
        for (BinaryOperation operation : argument.findAll(BinaryOperation.class)) {
            SyntaxNode right = operation.getRight();
            if (!right.isIntegerLiteral() || !mentionsAny(operation.getLeft(), parameters)) {
                continue;
            }
            long amount = right.asLiteral().asLong();
            if (operation.getOperator() == Operator.DIVIDE && amount >= 2) {
                return amount;
            }
            if (operation.getOperator() == Operator.RIGHT_SHIFT && amount >= 1 && amount <= 62) {
                return 1L << amount;
            }
        }
        return null;
    }

    // p - c, and p + c for an index advancing toward the end of its range
    private static Long decrement(SyntaxNode argument, Set<String> parameters) {
        if (!argument.isBinaryOperation()) {
            return null;
        }
        BinaryOperation operation = argument.asBinaryOperation();
        if (!operation.getRight().isIntegerLiteral() || !mentionsAny(operation.getLeft(), parameters)) {
            return null;
        }
        long amount = operation.getRight().asLiteral().asLong();
        if (operation.getOperator() == Operator.MINUS) {
            return amount > 0 ? amount : null;
        }
        if (operation.getOperator() == Operator.PLUS) {
            return amount != 0 ? Math.abs(amount) : null;
        }
        return null;
    }

    // ---- recurrence term extraction ----

    /**
     * The additive recursive terms of a body expression. Of the branches of a
     * {@code max}, only the one with the heaviest recursion is kept.
     */
    List<RecurrenceTerm> recursiveTerms(CostExpression expression) {
        if (!expression.containsRecurrence()) {
            return List.of();
        }
        switch (expression.getKind()) {
            case RECURRENCE_REF:
                return List.of(((RecurrenceRef) expression).getArgument());
            case SUM:
                List<RecurrenceTerm> terms = new ArrayList<>();
                for (CostExpression child : expression.getChildren()) {
                    terms.addAll(recursiveTerms(child));
                }
                return terms;
            case MAX:
                List<RecurrenceTerm> heaviest = List.of();
                for (CostExpression child : expression.getChildren()) {
                    List<RecurrenceTerm> candidate = recursiveTerms(child);
                    if (BRANCH_WEIGHT.compare(candidate, heaviest) > 0) {
                        heaviest = candidate;
                    }
                }
                return heaviest;
            case PRODUCT:
                return productTerms(expression);
            default:
                return List.of();
        }
    }

    private List<RecurrenceTerm> productTerms(CostExpression product) {
        List<CostExpression> recursive = new ArrayList<>();
        List<CostExpression> factors = new ArrayList<>();
        for (CostExpression child : product.getChildren()) {
            (child.containsRecurrence() ? recursive : factors).add(child);
        }
        if (recursive.size() > 1) {
            return List.of(RecurrenceTerm.unrecognized("product of recursive calls " + product));
        }
        List<RecurrenceTerm> terms = recursiveTerms(recursive.get(0));
        for (CostExpression factor : factors) {
            List<RecurrenceTerm> scaled = new ArrayList<>();
            for (RecurrenceTerm term : terms) {
                RecurrenceTerm repeated = repeat(term, factor);
                if (repeated == null) {
                    return List.of(RecurrenceTerm.unrecognized("recursive call repeated " + factor + " times"));
                }
                scaled.add(repeated);
            }
            terms = scaled;
        }
        return terms;
    }

    // term repeated once per unit of factor, or null when the repetition has no recurrence shape
    private RecurrenceTerm repeat(RecurrenceTerm term, CostExpression factor) {
        if (factor instanceof Constant) {
            return term.times(((Constant) factor).getValue());
        }
        GrowthOrder order = classifier.order(factor);
        if (order.isConstant()) {
            return term;
        }
        if (order.equals(GrowthOrder.LINEAR) && !term.isInputScaled()) {
            return term.scaledByInput();
        }
        return null;
    }

    private static boolean isOpaqueTerm(RecurrenceTerm term) {
        return term.getReduction() == RecurrenceTerm.Reduction.UNRECOGNIZED
                || term.getReduction() == RecurrenceTerm.Reduction.UNCHANGED;
    }

    // unsolvable terms outrank everything, then input scaling, then call count, then decrements over divisions
    private static final Comparator<List<RecurrenceTerm>> BRANCH_WEIGHT = Comparator
            .<List<RecurrenceTerm>, Boolean>comparing(terms -> terms.stream().anyMatch(CostExpressionBuilder::isOpaqueTerm))
            .thenComparing(terms -> terms.stream().anyMatch(RecurrenceTerm::isInputScaled))
            .thenComparingLong(terms -> terms.stream().mapToLong(RecurrenceTerm::getCoefficient).sum())
            .thenComparing(terms -> terms.stream()
                    .anyMatch(t -> t.getReduction() == RecurrenceTerm.Reduction.SUBTRACT));

    /**
     * Per-function traversal state.
     */
    static final class Frame {
        private final FunctionDefinition function;
        private final String signature;
        private final AnalysisRun run;
        private final Scope scope;
        private final List<String> warnings = new ArrayList<>();
        private Map<String, VariableState> environment = new LinkedHashMap<>();

        private Frame(FunctionDefinition function, AnalysisRun run) {
            this.function = function;
            this.signature = function.getSignature();
            this.run = run;
            this.scope = Scope.function(function.getName());
        }

        private void warn(String warning) {
            if (!warnings.contains(warning)) {
                warnings.add(warning);
            }
        }
    }
}
