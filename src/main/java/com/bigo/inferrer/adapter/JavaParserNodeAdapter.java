package com.bigo.inferrer.adapter;

import com.bigo.inferrer.analysis.UnsupportedConstructException;
import com.bigo.inferrer.syntax.*;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Converts JavaParser method declarations into {@link FunctionDefinition}s.
 *
 * Side effects nested in expressions ({@code a[k] = b[j++]}) are hoisted into
 * separate assignments: prefix updates before the statement, postfix updates
 * after it. Canonical counting {@code for} loops become {@link ForLoop}s; any
 * other {@code for} shape becomes its initializers followed by a
 * {@link WhileLoop}. Exception handlers, lambdas, method references, local
 * classes and switch expressions have no mapping.
 */
public class JavaParserNodeAdapter implements NodeAdapter<MethodDeclaration> {

    private static final Logger logger = LoggerFactory.getLogger(JavaParserNodeAdapter.class);

    @Override
    public FunctionDefinition adapt(MethodDeclaration method) {
        BlockStmt body = method.getBody()
                .orElseThrow(() -> new IllegalArgumentException("Method has no body: " + method.getNameAsString()));
        List<String> parameters = new ArrayList<>();
        for (Parameter parameter : method.getParameters()) {
            parameters.add(parameter.getNameAsString());
        }
        FunctionDefinition function = new FunctionDefinition(method.getNameAsString(), parameters, block(body));
        logger.trace("Adapted {}: {}", function.getSignature(), function.getBody());
        return function;
    }

    // ---- statements ----

    private Sequence block(BlockStmt block) {
        return sequence(block.getStatements());
    }

    private Sequence sequence(List<Statement> statements) {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (Statement statement : statements) {
            nodes.addAll(statement(statement));
        }
        return new Sequence(nodes);
    }

    private SyntaxNode body(Statement statement) {
        List<SyntaxNode> nodes = statement(statement);
        return nodes.size() == 1 && nodes.get(0) instanceof Sequence ? nodes.get(0) : new Sequence(nodes);
    }

    private List<SyntaxNode> statement(Statement statement) {
        if (statement instanceof BlockStmt) {
            return List.of(block((BlockStmt) statement));
        }
        if (statement instanceof ExpressionStmt) {
            return expressionStatement(((ExpressionStmt) statement).getExpression());
        }
        if (statement instanceof IfStmt) {
            return ifStatement((IfStmt) statement);
        }
        if (statement instanceof ForStmt) {
            return forStatement((ForStmt) statement);
        }
        if (statement instanceof ForEachStmt) {
            return List.of(forEachStatement((ForEachStmt) statement));
        }
        if (statement instanceof WhileStmt) {
            WhileStmt whileStmt = (WhileStmt) statement;
            return List.of(loop(whileStmt.getCondition(), whileStmt.getBody(), List.of()));
        }
        if (statement instanceof DoStmt) {
            DoStmt doStmt = (DoStmt) statement;
            return List.of(loop(doStmt.getCondition(), doStmt.getBody(), List.of()));
        }
        if (statement instanceof ReturnStmt) {
            Optional<Expression> value = ((ReturnStmt) statement).getExpression();
            if (value.isEmpty()) {
                return List.of(new Return(null));
            }
            return withEffects(effects -> new Return(expression(value.get(), effects)));
        }
        if (statement instanceof ThrowStmt) {
            // leaves the function like a return
            return withEffects(effects -> new Return(expression(((ThrowStmt) statement).getExpression(), effects)));
        }
        if (statement instanceof BreakStmt || statement instanceof ContinueStmt || statement instanceof EmptyStmt) {
            return List.of(new Sequence(List.of()));
        }
        if (statement instanceof SwitchStmt) {
            return switchStatement((SwitchStmt) statement);
        }
        if (statement instanceof LabeledStmt) {
            return statement(((LabeledStmt) statement).getStatement());
        }
        if (statement instanceof SynchronizedStmt) {
            return List.of(block(((SynchronizedStmt) statement).getBody()));
        }
        if (statement instanceof AssertStmt) {
            return withEffects(effects -> new OpaqueValue("assert",
                    List.of(expression(((AssertStmt) statement).getCheck(), effects))));
        }
        if (statement instanceof TryStmt) {
            throw new UnsupportedConstructException("try statement");
        }
        if (statement instanceof LocalClassDeclarationStmt || statement instanceof LocalRecordDeclarationStmt) {
            throw new UnsupportedConstructException("local class");
        }
        if (statement instanceof YieldStmt) {
            throw new UnsupportedConstructException("yield statement");
        }
        throw new UnsupportedConstructException(statement.getClass().getSimpleName());
    }

    private List<SyntaxNode> expressionStatement(Expression expression) {
        if (expression instanceof VariableDeclarationExpr) {
            List<SyntaxNode> nodes = new ArrayList<>();
            for (VariableDeclarator declarator : ((VariableDeclarationExpr) expression).getVariables()) {
                if (declarator.getInitializer().isPresent()) {
                    Effects effects = new Effects();
                    SyntaxNode value = expression(declarator.getInitializer().get(), effects);
                    nodes.addAll(effects.wrap(new Assignment(declarator.getNameAsString(), value)));
                }
            }
            return nodes;
        }
        Effects effects = new Effects();
        return effects.wrap(sideEffect(expression, effects));
    }

    // an expression evaluated for its effect; a bare update becomes the assignment itself
    private SyntaxNode sideEffect(Expression expression, Effects effects) {
        if (expression instanceof UnaryExpr && isUpdate((UnaryExpr) expression)
                && ((UnaryExpr) expression).getExpression() instanceof NameExpr) {
            return update((UnaryExpr) expression);
        }
        if (expression instanceof AssignExpr) {
            return assignment((AssignExpr) expression, effects);
        }
        return expression(expression, effects);
    }

    private SyntaxNode assignment(AssignExpr assign, Effects effects) {
        SyntaxNode value = expression(assign.getValue(), effects);
        if (!(assign.getTarget() instanceof NameExpr)) {
            SyntaxNode target = expression(assign.getTarget(), effects);
            return new OpaqueValue("store " + assign.getTarget(), List.of(target, value));
        }
        String name = ((NameExpr) assign.getTarget()).getNameAsString();
        if (assign.getOperator() == AssignExpr.Operator.ASSIGN) {
            return new Assignment(name, value);
        }
        Identifier current = new Identifier(name);
        Optional<BinaryExpr.Operator> operator = assign.getOperator().toBinaryOperator();
        BinaryOperation.Operator mapped = operator.map(JavaParserNodeAdapter::operator).orElse(null);
        if (mapped == null) {
            return new Assignment(name, new OpaqueValue(assign.toString(), List.of(current, value)));
        }
        return new Assignment(name, new BinaryOperation(mapped, current, value));
    }

    private static boolean isUpdate(UnaryExpr unary) {
        return unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                || unary.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT
                || unary.getOperator() == UnaryExpr.Operator.PREFIX_DECREMENT
                || unary.getOperator() == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    private static Assignment update(UnaryExpr unary) {
        String name = ((NameExpr) unary.getExpression()).getNameAsString();
        boolean increment = unary.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                || unary.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT;
        BinaryOperation.Operator operator = increment ? BinaryOperation.Operator.PLUS : BinaryOperation.Operator.MINUS;
        return new Assignment(name, new BinaryOperation(operator, new Identifier(name), Literal.of(1)));
    }

    private List<SyntaxNode> ifStatement(IfStmt ifStmt) {
        Effects effects = new Effects();
        SyntaxNode condition = expression(ifStmt.getCondition(), effects);
        SyntaxNode thenBranch = body(ifStmt.getThenStmt());
        SyntaxNode elseBranch = ifStmt.getElseStmt().map(this::body).orElse(null);
        return effects.wrap(new Conditional(condition, thenBranch, elseBranch));
    }

    private List<SyntaxNode> forStatement(ForStmt forStmt) {
        Optional<ForLoop> canonical = canonicalFor(forStmt);
        if (canonical.isPresent()) {
            return List.of(canonical.get());
        }
        List<SyntaxNode> nodes = new ArrayList<>();
        for (Expression initializer : forStmt.getInitialization()) {
            nodes.addAll(expressionStatement(initializer));
        }
        List<SyntaxNode> updates = new ArrayList<>();
        for (Expression update : forStmt.getUpdate()) {
            updates.addAll(expressionStatement(update));
        }
        Expression condition = forStmt.getCompare().orElse(new BooleanLiteralExpr(true));
        nodes.add(loop(condition, forStmt.getBody(), updates));
        return nodes;
    }

    // for (i = start; i <op> stop; <single update of i>)
    private Optional<ForLoop> canonicalFor(ForStmt forStmt) {
        if (forStmt.getInitialization().size() != 1 || forStmt.getUpdate().size() != 1
                || forStmt.getCompare().isEmpty() || !(forStmt.getCompare().get() instanceof BinaryExpr)) {
            return Optional.empty();
        }
        String iterator;
        Expression startExpression;
        Expression initializer = forStmt.getInitialization().get(0);
        if (initializer instanceof VariableDeclarationExpr
                && ((VariableDeclarationExpr) initializer).getVariables().size() == 1) {
            VariableDeclarator declarator = ((VariableDeclarationExpr) initializer).getVariable(0);
            if (declarator.getInitializer().isEmpty()) {
                return Optional.empty();
            }
            iterator = declarator.getNameAsString();
            startExpression = declarator.getInitializer().get();
        } else if (initializer instanceof AssignExpr
                && ((AssignExpr) initializer).getOperator() == AssignExpr.Operator.ASSIGN
                && ((AssignExpr) initializer).getTarget() instanceof NameExpr) {
            iterator = ((NameExpr) ((AssignExpr) initializer).getTarget()).getNameAsString();
            startExpression = ((AssignExpr) initializer).getValue();
        } else {
            return Optional.empty();
        }

        BinaryExpr compare = (BinaryExpr) forStmt.getCompare().get();
        BinaryOperation.Operator comparison = operator(compare.getOperator());
        if (comparison == null || !comparison.isComparison() || comparison == BinaryOperation.Operator.EQUALS) {
            return Optional.empty();
        }
        Expression stopExpression;
        if (isName(compare.getLeft(), iterator)) {
            stopExpression = compare.getRight();
        } else if (isName(compare.getRight(), iterator)) {
            stopExpression = compare.getLeft();
            comparison = comparison.mirror();
        } else {
            return Optional.empty();
        }

        List<SyntaxNode> update = expressionStatement(forStmt.getUpdate().get(0));
        if (update.size() != 1 || !(update.get(0) instanceof Assignment)
                || !((Assignment) update.get(0)).getTarget().equals(iterator)) {
            return Optional.empty();
        }
        Effects effects = new Effects();
        SyntaxNode start = expression(startExpression, effects);
        SyntaxNode stop = expression(stopExpression, effects);
        if (!effects.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ForLoop(iterator, start, stop, comparison, (Assignment) update.get(0),
                body(forStmt.getBody())));
    }

    private static boolean isName(Expression expression, String name) {
        return expression instanceof NameExpr && ((NameExpr) expression).getNameAsString().equals(name);
    }

    // for (T x : items) runs once per element of items
    private ForLoop forEachStatement(ForEachStmt forEach) {
        String element = forEach.getVariableDeclarator().getNameAsString();
        Effects effects = new Effects();
        SyntaxNode items = expression(forEach.getIterable(), effects);
        if (!effects.isEmpty()) {
            throw new UnsupportedConstructException("update inside for-each iterable");
        }
        SyntaxNode size = literalCount(forEach.getIterable())
                .<SyntaxNode>map(Literal::of)
                .orElseGet(() -> new Call("size", items, List.of()));
        Assignment next = new Assignment(element,
                new BinaryOperation(BinaryOperation.Operator.PLUS, new Identifier(element), Literal.of(1)));
        return new ForLoop(element, Literal.of(0), size, BinaryOperation.Operator.LESS, next, body(forEach.getBody()));
    }

    /**
     * Element count of a container spelled out in the source, e.g. {@code new int[]{1, 2}}
     * or {@code List.of("a", "b")}. Arguments of the factories must be literals, since
     * {@code Arrays.asList(array)} spreads its one argument.
     */
    private static Optional<Long> literalCount(Expression iterable) {
        if (iterable instanceof ArrayCreationExpr) {
            return ((ArrayCreationExpr) iterable).getInitializer()
                    .filter(initializer -> initializer.findFirst(MethodCallExpr.class).isEmpty())
                    .map(initializer -> (long) initializer.getValues().size());
        }
        if (iterable instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) iterable;
            String scope = call.getScope().map(Expression::toString).orElse("");
            String name = call.getNameAsString();
            boolean factory = name.equals("of") && (scope.equals("List") || scope.equals("Set"))
                    || name.equals("asList") && scope.equals("Arrays");
            if (factory && call.getArguments().stream().allMatch(Expression::isLiteralExpr)) {
                return Optional.of((long) call.getArguments().size());
            }
        }
        return Optional.empty();
    }

    // condition updates run once per iteration, ahead of the body
    private WhileLoop loop(Expression conditionExpression, Statement bodyStatement, List<SyntaxNode> trailing) {
        Effects effects = new Effects();
        SyntaxNode condition = expression(conditionExpression, effects);
        List<SyntaxNode> body = new ArrayList<>(effects.before);
        body.addAll(effects.after);
        body.add(body(bodyStatement));
        body.addAll(trailing);
        return new WhileLoop(condition, new Sequence(body));
    }

    // cases become a chain of conditionals on the selector; fall-through is not modeled
    private List<SyntaxNode> switchStatement(SwitchStmt switchStmt) {
        Effects effects = new Effects();
        SyntaxNode selector = expression(switchStmt.getSelector(), effects);
        SyntaxNode fallback = null;
        List<SyntaxNode> conditions = new ArrayList<>();
        List<SyntaxNode> branches = new ArrayList<>();
        for (SwitchEntry entry : switchStmt.getEntries()) {
            Sequence branch = sequence(entry.getStatements());
            if (entry.getLabels().isEmpty()) {
                fallback = branch;
                continue;
            }
            SyntaxNode condition = null;
            for (Expression label : entry.getLabels()) {
                SyntaxNode test = new BinaryOperation(BinaryOperation.Operator.EQUALS, selector,
                        expression(label, effects));
                condition = condition == null ? test
                        : new BinaryOperation(BinaryOperation.Operator.OR, condition, test);
            }
            conditions.add(condition);
            branches.add(branch);
        }
        SyntaxNode chain = fallback;
        for (int i = conditions.size() - 1; i >= 0; i--) {
            chain = new Conditional(conditions.get(i), branches.get(i), chain);
        }
        return effects.wrap(chain);
    }

    // ---- expressions ----

    private SyntaxNode expression(Expression expression, Effects effects) {
        if (expression instanceof IntegerLiteralExpr) {
            return Literal.of(((IntegerLiteralExpr) expression).asNumber().longValue());
        }
        if (expression instanceof LongLiteralExpr) {
            return Literal.of(((LongLiteralExpr) expression).asNumber().longValue());
        }
        if (expression instanceof LiteralExpr) {
            return new Literal(expression.toString());
        }
        if (expression instanceof NameExpr) {
            return new Identifier(((NameExpr) expression).getNameAsString());
        }
        if (expression instanceof ThisExpr) {
            return new Identifier("this");
        }
        if (expression instanceof SuperExpr) {
            return new Identifier("super");
        }
        if (expression instanceof EnclosedExpr) {
            return expression(((EnclosedExpr) expression).getInner(), effects);
        }
        if (expression instanceof CastExpr) {
            return expression(((CastExpr) expression).getExpression(), effects);
        }
        if (expression instanceof BinaryExpr) {
            return binary((BinaryExpr) expression, effects);
        }
        if (expression instanceof UnaryExpr) {
            return unary((UnaryExpr) expression, effects);
        }
        if (expression instanceof AssignExpr) {
            SyntaxNode assigned = assignment((AssignExpr) expression, effects);
            if (!(assigned instanceof Assignment)) {
                return assigned;
            }
            effects.before.add(assigned);
            return new Identifier(((Assignment) assigned).getTarget());
        }
        if (expression instanceof MethodCallExpr) {
            return methodCall((MethodCallExpr) expression, effects);
        }
        if (expression instanceof FieldAccessExpr) {
            return fieldAccess((FieldAccessExpr) expression, effects);
        }
        if (expression instanceof ArrayAccessExpr) {
            ArrayAccessExpr access = (ArrayAccessExpr) expression;
            return new OpaqueValue(access.toString(),
                    List.of(expression(access.getName(), effects), expression(access.getIndex(), effects)));
        }
        if (expression instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) expression;
            return new OpaqueValue(conditional.toString(), List.of(
                    expression(conditional.getCondition(), effects),
                    expression(conditional.getThenExpr(), effects),
                    expression(conditional.getElseExpr(), effects)));
        }
        if (expression instanceof ObjectCreationExpr) {
            ObjectCreationExpr creation = (ObjectCreationExpr) expression;
            if (creation.getAnonymousClassBody().isPresent()) {
                throw new UnsupportedConstructException("anonymous class");
            }
            return new Call("new " + creation.getType().getNameAsString(), null,
                    expressions(creation.getArguments(), effects));
        }
        if (expression instanceof ArrayCreationExpr) {
            ArrayCreationExpr creation = (ArrayCreationExpr) expression;
            List<SyntaxNode> operands = new ArrayList<>();
            creation.getLevels().forEach(level -> level.getDimension()
                    .ifPresent(dimension -> operands.add(expression(dimension, effects))));
            creation.getInitializer().ifPresent(init -> operands.add(expression(init, effects)));
            return new OpaqueValue(creation.toString(), operands);
        }
        if (expression instanceof ArrayInitializerExpr) {
            return new OpaqueValue(expression.toString(),
                    expressions(((ArrayInitializerExpr) expression).getValues(), effects));
        }
        if (expression instanceof InstanceOfExpr) {
            return new OpaqueValue(expression.toString(),
                    List.of(expression(((InstanceOfExpr) expression).getExpression(), effects)));
        }
        if (expression instanceof ClassExpr || expression instanceof TypeExpr) {
            return new OpaqueValue(expression.toString(), List.of());
        }
        if (expression instanceof LambdaExpr) {
            throw new UnsupportedConstructException("lambda");
        }
        if (expression instanceof MethodReferenceExpr) {
            throw new UnsupportedConstructException("method reference");
        }
        if (expression instanceof SwitchExpr) {
            throw new UnsupportedConstructException("switch expression");
        }
        throw new UnsupportedConstructException(expression.getClass().getSimpleName());
    }

    private List<SyntaxNode> expressions(NodeList<Expression> expressions, Effects effects) {
        List<SyntaxNode> nodes = new ArrayList<>();
        for (Expression expression : expressions) {
            nodes.add(expression(expression, effects));
        }
        return nodes;
    }

    private SyntaxNode binary(BinaryExpr binary, Effects effects) {
        SyntaxNode left = expression(binary.getLeft(), effects);
        SyntaxNode right = expression(binary.getRight(), effects);
        BinaryOperation.Operator operator = operator(binary.getOperator());
        if (operator == null) {
            return new OpaqueValue(binary.toString(), List.of(left, right));
        }
        return new BinaryOperation(operator, left, right);
    }

    private SyntaxNode unary(UnaryExpr unary, Effects effects) {
        if (isUpdate(unary)) {
            if (!(unary.getExpression() instanceof NameExpr)) {
                return new OpaqueValue(unary.toString(), List.of(expression(unary.getExpression(), effects)));
            }
            Assignment update = update(unary);
            if (unary.isPrefix()) {
                effects.before.add(update);
            } else {
                effects.after.add(update);
            }
            return new Identifier(update.getTarget());
        }
        SyntaxNode operand = expression(unary.getExpression(), effects);
        if (unary.getOperator() == UnaryExpr.Operator.PLUS) {
            return operand;
        }
        if (unary.getOperator() == UnaryExpr.Operator.MINUS && operand.isIntegerLiteral()) {
            return Literal.of(-operand.asLiteral().asLong());
        }
        return new OpaqueValue(unary.toString(), List.of(operand));
    }

    private SyntaxNode methodCall(MethodCallExpr call, Effects effects) {
        SyntaxNode receiver = null;
        if (call.getScope().isPresent()) {
            receiver = expression(call.getScope().get(), effects);
        }
        return new Call(call.getNameAsString(), receiver, expressions(call.getArguments(), effects));
    }

    // arr.length is a size call; other field reads are named values
    private SyntaxNode fieldAccess(FieldAccessExpr access, Effects effects) {
        if (access.getNameAsString().equals("length")) {
            return new Call("length", expression(access.getScope(), effects), List.of());
        }
        if (access.getScope() instanceof ThisExpr) {
            return new Identifier(access.getNameAsString());
        }
        return new Identifier(access.toString());
    }

    static BinaryOperation.Operator operator(BinaryExpr.Operator operator) {
        switch (operator) {
            case PLUS:
                return BinaryOperation.Operator.PLUS;
            case MINUS:
                return BinaryOperation.Operator.MINUS;
            case MULTIPLY:
                return BinaryOperation.Operator.MULTIPLY;
            case DIVIDE:
                return BinaryOperation.Operator.DIVIDE;
            case REMAINDER:
                return BinaryOperation.Operator.REMAINDER;
            case LEFT_SHIFT:
                return BinaryOperation.Operator.LEFT_SHIFT;
            case SIGNED_RIGHT_SHIFT:
            case UNSIGNED_RIGHT_SHIFT:
                return BinaryOperation.Operator.RIGHT_SHIFT;
            case LESS:
                return BinaryOperation.Operator.LESS;
            case LESS_EQUALS:
                return BinaryOperation.Operator.LESS_EQUALS;
            case GREATER:
                return BinaryOperation.Operator.GREATER;
            case GREATER_EQUALS:
                return BinaryOperation.Operator.GREATER_EQUALS;
            case EQUALS:
                return BinaryOperation.Operator.EQUALS;
            case NOT_EQUALS:
                return BinaryOperation.Operator.NOT_EQUALS;
            case AND:
                return BinaryOperation.Operator.AND;
            case OR:
                return BinaryOperation.Operator.OR;
            default:
                return null;
        }
    }

    private List<SyntaxNode> withEffects(Function<Effects, SyntaxNode> conversion) {
        Effects effects = new Effects();
        SyntaxNode node = conversion.apply(effects);
        return effects.wrap(node);
    }

    /**
     * Updates hoisted out of an expression.
     */
    private static final class Effects {
        private final List<SyntaxNode> before = new ArrayList<>();
        private final List<SyntaxNode> after = new ArrayList<>();

        boolean isEmpty() {
            return before.isEmpty() && after.isEmpty();
        }

        List<SyntaxNode> wrap(SyntaxNode node) {
            List<SyntaxNode> nodes = new ArrayList<>(before);
            if (node != null) {
                nodes.add(node);
            }
            nodes.addAll(after);
            return nodes;
        }
    }
}
