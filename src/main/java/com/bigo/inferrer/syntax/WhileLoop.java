package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Condition-controlled loop.
 */
public final class WhileLoop extends SyntaxNode {

    private final SyntaxNode condition;
    private final SyntaxNode body;

    public WhileLoop(SyntaxNode condition, SyntaxNode body) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = Objects.requireNonNull(body, "body");
    }

    public SyntaxNode getCondition() {
        return condition;
    }

    public SyntaxNode getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.WHILE_LOOP;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of(condition, body);
    }

    @Override
    public String toString() {
        return "while (" + condition + ") " + body;
    }
}
