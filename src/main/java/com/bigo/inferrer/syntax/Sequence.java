package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Straight-line block of statements.
 */
public final class Sequence extends SyntaxNode {

    private final List<SyntaxNode> statements;

    public Sequence(List<SyntaxNode> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<SyntaxNode> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public Kind getKind() {
        return Kind.SEQUENCE;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return statements;
    }

    @Override
    public String toString() {
        return statements.stream().map(SyntaxNode::toString).collect(Collectors.joining("; ", "{", "}"));
    }
}
