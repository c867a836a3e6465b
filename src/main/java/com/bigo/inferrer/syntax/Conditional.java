package com.bigo.inferrer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-way branch. A missing else branch behaves as an empty block.
 */
public final class Conditional extends SyntaxNode {

    private final SyntaxNode condition;
    private final SyntaxNode thenBranch;
    private final SyntaxNode elseBranch;

    public Conditional(SyntaxNode condition, SyntaxNode thenBranch, SyntaxNode elseBranch) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
        this.elseBranch = elseBranch;
    }

    public SyntaxNode getCondition() {
        return condition;
    }

    public SyntaxNode getThenBranch() {
        return thenBranch;
    }

    public Optional<SyntaxNode> getElseBranch() {
        return Optional.ofNullable(elseBranch);
    }

    @Override
    public Kind getKind() {
        return Kind.CONDITIONAL;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        List<SyntaxNode> children = new ArrayList<>(3);
        children.add(condition);
        children.add(thenBranch);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public String toString() {
        return "if (" + condition + ") " + thenBranch + (elseBranch != null ? " else " + elseBranch : "");
    }
}
