package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Assignment of a value to a named variable. Compound forms such as
 * {@code x += c} are normalized by the adapter to {@code x = x + c}.
 */
public final class Assignment extends SyntaxNode {

    private final String target;
    private final SyntaxNode value;

    public Assignment(String target, SyntaxNode value) {
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getTarget() {
        return target;
    }

    public SyntaxNode getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.ASSIGNMENT;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of(value);
    }

    @Override
    public String toString() {
        return target + " = " + value;
    }
}
