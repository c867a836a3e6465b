package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Optional;

/**
 * Exit from the enclosing function, with or without a value.
 */
public final class Return extends SyntaxNode {

    private final SyntaxNode value;

    public Return(SyntaxNode value) {
        this.value = value;
    }

    public Optional<SyntaxNode> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public Kind getKind() {
        return Kind.RETURN;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return value != null ? List.of(value) : List.of();
    }

    @Override
    public String toString() {
        return value != null ? "return " + value : "return";
    }
}
