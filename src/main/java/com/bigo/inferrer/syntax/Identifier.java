package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

public final class Identifier extends SyntaxNode {

    private final String name;

    public Identifier(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    @Override
    public Kind getKind() {
        return Kind.IDENTIFIER;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Identifier && ((Identifier) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
