package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Literal constant. Only integer literals carry a numeric value; strings,
 * booleans and literal containers are kept as text.
 */
public final class Literal extends SyntaxNode {

    private final String text;

    public Literal(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public static Literal of(long value) {
        return new Literal(Long.toString(value));
    }

    public String getText() {
        return text;
    }

    public boolean isInteger() {
        try {
            Long.parseLong(text);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public long asLong() {
        if (!isInteger()) {
            throw new IllegalStateException("Not an integer literal: " + text);
        }
        return Long.parseLong(text);
    }

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
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
        return o instanceof Literal && ((Literal) o).text.equals(text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
