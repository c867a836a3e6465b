package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * A value expression the engine has no rule for (array indexing, object
 * creation, casts, bitwise arithmetic). Its value is never modeled, but calls
 * among its operands still contribute cost.
 */
public final class OpaqueValue extends SyntaxNode {

    private final String text;
    private final List<SyntaxNode> operands;

    public OpaqueValue(String text, List<SyntaxNode> operands) {
        this.text = Objects.requireNonNull(text, "text");
        this.operands = List.copyOf(operands);
    }

    public String getText() {
        return text;
    }

    public List<SyntaxNode> getOperands() {
        return operands;
    }

    @Override
    public Kind getKind() {
        return Kind.OPAQUE_VALUE;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof OpaqueValue && ((OpaqueValue) o).text.equals(text);
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
