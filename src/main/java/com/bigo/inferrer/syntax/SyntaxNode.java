package com.bigo.inferrer.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Language-neutral syntax tree node consumed by the complexity engine.
 * The set of node kinds is closed: downstream components dispatch on
 * {@link #getKind()} or through a {@link SyntaxVisitor}, never on the shape of
 * the host language's AST.
 */
public abstract class SyntaxNode {

    /**
     * The abstract node kinds produced by a {@link com.bigo.inferrer.adapter.NodeAdapter}.
     */
    public enum Kind {
        SEQUENCE,
        CONDITIONAL,
        FOR_LOOP,
        WHILE_LOOP,
        CALL,
        ASSIGNMENT,
        LITERAL,
        IDENTIFIER,
        RETURN,
        BINARY_OPERATION,
        OPAQUE_VALUE,
        FUNCTION_DEFINITION
    }

    public abstract Kind getKind();

    public abstract <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg);

    /**
     * Direct children in evaluation order.
     */
    public abstract List<SyntaxNode> getChildNodes();

    /**
     * Finds every node of the given type in this subtree, this node included, in pre-order.
     *
     * @param type The node class to look for
     * @return Matching nodes, possibly empty
     */
    public <T extends SyntaxNode> List<T> findAll(Class<T> type) {
        List<T> found = new ArrayList<>();
        collect(this, type, found);
        return found;
    }

    private static <T extends SyntaxNode> void collect(SyntaxNode node, Class<T> type, List<T> found) {
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        for (SyntaxNode child : node.getChildNodes()) {
            collect(child, type, found);
        }
    }

    public boolean isLiteral() {
        return getKind() == Kind.LITERAL;
    }

    public boolean isIdentifier() {
        return getKind() == Kind.IDENTIFIER;
    }

    public boolean isBinaryOperation() {
        return getKind() == Kind.BINARY_OPERATION;
    }

    public boolean isCall() {
        return getKind() == Kind.CALL;
    }

    public Literal asLiteral() {
        return (Literal) this;
    }

    public Identifier asIdentifier() {
        return (Identifier) this;
    }

    public BinaryOperation asBinaryOperation() {
        return (BinaryOperation) this;
    }

    public Call asCall() {
        return (Call) this;
    }

    /**
     * True for an integer literal, the only literals the engine does arithmetic on.
     */
    public boolean isIntegerLiteral() {
        return isLiteral() && asLiteral().isInteger();
    }
}
