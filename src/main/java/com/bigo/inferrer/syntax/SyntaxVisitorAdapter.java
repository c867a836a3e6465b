package com.bigo.inferrer.syntax;

/**
 * Visitor that walks every child of every node and returns nothing.
 * Subclasses override the kinds they care about and call {@code super} to keep descending.
 *
 * @param <A> The argument passed down the traversal
 */
public abstract class SyntaxVisitorAdapter<A> implements SyntaxVisitor<Void, A> {

    protected void visitChildren(SyntaxNode node, A arg) {
        for (SyntaxNode child : node.getChildNodes()) {
            child.accept(this, arg);
        }
    }

    @Override
    public Void visit(Sequence node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(Conditional node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(ForLoop node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(WhileLoop node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(Call node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(Assignment node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(Literal node, A arg) {
        return null;
    }

    @Override
    public Void visit(Identifier node, A arg) {
        return null;
    }

    @Override
    public Void visit(Return node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(BinaryOperation node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(OpaqueValue node, A arg) {
        visitChildren(node, arg);
        return null;
    }

    @Override
    public Void visit(FunctionDefinition node, A arg) {
        visitChildren(node, arg);
        return null;
    }
}
