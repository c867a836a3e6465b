package com.bigo.inferrer.syntax;

/**
 * Exhaustive visitor over the closed node set.
 *
 * @param <R> The result type
 * @param <A> The argument passed down the traversal
 */
public interface SyntaxVisitor<R, A> {

    R visit(Sequence node, A arg);

    R visit(Conditional node, A arg);

    R visit(ForLoop node, A arg);

    R visit(WhileLoop node, A arg);

    R visit(Call node, A arg);

    R visit(Assignment node, A arg);

    R visit(Literal node, A arg);

    R visit(Identifier node, A arg);

    R visit(Return node, A arg);

    R visit(BinaryOperation node, A arg);

    R visit(OpaqueValue node, A arg);

    R visit(FunctionDefinition node, A arg);
}
