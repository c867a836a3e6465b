package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Counted loop: {@code iterator} starts at {@code start}, runs while
 * {@code iterator <comparison> stop} holds, and is advanced by {@code update}
 * after every iteration of {@code body}.
 */
public final class ForLoop extends SyntaxNode {

    private final String iterator;
    private final SyntaxNode start;
    private final SyntaxNode stop;
    private final BinaryOperation.Operator comparison;
    private final Assignment update;
    private final SyntaxNode body;

    public ForLoop(String iterator, SyntaxNode start, SyntaxNode stop, BinaryOperation.Operator comparison,
                   Assignment update, SyntaxNode body) {
        this.iterator = Objects.requireNonNull(iterator, "iterator");
        this.start = Objects.requireNonNull(start, "start");
        this.stop = Objects.requireNonNull(stop, "stop");
        this.comparison = Objects.requireNonNull(comparison, "comparison");
        this.update = Objects.requireNonNull(update, "update");
        this.body = Objects.requireNonNull(body, "body");
        if (!comparison.isComparison() || comparison == BinaryOperation.Operator.EQUALS) {
            throw new IllegalArgumentException("Not a loop comparison: " + comparison);
        }
        if (!update.getTarget().equals(iterator)) {
            throw new IllegalArgumentException("Update assigns " + update.getTarget() + ", not iterator " + iterator);
        }
    }

    public String getIterator() {
        return iterator;
    }

    public SyntaxNode getStart() {
        return start;
    }

    public SyntaxNode getStop() {
        return stop;
    }

    public BinaryOperation.Operator getComparison() {
        return comparison;
    }

    public Assignment getUpdate() {
        return update;
    }

    public SyntaxNode getBody() {
        return body;
    }

    @Override
    public Kind getKind() {
        return Kind.FOR_LOOP;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of(start, stop, update, body);
    }

    @Override
    public String toString() {
        return "for (" + iterator + " = " + start + "; " + iterator + " " + comparison.asString() + " " + stop
                + "; " + update + ") " + body;
    }
}
