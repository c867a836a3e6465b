package com.bigo.inferrer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Function or method call. The callee is referenced by name only; recursion is
 * resolved by looking the name up, never by a pointer to the callee's tree.
 */
public final class Call extends SyntaxNode {

    private final String callee;
    private final SyntaxNode receiver;
    private final List<SyntaxNode> arguments;

    public Call(String callee, SyntaxNode receiver, List<SyntaxNode> arguments) {
        this.callee = Objects.requireNonNull(callee, "callee");
        this.receiver = receiver;
        this.arguments = List.copyOf(arguments);
    }

    public String getCallee() {
        return callee;
    }

    public Optional<SyntaxNode> getReceiver() {
        return Optional.ofNullable(receiver);
    }

    public List<SyntaxNode> getArguments() {
        return arguments;
    }

    /**
     * Lookup key of the callee, {@code name/arity}.
     */
    public String getSignature() {
        return FunctionDefinition.signatureOf(callee, arguments.size());
    }

    /**
     * Whether the call can target a function of the analyzed module: no receiver, or {@code this}.
     */
    public boolean isUnqualified() {
        return receiver == null || (receiver.isIdentifier() && receiver.asIdentifier().getName().equals("this"));
    }

    @Override
    public Kind getKind() {
        return Kind.CALL;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        List<SyntaxNode> children = new ArrayList<>(arguments.size() + 1);
        if (receiver != null) {
            children.add(receiver);
        }
        children.addAll(arguments);
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Call)) {
            return false;
        }
        Call other = (Call) o;
        return callee.equals(other.callee) && Objects.equals(receiver, other.receiver)
                && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(callee, receiver, arguments);
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(SyntaxNode::toString).collect(Collectors.joining(", "));
        return (receiver != null ? receiver + "." : "") + callee + "(" + args + ")";
    }
}
