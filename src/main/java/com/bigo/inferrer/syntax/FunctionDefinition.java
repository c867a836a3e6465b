package com.bigo.inferrer.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Root of one analysis unit: a named function with its parameters and body.
 */
public final class FunctionDefinition extends SyntaxNode {

    private final String name;
    private final List<String> parameters;
    private final SyntaxNode body;

    public FunctionDefinition(String name, List<String> parameters, SyntaxNode body) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public SyntaxNode getBody() {
        return body;
    }

    /**
     * Lookup key used by call resolution, {@code name/arity}.
     */
    public String getSignature() {
        return signatureOf(name, parameters.size());
    }

    public static String signatureOf(String name, int arity) {
        return name + "/" + arity;
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION_DEFINITION;
    }

    @Override
    public <R, A> R accept(SyntaxVisitor<R, A> visitor, A arg) {
        return visitor.visit(this, arg);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return List.of(body);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameters) + ") " + body;
    }
}
