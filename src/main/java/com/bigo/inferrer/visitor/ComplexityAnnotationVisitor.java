package com.bigo.inferrer.visitor;

import com.bigo.inferrer.model.FunctionComplexity;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Writes inferred complexities back into a parsed compilation unit as
 * {@code @Complexity} annotations. Methods that already carry one are left alone.
 */
public class ComplexityAnnotationVisitor extends VoidVisitorAdapter<Void> {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnnotationVisitor.class);

    public static final String ANNOTATION_NAME = "com.bigo.inferrer.annotations.Complexity";

    private final Map<MethodDeclaration, FunctionComplexity> results;
    private int annotatedMethods = 0;

    /**
     * @param results Inferred results keyed by the declarations they were inferred from;
     *                callers should pass an identity map since JavaParser nodes compare structurally
     */
    public ComplexityAnnotationVisitor(Map<MethodDeclaration, FunctionComplexity> results) {
        this.results = results;
    }

    @Override
    public void visit(MethodDeclaration methodDecl, Void arg) {
        FunctionComplexity result = results.get(methodDecl);
        if (result != null) {
            if (hasComplexityAnnotation(methodDecl)) {
                logger.debug("Method {} already has @Complexity, skipping", methodDecl.getNameAsString());
            } else {
                methodDecl.addAnnotation(createAnnotation(result));
                annotatedMethods++;
                logger.debug("Added @Complexity({}) to method: {}", result.getComplexity(),
                        methodDecl.getNameAsString());
            }
        }

        super.visit(methodDecl, arg);
    }

    private boolean hasComplexityAnnotation(MethodDeclaration methodDecl) {
        return methodDecl.getAnnotations().stream()
                .anyMatch(annotation -> annotation.getNameAsString().equals("Complexity")
                        || annotation.getNameAsString().equals(ANNOTATION_NAME));
    }

    private NormalAnnotationExpr createAnnotation(FunctionComplexity result) {
        NodeList<MemberValuePair> pairs = new NodeList<>();
        pairs.add(new MemberValuePair("time", stringLiteral(result.getComplexity().getNotation())));

        if (result.hasWarnings()) {
            NodeList<Expression> warnings = new NodeList<>();
            for (String warning : result.getWarnings()) {
                warnings.add(stringLiteral(warning));
            }
            pairs.add(new MemberValuePair("warnings", new ArrayInitializerExpr(warnings)));
        }

        return new NormalAnnotationExpr(new Name(ANNOTATION_NAME), pairs);
    }

    private static StringLiteralExpr stringLiteral(String value) {
        String escaped = value.replaceAll("\\s+", " ").replace("\\", "\\\\").replace("\"", "\\\"");
        return new StringLiteralExpr(escaped);
    }

    public boolean hasModifications() {
        return annotatedMethods > 0;
    }

    public int getAnnotatedMethods() {
        return annotatedMethods;
    }
}
