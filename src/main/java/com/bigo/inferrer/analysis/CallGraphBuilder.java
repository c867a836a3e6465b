package com.bigo.inferrer.analysis;

import com.bigo.inferrer.syntax.Call;
import com.bigo.inferrer.syntax.FunctionDefinition;
import com.bigo.inferrer.syntax.SyntaxVisitorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds a CallGraph by visiting every function of a module.
 * This runs before any function is analyzed.
 *
 * Only calls that can target a module function are recorded: calls without a
 * receiver, or on {@code this}.
 */
public class CallGraphBuilder extends SyntaxVisitorAdapter<CallGraph> {

    private static final Logger logger = LoggerFactory.getLogger(CallGraphBuilder.class);

    private String currentSignature = "";

    /**
     * Builds a call graph from the functions of one module.
     *
     * @param functions The function definitions
     * @return The constructed call graph
     */
    public CallGraph buildFromFunctions(List<FunctionDefinition> functions) {
        CallGraph callGraph = new CallGraph();

        for (FunctionDefinition function : functions) {
            callGraph.addFunction(function.getSignature());
        }
        for (FunctionDefinition function : functions) {
            function.accept(this, callGraph);
        }

        logger.debug("Call graph built: {}", callGraph.getStatistics());
        return callGraph;
    }

    @Override
    public Void visit(FunctionDefinition function, CallGraph callGraph) {
        String previousSignature = currentSignature;
        currentSignature = function.getSignature();

        super.visit(function, callGraph);
        currentSignature = previousSignature;
        return null;
    }

    @Override
    public Void visit(Call call, CallGraph callGraph) {
        if (!currentSignature.isEmpty() && call.isUnqualified()) {
            callGraph.addCall(currentSignature, call.getSignature());
            logger.trace("Call: {} -> {}", currentSignature, call.getSignature());
        }

        return super.visit(call, callGraph);
    }
}
