package com.bigo.inferrer.analysis;

import com.bigo.inferrer.syntax.FunctionDefinition;

import java.util.List;

/**
 * State shared by the functions of one analysis run. Runs never share state
 * with each other, so concurrent runs on one analyzer are independent.
 */
public final class AnalysisRun {

    private final CallGraph callGraph;
    private final FunctionResultCache results;
    private final RecurrenceCache recurrences;
    private final CancellationToken cancellationToken;

    public AnalysisRun(CallGraph callGraph, FunctionResultCache results, RecurrenceCache recurrences,
                       CancellationToken cancellationToken) {
        this.callGraph = callGraph;
        this.results = results;
        this.recurrences = recurrences;
        this.cancellationToken = cancellationToken;
    }

    /**
     * A run over the given functions with empty caches.
     */
    public static AnalysisRun of(List<FunctionDefinition> functions, CancellationToken cancellationToken) {
        return new AnalysisRun(new CallGraphBuilder().buildFromFunctions(functions), new FunctionResultCache(),
                new RecurrenceCache(), cancellationToken);
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    public FunctionResultCache getResults() {
        return results;
    }

    public RecurrenceCache getRecurrences() {
        return recurrences;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }
}
