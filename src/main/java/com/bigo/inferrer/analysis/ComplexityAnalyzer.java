package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.FunctionComplexity;
import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.cost.FunctionCost;
import com.bigo.inferrer.model.cost.RecurrenceRef;
import com.bigo.inferrer.model.RecurrenceTerm;
import com.bigo.inferrer.syntax.FunctionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Entry point of the inference engine. Analyzes one function, or a module
 * function by function with callees first so each caller reuses its callees'
 * classes. Every call starts a fresh {@link AnalysisRun}, so one analyzer can
 * serve concurrent callers.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    private final AnalysisOptions options;
    private final CostExpressionBuilder builder;
    private final ComplexityClassifier classifier;
    private final FunctionResultCache externals = new FunctionResultCache();

    public ComplexityAnalyzer() {
        this(AnalysisOptions.defaults());
    }

    public ComplexityAnalyzer(AnalysisOptions options) {
        this.options = options;
        this.classifier = new ComplexityClassifier(new RecurrenceSolver());
        this.builder = new CostExpressionBuilder(options, new VariableStateTracker(options), classifier);
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    /**
     * Makes a result from an earlier analysis, e.g. of another file, visible to later runs.
     * Functions analyzed in a run take precedence over registered ones.
     */
    public synchronized void registerExternal(FunctionComplexity result) {
        externals.put(result.getSignature(), result);
    }

    public FunctionComplexity analyzeFunction(FunctionDefinition function) {
        return analyzeFunction(function, CancellationToken.none());
    }

    /**
     * Analyzes a single function.
     *
     * @param function The function definition
     * @param cancellationToken Checked between top-level statements
     * @return The function's class and warnings
     * @throws UnsupportedConstructException If the function is unsupported and failing is configured
     * @throws AnalysisCancelledException If cancelled
     */
    public FunctionComplexity analyzeFunction(FunctionDefinition function, CancellationToken cancellationToken) {
        return analyzeModule(List.of(function), cancellationToken).get(0);
    }

    public List<FunctionComplexity> analyzeModule(List<FunctionDefinition> functions) {
        return analyzeModule(functions, CancellationToken.none());
    }

    /**
     * Analyzes every function of a module.
     *
     * @param functions The module's function definitions
     * @param cancellationToken Checked between functions and between top-level statements
     * @return One result per function, in the order given
     * @throws UnsupportedConstructException If a function is unsupported and failing is configured
     * @throws AnalysisCancelledException If cancelled; no partial results are returned
     */
    public List<FunctionComplexity> analyzeModule(List<FunctionDefinition> functions,
                                                  CancellationToken cancellationToken) {
        CallGraph callGraph = new CallGraphBuilder().buildFromFunctions(functions);
        FunctionResultCache results = new FunctionResultCache();
        synchronized (this) {
            results.putAll(externals);
        }
        AnalysisRun run = new AnalysisRun(callGraph, results, new RecurrenceCache(), cancellationToken);

        Map<String, FunctionDefinition> bySignature = new LinkedHashMap<>();
        for (FunctionDefinition function : functions) {
            if (bySignature.putIfAbsent(function.getSignature(), function) != null) {
                logger.warn("Duplicate definition of {}, keeping the first", function.getSignature());
            }
        }

        Map<String, FunctionComplexity> analyzed = new HashMap<>();
        for (String signature : callGraph.calleesFirstOrder()) {
            cancellationToken.throwIfCancelled();
            FunctionComplexity result = analyze(bySignature.get(signature), run);
            analyzed.put(signature, result);
            results.put(signature, result);
        }

        List<FunctionComplexity> ordered = new ArrayList<>();
        for (FunctionDefinition function : functions) {
            ordered.add(analyzed.get(function.getSignature()));
        }
        return ordered;
    }

    private FunctionComplexity analyze(FunctionDefinition function, AnalysisRun run) {
        String signature = function.getSignature();
        List<String> warnings = new ArrayList<>();
        FunctionComplexity result;
        try {
            if (run.getCallGraph().isInMutualRecursion(signature)) {
                throw new UnsupportedConstructException("mutual recursion");
            }
            FunctionCost cost = builder.build(function, run);
            warnings.addAll(cost.getWarnings());
            GrowthOrder order;
            if (cost.isRecursive()) {
                RecurrenceRef whole = new RecurrenceRef(signature, RecurrenceTerm.unchanged());
                order = classifier.order(whole, run.getRecurrences(), warnings);
            } else {
                order = classifier.order(cost.getExpression(), run.getRecurrences(), warnings);
            }
            String recurrence = cost.getRecurrence().map(Object::toString).orElse(null);
            result = new FunctionComplexity(function.getName(), signature, order, cost.getExpression().toString(),
                    recurrence, warnings);
        } catch (UnsupportedConstructException e) {
            if (options.isFailOnUnsupported()) {
                throw e;
            }
            warnings.add("unsupported construct: " + e.getConstruct());
            result = FunctionComplexity.unknown(function.getName(), signature, warnings);
        }

        for (String warning : result.getWarnings()) {
            logger.warn("{}: {}", signature, warning);
        }
        logger.debug("Analyzed {}: {}", signature, result.getComplexity());
        return result;
    }
}
