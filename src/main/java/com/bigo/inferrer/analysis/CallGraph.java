package com.bigo.inferrer.analysis;

import java.util.*;

/**
 * Call relationships between the functions of one module, keyed by
 * {@code name/arity} signatures.
 *
 * This enables:
 * - Analyzing callees before their callers, so callers reuse callee results
 * - Recognising direct recursion (a self edge)
 * - Rejecting mutual recursion (a cycle through two or more functions)
 */
public class CallGraph {

    // Functions defined in the module, in definition order
    private final Set<String> functions = new LinkedHashSet<>();

    // Call edges: caller -> set of callees
    private final Map<String, Set<String>> functionCalls = new HashMap<>();

    // Reverse call edges: callee -> set of callers
    private final Map<String, Set<String>> calledBy = new HashMap<>();

    /**
     * Records a function defined in the module.
     *
     * @param signature The function signature
     */
    public void addFunction(String signature) {
        functions.add(signature);
    }

    /**
     * Records a call from caller to callee.
     *
     * @param callerSignature The calling function's signature
     * @param calleeSignature The called function's signature
     */
    public void addCall(String callerSignature, String calleeSignature) {
        functionCalls.computeIfAbsent(callerSignature, k -> new LinkedHashSet<>()).add(calleeSignature);
        calledBy.computeIfAbsent(calleeSignature, k -> new LinkedHashSet<>()).add(callerSignature);
    }

    public Set<String> getFunctions() {
        return Collections.unmodifiableSet(functions);
    }

    public boolean isDefined(String signature) {
        return functions.contains(signature);
    }

    /**
     * Gets all functions called by a given function.
     *
     * @param signature The function signature
     * @return Set of callee signatures, or empty set if none
     */
    public Set<String> getCallees(String signature) {
        return functionCalls.getOrDefault(signature, Collections.emptySet());
    }

    /**
     * Gets all functions that call a given function.
     *
     * @param signature The function signature
     * @return Set of caller signatures, or empty set if none
     */
    public Set<String> getCallers(String signature) {
        return calledBy.getOrDefault(signature, Collections.emptySet());
    }

    /**
     * Whether the function calls itself directly.
     */
    public boolean isDirectlyRecursive(String signature) {
        return getCallees(signature).contains(signature);
    }

    /**
     * Whether {@code target} can be reached from {@code source} through one or more calls.
     */
    public boolean reaches(String source, String target) {
        Deque<String> pending = new ArrayDeque<>(getCallees(source));
        Set<String> seen = new HashSet<>();
        while (!pending.isEmpty()) {
            String current = pending.pop();
            if (current.equals(target)) {
                return true;
            }
            if (seen.add(current)) {
                pending.addAll(getCallees(current));
            }
        }
        return false;
    }

    /**
     * Whether the two distinct functions call each other, directly or through others.
     */
    public boolean isMutuallyRecursive(String first, String second) {
        return !first.equals(second) && reaches(first, second) && reaches(second, first);
    }

    /**
     * Whether the function lies on a call cycle through at least one other defined function.
     */
    public boolean isInMutualRecursion(String signature) {
        for (String other : functions) {
            if (isMutuallyRecursive(signature, other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Orders the defined functions so that every callee comes before its callers.
     * Functions on a cycle keep their definition order relative to each other.
     *
     * @return The defined signatures, callees first
     */
    public List<String> calleesFirstOrder() {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String signature : functions) {
            visitCalleesFirst(signature, visited, order);
        }
        return order;
    }

    private void visitCalleesFirst(String signature, Set<String> visited, List<String> order) {
        if (!visited.add(signature)) {
            return;
        }
        for (String callee : getCallees(signature)) {
            if (functions.contains(callee)) {
                visitCalleesFirst(callee, visited, order);
            }
        }
        order.add(signature);
    }

    /**
     * Gets statistics about the call graph.
     */
    public String getStatistics() {
        int totalCalls = functionCalls.values().stream().mapToInt(Set::size).sum();
        long recursive = functions.stream().filter(this::isDirectlyRecursive).count();
        return String.format("CallGraph: %d functions, %d calls, %d directly recursive",
                functions.size(), totalCalls, recursive);
    }

    /**
     * Clears all data from the call graph.
     */
    public void clear() {
        functions.clear();
        functionCalls.clear();
        calledBy.clear();
    }
}
