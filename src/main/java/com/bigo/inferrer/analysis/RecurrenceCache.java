package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.RecurrenceRelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Recurrences of one analysis run keyed by the defining function's signature,
 * with their solutions memoized so every reference to the same recurrence
 * classifies identically.
 */
public class RecurrenceCache {

    private final Map<String, RecurrenceRelation> relations = new ConcurrentHashMap<>();
    private final Map<String, Solution> solutions = new ConcurrentHashMap<>();

    public void register(String functionId, RecurrenceRelation relation) {
        relations.put(functionId, relation);
        solutions.remove(functionId);
    }

    public Optional<RecurrenceRelation> getRelation(String functionId) {
        return Optional.ofNullable(relations.get(functionId));
    }

    Optional<Solution> getSolution(String functionId) {
        return Optional.ofNullable(solutions.get(functionId));
    }

    void putSolution(String functionId, Solution solution) {
        solutions.put(functionId, solution);
    }

    public int size() {
        return relations.size();
    }

    /**
     * Solved order of a recurrence together with the warnings solving it produced.
     */
    static final class Solution {
        private final GrowthOrder order;
        private final List<String> warnings;

        Solution(GrowthOrder order, List<String> warnings) {
            this.order = order;
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        GrowthOrder getOrder() {
            return order;
        }

        List<String> getWarnings() {
            return warnings;
        }
    }
}
