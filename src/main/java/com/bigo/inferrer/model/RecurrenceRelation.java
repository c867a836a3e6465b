package com.bigo.inferrer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Cost recurrence of a recursive function:
 * {@code T(n) = sum of recursive terms + f(n)}, with {@code T(base) = O(1)} implicit.
 * Terms with the same argument reduction are merged, so {@code T(n/2) + T(n/2)}
 * is stored as {@code 2T(n/2)}.
 */
public final class RecurrenceRelation {

    private final String functionName;
    private final List<RecurrenceTerm> terms;
    private final GrowthOrder nonRecursiveCost;

    /**
     * @param functionName The defining function
     * @param terms One term per recursive call site, at least one
     * @param nonRecursiveCost The class of everything in the body except the recursive calls
     * @throws IllegalStateException If there are no recursive terms, which means the builder emitted a
     *                               recurrence for a non-recursive function
     */
    public RecurrenceRelation(String functionName, List<RecurrenceTerm> terms, GrowthOrder nonRecursiveCost) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.nonRecursiveCost = Objects.requireNonNull(nonRecursiveCost, "nonRecursiveCost");
        if (terms.isEmpty()) {
            throw new IllegalStateException("Recurrence for " + functionName + " has no recursive terms");
        }
        this.terms = Collections.unmodifiableList(merge(terms));
    }

    private static List<RecurrenceTerm> merge(List<RecurrenceTerm> terms) {
        List<RecurrenceTerm> merged = new ArrayList<>();
        for (RecurrenceTerm term : terms) {
            boolean absorbed = false;
            for (int i = 0; i < merged.size(); i++) {
                if (merged.get(i).sameShape(term)) {
                    merged.set(i, merged.get(i).plus(term));
                    absorbed = true;
                    break;
                }
            }
            if (!absorbed) {
                merged.add(term);
            }
        }
        return merged;
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<RecurrenceTerm> getTerms() {
        return terms;
    }

    public GrowthOrder getNonRecursiveCost() {
        return nonRecursiveCost;
    }

    public boolean allTermsAre(RecurrenceTerm.Reduction reduction) {
        return terms.stream().allMatch(term -> term.getReduction() == reduction);
    }

    public boolean anyTermIs(RecurrenceTerm.Reduction reduction) {
        return terms.stream().anyMatch(term -> term.getReduction() == reduction);
    }

    /**
     * Total number of recursive calls per invocation, ignoring input-scaled repetition.
     */
    public long totalCoefficient() {
        return terms.stream().mapToLong(RecurrenceTerm::getCoefficient).sum();
    }

    @Override
    public String toString() {
        String recursive = terms.stream().map(RecurrenceTerm::toString).collect(Collectors.joining(" + "));
        return "T(n) = " + recursive + " + " + nonRecursiveCost.toNotation();
    }
}
