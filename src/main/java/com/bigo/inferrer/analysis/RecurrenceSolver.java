package com.bigo.inferrer.analysis;

import com.bigo.inferrer.model.ComplexityClass;
import com.bigo.inferrer.model.GrowthOrder;
import com.bigo.inferrer.model.RecurrenceRelation;
import com.bigo.inferrer.model.RecurrenceTerm;
import com.bigo.inferrer.model.RecurrenceTerm.Reduction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed forms for the recurrence shapes the engine recognises: divide-and-conquer
 * (Master theorem, with Akra-Bazzi for unequal divisors), single decrement, and
 * repeated decrement. Any other shape solves to Unknown with a warning.
 */
public class RecurrenceSolver {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceSolver.class);

    private static final double EPSILON = 1e-9;
    private static final int BISECTION_STEPS = 200;

    /**
     * Solves {@code relation} to a canonical class.
     */
    public ComplexityClass solve(RecurrenceRelation relation) {
        return solveOrder(relation, new ArrayList<>()).toComplexityClass();
    }

    /**
     * Solves {@code relation} to a growth order.
     *
     * @param relation The recurrence
     * @param warnings Receives the reason whenever the result is Unknown
     * @return The growth order of {@code T(n)}
     */
    public GrowthOrder solveOrder(RecurrenceRelation relation, List<String> warnings) {
        GrowthOrder result = doSolve(relation, warnings);
        logger.debug("Solved {} as {}", relation, result);
        return result;
    }

    private GrowthOrder doSolve(RecurrenceRelation relation, List<String> warnings) {
        String name = relation.getFunctionName();
        GrowthOrder f = relation.getNonRecursiveCost();
        if (f.isUnknown()) {
            warnings.add("non-recursive cost of " + name + " is Unknown");
            return GrowthOrder.UNKNOWN;
        }
        for (RecurrenceTerm term : relation.getTerms()) {
            if (term.getReduction() == Reduction.UNRECOGNIZED) {
                warnings.add("unrecognized recursive call in " + name + ": " + term.getDescription());
                return GrowthOrder.UNKNOWN;
            }
            if (term.getReduction() == Reduction.UNCHANGED) {
                warnings.add("recursive call in " + name + " does not shrink its input");
                return GrowthOrder.UNKNOWN;
            }
        }
        if (relation.allTermsAre(Reduction.DIVIDE)) {
            return divideAndConquer(relation, f, warnings);
        }
        if (relation.allTermsAre(Reduction.SUBTRACT)) {
            return decrement(relation, f, warnings);
        }
        warnings.add("no closed form for " + relation + ": mixed division and decrement terms");
        return GrowthOrder.UNKNOWN;
    }

    private GrowthOrder divideAndConquer(RecurrenceRelation relation, GrowthOrder f, List<String> warnings) {
        if (relation.getTerms().stream().anyMatch(RecurrenceTerm::isInputScaled)) {
            warnings.add("no closed form for " + relation + ": divided call repeated a growing number of times");
            return GrowthOrder.UNKNOWN;
        }
        double p = criticalExponent(relation.getTerms());
        if (!f.isPolynomial()) {
            return f;
        }
        int cmp = f.compareDegree(p);
        if (cmp < 0) {
            return GrowthOrder.polynomial(p, 0);
        }
        if (cmp == 0) {
            return GrowthOrder.polynomial(p, f.getLogPower() + 1);
        }
        return f;
    }

    /**
     * The exponent {@code p} with {@code sum(a_i / b_i^p) = 1}; {@code log_b(a)} when all divisors agree.
     */
    static double criticalExponent(List<RecurrenceTerm> terms) {
        long divisor = terms.get(0).getAmount();
        if (terms.stream().allMatch(t -> t.getAmount() == divisor)) {
            long a = terms.stream().mapToLong(RecurrenceTerm::getCoefficient).sum();
            return rounded(Math.log(a) / Math.log(divisor));
        }
        double low = 0;
        double high = 64;
        for (int i = 0; i < BISECTION_STEPS && high - low > EPSILON / 10; i++) {
            double mid = (low + high) / 2;
            if (akraBazzi(terms, mid) > 1) {
                low = mid;
            } else {
                high = mid;
            }
        }
        return rounded((low + high) / 2);
    }

    private static double akraBazzi(List<RecurrenceTerm> terms, double p) {
        double total = 0;
        for (RecurrenceTerm term : terms) {
            total += term.getCoefficient() * Math.pow(term.getAmount(), -p);
        }
        return total;
    }

    private static double rounded(double p) {
        double nearest = Math.rint(p);
        return Math.abs(p - nearest) < 1e-6 ? nearest : p;
    }

    private GrowthOrder decrement(RecurrenceRelation relation, GrowthOrder f, List<String> warnings) {
        List<RecurrenceTerm> terms = relation.getTerms();
        if (terms.stream().anyMatch(RecurrenceTerm::isInputScaled)) {
            if (terms.size() > 1) {
                warnings.add("no closed form for " + relation + ": several input-scaled decrement terms");
                return GrowthOrder.UNKNOWN;
            }
            // n * T(n - c): permutation-style recursion
            return GrowthOrder.FACTORIAL;
        }
        if (relation.totalCoefficient() == 1) {
            return GrowthOrder.LINEAR.times(f);
        }
        // a*T(n-c) with a >= 2, or several decrement terms: the call tree branches at every level
        return GrowthOrder.EXPONENTIAL.max(f);
    }
}
