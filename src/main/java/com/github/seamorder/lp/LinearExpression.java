package com.github.seamorder.lp;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.math.BigDecimal.ZERO;

/**
 * A weighted sum of variables, addressed by the integer handles returned from
 * {@link SolverEngine#newBinaryVariable(String)}. Terms keep their insertion order.
 */
public final class LinearExpression {
    private final Map<Integer, BigDecimal> terms = new LinkedHashMap<>();

    /**
     * Set the coefficient of a variable, replacing any previous coefficient.
     *
     * @param variable    the variable handle
     * @param coefficient the coefficient
     * @return this expression
     */
    public LinearExpression set(int variable, BigDecimal coefficient) {
        if (variable < 0) {
            throw new IllegalArgumentException("invalid variable handle: " + variable);
        }
        terms.put(variable, coefficient);
        return this;
    }

    /**
     * @return an unmodifiable view of the terms, keyed by variable handle
     */
    public Map<Integer, BigDecimal> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    /**
     * Evaluate this expression against a candidate assignment.
     *
     * @param candidate the variable values
     * @return the sum of coefficient times value over all terms
     */
    public BigDecimal evaluate(Candidate candidate) {
        var total = ZERO;

        for (var term : terms.entrySet()) {
            total = total.add(term.getValue().multiply(candidate.get(term.getKey())));
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LinearExpression && terms.equals(((LinearExpression) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        return terms.toString();
    }
}
