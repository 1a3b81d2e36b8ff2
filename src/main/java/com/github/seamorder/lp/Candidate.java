package com.github.seamorder.lp;

import java.math.BigDecimal;

/**
 * Read-only view of a variable assignment, either an integer-feasible candidate found during the search,
 * or the final solution.
 */
@FunctionalInterface
public interface Candidate {
    /**
     * Threshold above which a binary variable is considered set.
     */
    BigDecimal HALF = new BigDecimal("0.5");

    /**
     * @param variable a variable handle
     * @return the value of the variable in this assignment
     */
    BigDecimal get(int variable);

    /**
     * A binary variable is effectively 1 if its value rounds to 1. Solver output is only accurate up to the
     * configured tolerance, so an exact comparison with {@link BigDecimal#ONE} is not reliable.
     *
     * @param variable a variable handle
     * @return true if the variable is effectively set
     */
    default boolean isSet(int variable) {
        return get(variable).compareTo(HALF) > 0;
    }
}
