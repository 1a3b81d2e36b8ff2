package com.github.seamorder.lp;

/**
 * The outcome of {@link SolverEngine#optimize()}.
 *
 * @param state     {@link State#OPTIMAL} or {@link State#FEASIBLE}
 * @param objective the objective value of the final assignment
 * @param values    the final variable assignment
 * @param rounds    number of candidates passed to the lazy-constraint callback
 * @param cuts      number of lazy constraints added during the search
 */
public record Solution(State state, double objective, Candidate values, int rounds, int cuts) {
    /**
     * Solution quality. Outcomes without an incumbent are reported via {@link SolverException} instead.
     */
    public enum State {
        /**
         * Feasible, but the search stopped (timeout) before proving optimality.
         */
        FEASIBLE,
        /**
         * Proven optimal.
         */
        OPTIMAL
    }
}
