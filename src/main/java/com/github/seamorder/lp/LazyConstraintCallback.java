package com.github.seamorder.lp;

import java.util.List;

/**
 * Invoked by a {@link SolverEngine} on every new integer-feasible candidate. Implementations must not modify
 * solver state directly; any constraints they return are appended to the model for the rest of the search.
 */
@FunctionalInterface
public interface LazyConstraintCallback {
    /**
     * @param candidate the integer-feasible assignment just found
     * @return lazy constraints violated by the candidate, or an empty list to accept it
     */
    List<LinearConstraint> onCandidate(Candidate candidate);
}
