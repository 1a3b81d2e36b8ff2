package com.github.seamorder.lp;

/**
 * Thrown when the solver ends without a usable assignment (infeasible, unbounded, timed out without an
 * incumbent) or returns an assignment that contradicts the model.
 */
public class SolverException extends RuntimeException {
    /**
     * @param message detail message
     */
    public SolverException(String message) {
        super(message);
    }
}
