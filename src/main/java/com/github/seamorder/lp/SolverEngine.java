package com.github.seamorder.lp;

/**
 * The integer-programming services consumed by the ordering pipeline. Variables are addressed by the integer
 * handle returned at creation, in creation order starting from zero.
 * <p>
 * Variables, constraints and the objective may only be registered before {@link #optimize()} is called.
 * After that, the model is frozen and the only additions are the lazy constraints returned by the
 * {@link LazyConstraintCallback}.
 */
public interface SolverEngine {
    /**
     * Create a binary decision variable.
     *
     * @param name variable name, or null for a generated one
     * @return the variable handle
     */
    int newBinaryVariable(String name);

    /**
     * @return number of variables created so far
     */
    int getVariableCount();

    /**
     * Add a constraint that holds for the whole search.
     *
     * @param constraint the constraint
     */
    void addConstraint(LinearConstraint constraint);

    /**
     * Set a linear objective to be minimised.
     *
     * @param objective weighted sum of variables
     */
    void setObjective(LinearExpression objective);

    /**
     * Enable lazy-constraint mode and register the callback invoked on every new integer-feasible candidate.
     *
     * @param callback the callback
     */
    void setLazyCallback(LazyConstraintCallback callback);

    /**
     * Run the optimisation to completion (or until the engine's deadline.)
     *
     * @return the final assignment
     * @throws SolverException if no feasible assignment was found
     */
    Solution optimize();
}
