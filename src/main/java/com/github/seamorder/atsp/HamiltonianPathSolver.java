package com.github.seamorder.atsp;

import com.github.seamorder.image.CostMatrixBuilder;
import com.github.seamorder.image.Image;
import com.github.seamorder.lp.Solution;

import java.util.List;

/**
 * Abstract superclass for exact solvers of the minimum-cost Hamiltonian path problem on a directed graph.
 * <p>
 * The path is open: node 0 of the cost matrix is a depot with zero cost to and from every other node, so the
 * cheapest cycle through the depot is the cheapest path through the remaining nodes.
 */
public abstract class HamiltonianPathSolver {
    /**
     * Default constructor.
     */
    protected HamiltonianPathSolver() {
    }

    /**
     * Record type to hold a solution to the problem.
     *
     * @param state     {@link Solution.State#OPTIMAL}, or {@link Solution.State#FEASIBLE} if the search timed out
     * @param objective total cost of the ordering
     * @param order     node indexes 1..n in visiting order, excluding the depot
     */
    public record Result(Solution.State state, double objective, List<Integer> order) {
        /**
         * Convenience constructor to compute the objective based on the costs.
         *
         * @param state {@link Solution.State#OPTIMAL}, or {@link Solution.State#FEASIBLE} if the search timed out
         * @param costs the cost matrix
         * @param order node indexes 1..n in visiting order, excluding the depot
         */
        public Result(Solution.State state, CostMatrix costs, List<Integer> order) {
            this(state, costs.pathCost(order), List.copyOf(order));
        }
    }

    /**
     * Equivalent to <code>solve(costs, 1000L * 60L * 60L)</code>
     *
     * @param costs square matrix of directed costs; row and column 0 are the depot
     * @return the solution
     */
    public final Result solve(CostMatrix costs) {
        return solve(costs, 1000L * 60L * 60L);
    }

    /**
     * Solve for the cheapest ordering.
     *
     * @param costs         square matrix of directed costs; row and column 0 are the depot
     * @param timeoutMillis the maximum wall-clock time in milliseconds
     * @return the solution
     * @throws FormulationException if the matrix is not square, smaller than 2x2 or has negative entries
     */
    public final Result solve(CostMatrix costs, long timeoutMillis) {
        ModelFormulator.validate(costs);

        return doSolve(costs, timeoutMillis);
    }

    /**
     * Derive seam costs from the images and solve for the cheapest ordering.
     *
     * @param images        the images, all of the same size. Image <code>i</code> becomes node <code>i + 1</code>.
     * @param timeoutMillis the maximum wall-clock time in milliseconds
     * @return the solution
     */
    public final Result solve(List<Image> images, long timeoutMillis) {
        var builder = new CostMatrixBuilder();
        builder.setDebug(isDebug());

        return solve(builder.build(images), timeoutMillis);
    }

    /**
     * @return true if debug logging is enabled
     */
    public abstract boolean isDebug();

    /**
     * To be implemented by subclasses.
     *
     * @param costs   a validated cost matrix
     * @param timeout the maximum wall-clock time in milliseconds
     * @return the solution
     */
    protected abstract Result doSolve(CostMatrix costs, long timeout);
}
