package com.github.seamorder.atsp;

import com.github.seamorder.lp.OjAlgoSolverEngine;
import com.github.seamorder.lp.SolverException;
import org.ojalgo.netio.BasicLogger;

import static com.github.seamorder.Util.toSeconds;

/**
 * Branch-and-cut solver built on ojAlgo: the assignment relaxation from {@link ModelFormulator}, repaired by
 * lazy subtour cuts from {@link SubtourEliminationCallback}.
 */
public class OjAlgoHamiltonianPathSolver extends HamiltonianPathSolver {
    private boolean debug;
    private CutStrategy cutStrategy = CutStrategy.DEPOT_CYCLE;

    /**
     * Default constructor
     */
    public OjAlgoHamiltonianPathSolver() {
    }

    @Override
    protected Result doSolve(CostMatrix costs, long timeout) {
        var start = System.currentTimeMillis();
        var engine = new OjAlgoSolverEngine(start + timeout);
        engine.setDebug(debug);

        var formulation = ModelFormulator.formulate(costs, engine, cutStrategy);
        var solution = engine.optimize();
        var result = new Result(solution.state(), costs, PathReconstructor.reconstruct(formulation, solution.values()));

        debug("[" + toSeconds(System.currentTimeMillis() - start) + "s] " + solution.state() + " after " +
                solution.rounds() + " rounds, " + solution.cuts() + " cuts: " + result.order());

        if (Math.abs(solution.objective() - result.objective()) > 1e-6 * Math.max(1.0, result.objective())) {
            throw new SolverException("Reported objective " + solution.objective() +
                    " does not match path cost " + result.objective());
        }
        return result;
    }

    private void debug(String s) {
        if (debug) {
            BasicLogger.debug(s);
        }
    }

    /**
     * Get the debug property
     *
     * @return true if debug logging is enabled
     */
    @Override
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     * You can supply a thin wrapper implementation to redirect it to the logging library of your choice.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    /**
     * @return the configured cut strategy
     * @see #setCutStrategy(CutStrategy)
     */
    @SuppressWarnings("unused")
    public CutStrategy getCutStrategy() {
        return cutStrategy;
    }

    /**
     * Choose which cycles are cut when a candidate is not a single tour. The default,
     * {@link CutStrategy#DEPOT_CYCLE}, cuts only the cycle through the depot.
     *
     * @param cutStrategy the strategy
     */
    public void setCutStrategy(CutStrategy cutStrategy) {
        this.cutStrategy = cutStrategy;
    }
}
