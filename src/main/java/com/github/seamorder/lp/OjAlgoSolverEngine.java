package com.github.seamorder.lp;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.ojalgo.netio.BasicLogger;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static com.github.seamorder.Util.minimize;
import static com.github.seamorder.Util.newModel;
import static com.github.seamorder.Util.toSeconds;

/**
 * {@link SolverEngine} backed by ojAlgo's {@link ExpressionsBasedModel}.
 * <p>
 * ojAlgo has no native lazy-constraint hook, so this uses row generation instead: the model is solved to
 * integer optimality, the result is passed to the callback as a candidate, the returned constraints are
 * appended, and the model is solved again, until a candidate produces no constraints. Callback invocations
 * therefore happen one at a time, on the thread that called {@link #optimize()}.
 * <p>
 * Only binary variables are created, so every candidate handed to the callback must be 0/1 within
 * {@link #INTEGRALITY_TOLERANCE}; anything else is reported as a {@link SolverException}.
 */
public class OjAlgoSolverEngine implements SolverEngine {
    /**
     * Maximum distance from 0 or 1 for a value to count as integral.
     */
    public static final BigDecimal INTEGRALITY_TOLERANCE = new BigDecimal("1e-6");

    private final ExpressionsBasedModel model;
    private final long deadline;
    @GuardedBy("this")
    private final List<Variable> variables = new ArrayList<>();
    @GuardedBy("this")
    private LazyConstraintCallback callback;
    @GuardedBy("this")
    private boolean frozen;
    @GuardedBy("this")
    private int cuts;
    @GuardedBy("this")
    private boolean debug;

    /**
     * @param deadline wall-clock time in milliseconds after which the search is abandoned
     */
    public OjAlgoSolverEngine(long deadline) {
        this.deadline = deadline;
        this.model = newModel(deadline);
    }

    @Override
    public synchronized int newBinaryVariable(String name) {
        checkNotFrozen();

        var handle = variables.size();
        variables.add(model.newVariable(name == null ? "v" + handle : name).binary());
        return handle;
    }

    @Override
    public synchronized int getVariableCount() {
        return variables.size();
    }

    @Override
    public synchronized void addConstraint(LinearConstraint constraint) {
        checkNotFrozen();
        add(constraint);
    }

    @Override
    public synchronized void setObjective(LinearExpression objective) {
        checkNotFrozen();

        for (var term : objective.getTerms().entrySet()) {
            variable(term.getKey()).weight(term.getValue());
        }
    }

    @Override
    public synchronized void setLazyCallback(LazyConstraintCallback callback) {
        checkNotFrozen();
        this.callback = callback;
    }

    @Override
    public synchronized Solution optimize() {
        frozen = true;

        for (var rounds = 0; ; ) {
            var start = System.currentTimeMillis();
            var result = minimize(model, deadline);
            var elapsed = System.currentTimeMillis() - start;

            debug("[" + toSeconds(elapsed) + "s] " + result.getState() + " " + result.getValue());

            if (!result.getState().isFeasible()) {
                throw new SolverException("No feasible solution: " + result.getState());
            }

            var candidate = toCandidate(result);
            checkIntegral(candidate);

            if (callback == null) {
                return toSolution(result, candidate, rounds);
            }

            rounds++;
            var lazy = callback.onCandidate(candidate);

            if (lazy.isEmpty()) {
                return toSolution(result, candidate, rounds);
            }
            if (lazy.stream().allMatch(c -> c.isSatisfiedBy(candidate))) {
                throw new IllegalStateException("Lazy constraints do not cut off the candidate: " + lazy);
            }
            if (System.currentTimeMillis() >= deadline) {
                throw new SolverException("Deadline reached before a candidate satisfied all lazy constraints");
            }

            lazy.forEach(this::add);
            cuts += lazy.size();
            debug("Round " + rounds + ": added " + lazy.size() + " lazy constraints, " + cuts + " total");
        }
    }

    private Solution toSolution(Optimisation.Result result, Candidate candidate, int rounds) {
        var state = result.getState().isOptimal() ? Solution.State.OPTIMAL : Solution.State.FEASIBLE;

        return new Solution(state, result.getValue(), candidate, rounds, cuts);
    }

    private void checkIntegral(Candidate candidate) {
        for (var handle = 0; handle < variables.size(); handle++) {
            var value = candidate.get(handle);

            if (value.abs().compareTo(INTEGRALITY_TOLERANCE) > 0 &&
                    value.subtract(BigDecimal.ONE).abs().compareTo(INTEGRALITY_TOLERANCE) > 0) {
                throw new SolverException("Candidate is not integral: " + variables.get(handle).getName() +
                        " = " + value);
            }
        }
    }

    // results follow the model's variable order, so handles map directly onto result indexes.
    private static Candidate toCandidate(Optimisation.Result result) {
        return result::get;
    }

    private void add(LinearConstraint constraint) {
        if (model.getExpression(constraint.name()) != null) {
            throw new IllegalArgumentException("Duplicate constraint name: " + constraint.name());
        }

        var terms = new LinkedHashMap<Variable, BigDecimal>();
        constraint.lhs().getTerms().forEach((handle, coefficient) -> terms.put(variable(handle), coefficient));

        var expr = model.newExpression(constraint.name());

        for (var term : terms.entrySet()) {
            expr.set(term.getKey(), term.getValue());
        }

        switch (constraint.relation()) {
            case EQUAL -> expr.level(constraint.rhs());
            case LESS_EQUAL -> expr.upper(constraint.rhs());
            case GREATER_EQUAL -> expr.lower(constraint.rhs());
        }
    }

    private Variable variable(int handle) {
        if (handle < 0 || handle >= variables.size()) {
            throw new IllegalArgumentException("Unknown variable handle: " + handle);
        }
        return variables.get(handle);
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("The model is frozen once optimize() has been called");
        }
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
    @SuppressWarnings("unused")
    public synchronized boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     *
     * @param debug true if debug logging is enabled
     */
    public synchronized void setDebug(boolean debug) {
        this.debug = debug;
    }
}
