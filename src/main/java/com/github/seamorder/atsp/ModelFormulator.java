package com.github.seamorder.atsp;

import com.github.seamorder.lp.LinearConstraint;
import com.github.seamorder.lp.LinearExpression;
import com.github.seamorder.lp.Relation;
import com.github.seamorder.lp.SolverEngine;

import java.math.BigDecimal;
import java.util.stream.IntStream;

import static java.math.BigDecimal.ONE;

/**
 * Builds the assignment relaxation of the Hamiltonian cycle problem: a binary variable for every ordered pair
 * of nodes, a cost-weighted objective, and "leave once" / "enter once" constraints on every node. These alone
 * admit unions of disjoint cycles, which {@link SubtourEliminationCallback} removes during the search.
 */
public final class ModelFormulator {
    private ModelFormulator() {
    }

    /**
     * Validate the cost matrix.
     *
     * @param costs a matrix, which must be square, at least 2x2 and non-negative.
     * @throws FormulationException if invalid
     */
    public static void validate(CostMatrix costs) {
        var size = costs.size();

        if (size < 2) {
            throw new FormulationException("costMatrix must be at least 2x2");
        }
        if (IntStream.range(0, size).anyMatch(row -> costs.rowLength(row) != size)) {
            throw new FormulationException("costMatrix must be square");
        }
        for (var row = 0; row < size; row++) {
            for (var col = 0; col < size; col++) {
                if (costs.get(row, col) < 0L) {
                    throw new FormulationException("costMatrix must be non-negative, found " +
                            costs.get(row, col) + " at " + row + "," + col);
                }
            }
        }
    }

    /**
     * Register variables, objective and degree constraints with the engine, and enable lazy subtour
     * elimination.
     *
     * @param costs    the cost matrix
     * @param engine   an engine with an empty model
     * @param strategy which cycles to cut on each candidate
     * @return the variable layout
     * @throws FormulationException if the cost matrix is invalid
     */
    public static Formulation formulate(CostMatrix costs, SolverEngine engine, CutStrategy strategy) {
        validate(costs);

        var formulation = new Formulation(costs, buildVars(costs.size(), engine));

        buildObjective(formulation, engine);
        buildConstraints(formulation, engine);
        engine.setLazyCallback(new SubtourEliminationCallback(formulation, strategy));

        return formulation;
    }

    private static int[][] buildVars(int size, SolverEngine engine) {
        var vars = new int[size][size];

        for (var row = 0; row < size; row++) {
            for (var col = 0; col < size; col++) {
                vars[row][col] = row == col ? -1 : engine.newBinaryVariable("x" + row + "_" + col);
            }
        }
        return vars;
    }

    private static void buildObjective(Formulation formulation, SolverEngine engine) {
        var size = formulation.size();
        var costs = formulation.getCosts();
        var objective = new LinearExpression();

        for (var row = 0; row < size; row++) {
            for (var col = 0; col < size; col++) {
                if (row != col) {
                    objective.set(formulation.variable(row, col), BigDecimal.valueOf(costs.get(row, col)));
                }
            }
        }
        engine.setObjective(objective);
    }

    private static void buildConstraints(Formulation formulation, SolverEngine engine) {
        var size = formulation.size();

        for (var i = 0; i < size; i++) {
            var outgoing = new LinearExpression();
            var incoming = new LinearExpression();

            for (var j = 0; j < size; j++) {
                if (i != j) {
                    outgoing.set(formulation.variable(i, j), ONE);
                    incoming.set(formulation.variable(j, i), ONE);
                }
            }

            engine.addConstraint(new LinearConstraint("leave_once_" + i, outgoing, Relation.EQUAL, ONE));
            engine.addConstraint(new LinearConstraint("enter_once_" + i, incoming, Relation.EQUAL, ONE));
        }
    }
}
