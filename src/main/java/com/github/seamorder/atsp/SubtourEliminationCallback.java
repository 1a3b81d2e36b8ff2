package com.github.seamorder.atsp;

import com.github.seamorder.lp.Candidate;
import com.github.seamorder.lp.LazyConstraintCallback;
import com.github.seamorder.lp.LinearConstraint;
import com.github.seamorder.lp.LinearExpression;
import com.github.seamorder.lp.Relation;
import com.github.seamorder.lp.SolverException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static java.math.BigDecimal.ONE;

/**
 * Lazy subtour elimination. For a candidate made of several disjoint cycles, adds a constraint
 * <code>sum(x[e] for e in cycle) &lt;= |cycle| - 1</code> per cut cycle, which no single tour through all nodes
 * can violate.
 * <p>
 * Stateless between invocations: everything it knows about earlier rounds lives in the engine's model.
 */
public class SubtourEliminationCallback implements LazyConstraintCallback {
    private final Formulation formulation;
    private final CutStrategy strategy;

    /**
     * @param formulation the variable layout
     * @param strategy    which cycles to cut
     */
    public SubtourEliminationCallback(Formulation formulation, CutStrategy strategy) {
        this.formulation = formulation;
        this.strategy = strategy;
    }

    @Override
    public List<LinearConstraint> onCandidate(Candidate candidate) {
        var size = formulation.size();
        var visited = new boolean[size];
        var depotCycle = traceCycle(0, candidate, visited);

        if (depotCycle.size() == size) {
            return List.of();
        }

        var cuts = new ArrayList<LinearConstraint>();
        cuts.add(cut(depotCycle));

        if (strategy == CutStrategy.ALL_CYCLES) {
            for (var node = 1; node < size; node++) {
                if (!visited[node]) {
                    cuts.add(cut(traceCycle(node, candidate, visited)));
                }
            }
        }
        return cuts;
    }

    /**
     * Follow the chosen outgoing edges from <code>start</code> until reaching a node seen before.
     *
     * @param start     first node
     * @param candidate the assignment
     * @param visited   nodes already traced; updated in place
     * @return the traversed edges, in order
     */
    List<Edge> traceCycle(int start, Candidate candidate, boolean[] visited) {
        var edges = new ArrayList<Edge>();

        for (var node = start; !visited[node]; ) {
            visited[node] = true;
            var next = nextNode(formulation, node, candidate);
            edges.add(new Edge(node, next));
            node = next;
        }
        return edges;
    }

    private LinearConstraint cut(List<Edge> cycle) {
        var lhs = new LinearExpression();

        for (var edge : cycle) {
            lhs.set(formulation.variable(edge.src(), edge.dest()), ONE);
        }
        return new LinearConstraint("subtour: " + cycle, lhs, Relation.LESS_EQUAL,
                BigDecimal.valueOf(cycle.size() - 1L));
    }

    /**
     * @return the destination of the unique chosen edge leaving <code>node</code>
     * @throws SolverException if no outgoing edge is set
     */
    static int nextNode(Formulation formulation, int node, Candidate candidate) {
        var size = formulation.size();

        for (var dest = 0; dest < size; dest++) {
            if (dest != node && candidate.isSet(formulation.variable(node, dest))) {
                return dest;
            }
        }
        throw new SolverException("No outgoing edge from node " + node);
    }
}
