package com.github.seamorder.atsp;

import com.github.seamorder.lp.Candidate;
import com.github.seamorder.lp.SolverException;

import java.util.ArrayList;
import java.util.List;

import static com.github.seamorder.atsp.SubtourEliminationCallback.nextNode;

/**
 * Turns a solved assignment back into an ordering of the objects.
 */
public final class PathReconstructor {
    private PathReconstructor() {
    }

    /**
     * Walk from the depot along the chosen edges until returning to the depot.
     *
     * @param formulation the variable layout
     * @param solution    the final assignment
     * @return node indexes 1..n in visiting order, without the depot
     * @throws SolverException if the assignment is not a single tour through every node
     */
    public static List<Integer> reconstruct(Formulation formulation, Candidate solution) {
        var size = formulation.size();
        var order = new ArrayList<Integer>(size - 1);
        var visited = new boolean[size];

        for (var node = nextNode(formulation, 0, solution); node != 0; node = nextNode(formulation, node, solution)) {
            if (visited[node]) {
                throw new SolverException("Node " + node + " visited twice: " + order);
            }
            visited[node] = true;
            order.add(node);
        }

        if (order.size() != size - 1) {
            throw new SolverException("Solution is not a single tour: " + order);
        }
        return order;
    }
}
