package com.github.seamorder.atsp;

/**
 * The variable layout produced by {@link ModelFormulator}: one binary variable per ordered pair of distinct
 * nodes.
 */
public final class Formulation {
    private final CostMatrix costs;
    private final int[][] vars;

    Formulation(CostMatrix costs, int[][] vars) {
        this.costs = costs;
        this.vars = vars;
    }

    /**
     * @return the cost matrix the model was built from
     */
    public CostMatrix getCosts() {
        return costs;
    }

    /**
     * @return number of nodes, including the depot
     */
    public int size() {
        return vars.length;
    }

    /**
     * @param src  source node
     * @param dest destination node, distinct from <code>src</code>
     * @return the handle of variable x[src][dest]
     */
    public int variable(int src, int dest) {
        if (src == dest) {
            throw new IllegalArgumentException("no variable for self-loop " + src);
        }
        return vars[src][dest];
    }
}
