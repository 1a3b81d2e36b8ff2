package com.github.seamorder.atsp;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable matrix of directed transition costs. Index 0 is the depot; indexes 1..n are the objects being
 * ordered. The matrix is copied on construction and is not validated here; {@link ModelFormulator} rejects
 * matrices that are not square or that contain negative entries.
 */
public final class CostMatrix {
    private final long[][] costs;

    private CostMatrix(long[][] costs) {
        this.costs = costs;
    }

    /**
     * @param rows the cost rows; copied
     * @return the matrix
     */
    public static CostMatrix of(long[][] rows) {
        return new CostMatrix(Arrays.stream(rows).map(long[]::clone).toArray(long[][]::new));
    }

    /**
     * @return number of rows, i.e. number of nodes including the depot
     */
    public int size() {
        return costs.length;
    }

    /**
     * @param row a row index
     * @return the number of columns in that row
     */
    public int rowLength(int row) {
        return costs[row].length;
    }

    /**
     * @param src  source node
     * @param dest destination node
     * @return cost of travelling directly from <code>src</code> to <code>dest</code>
     */
    public long get(int src, int dest) {
        return costs[src][dest];
    }

    /**
     * Total cost of visiting the given nodes in order, starting and ending at the depot.
     *
     * @param order node indexes, excluding the depot
     * @return the sum of the costs of consecutive pairs, including both depot edges
     */
    public long pathCost(List<Integer> order) {
        var total = 0L;
        var prev = 0;

        for (var node : order) {
            total += costs[prev][node];
            prev = node;
        }
        return total + costs[prev][0];
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CostMatrix && Arrays.deepEquals(costs, ((CostMatrix) o).costs);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(costs);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(costs);
    }
}
