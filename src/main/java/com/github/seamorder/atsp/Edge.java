package com.github.seamorder.atsp;

/**
 * Represents an edge in a directed graph.
 *
 * @param src  the source node, as an index into the corresponding {@link CostMatrix}
 * @param dest the destination node, as an index into the corresponding {@link CostMatrix}
 */
public record Edge(int src, int dest) {
    @Override
    public String toString() {
        return src + "-->" + dest;
    }
}
