package com.github.seamorder.lp;

/**
 * The comparison between the left-hand side of a {@link LinearConstraint} and its right-hand side.
 */
public enum Relation {
    /**
     * lhs == rhs
     */
    EQUAL,
    /**
     * lhs &lt;= rhs
     */
    LESS_EQUAL,
    /**
     * lhs &gt;= rhs
     */
    GREATER_EQUAL
}
