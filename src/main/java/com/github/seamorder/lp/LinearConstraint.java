package com.github.seamorder.lp;

import java.math.BigDecimal;

/**
 * A named linear constraint of the form <code>lhs relation rhs</code>.
 *
 * @param name     constraint name, unique within a model
 * @param lhs      the weighted sum of variables
 * @param relation how <code>lhs</code> compares to <code>rhs</code>
 * @param rhs      the constant right-hand side
 */
public record LinearConstraint(String name, LinearExpression lhs, Relation relation, BigDecimal rhs) {
    /**
     * Check whether a candidate assignment satisfies this constraint.
     *
     * @param candidate the variable values
     * @return true if satisfied
     */
    public boolean isSatisfiedBy(Candidate candidate) {
        var cmp = lhs.evaluate(candidate).compareTo(rhs);

        return switch (relation) {
            case EQUAL -> cmp == 0;
            case LESS_EQUAL -> cmp <= 0;
            case GREATER_EQUAL -> cmp >= 0;
        };
    }

    @Override
    public String toString() {
        return name + ": " + lhs + " " + relation + " " + rhs;
    }
}
