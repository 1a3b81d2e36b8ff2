package com.github.seamorder.lp;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static java.math.BigDecimal.ONE;
import static java.math.BigDecimal.ZERO;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OjAlgoSolverEngineTest {
    private static final BigDecimal TWO = BigDecimal.valueOf(2L);

    private static final long TIMEOUT = 60_000L;

    /**
     * Pick exactly one of two items; the second is cheaper.
     */
    private static OjAlgoSolverEngine pickOne() {
        var engine = new OjAlgoSolverEngine(System.currentTimeMillis() + TIMEOUT);
        var a = engine.newBinaryVariable("a");
        var b = engine.newBinaryVariable("b");

        engine.addConstraint(new LinearConstraint("pick_one",
                new LinearExpression().set(a, ONE).set(b, ONE), Relation.EQUAL, ONE));
        engine.setObjective(new LinearExpression().set(a, BigDecimal.valueOf(3L)).set(b, TWO));
        return engine;
    }

    @Test
    void solvesWithoutCallback() {
        var solution = pickOne().optimize();

        assertEquals(Solution.State.OPTIMAL, solution.state());
        assertEquals(2.0, solution.objective(), 1e-9);
        assertFalse(solution.values().isSet(0));
        assertTrue(solution.values().isSet(1));
        assertEquals(0, solution.rounds());
    }

    @Test
    void resolvesAfterLazyConstraint() {
        var engine = pickOne();
        var seen = new ArrayList<Boolean>();

        engine.setLazyCallback(candidate -> {
            seen.add(candidate.isSet(1));
            return candidate.isSet(1) ?
                    List.of(new LinearConstraint("no_b", new LinearExpression().set(1, ONE), Relation.LESS_EQUAL, ZERO)) :
                    List.of();
        });

        var solution = engine.optimize();

        assertEquals(List.of(true, false), seen);
        assertEquals(3.0, solution.objective(), 1e-9);
        assertTrue(solution.values().isSet(0));
        assertEquals(2, solution.rounds());
        assertEquals(1, solution.cuts());
    }

    @Test
    void frozenAfterOptimize() {
        var engine = pickOne();
        engine.optimize();

        assertThrows(IllegalStateException.class, () -> engine.newBinaryVariable("c"));
        assertThrows(IllegalStateException.class, () -> engine.addConstraint(new LinearConstraint("late",
                new LinearExpression().set(0, ONE), Relation.LESS_EQUAL, ONE)));
        assertThrows(IllegalStateException.class, () -> engine.setLazyCallback(candidate -> List.of()));
    }

    @Test
    void infeasible() {
        var engine = new OjAlgoSolverEngine(System.currentTimeMillis() + TIMEOUT);
        var a = engine.newBinaryVariable("a");
        var b = engine.newBinaryVariable("b");

        engine.addConstraint(new LinearConstraint("impossible",
                new LinearExpression().set(a, ONE).set(b, ONE), Relation.GREATER_EQUAL, BigDecimal.valueOf(3L)));

        assertThrows(SolverException.class, engine::optimize);
    }

    /**
     * Once the deadline has passed, a candidate that still needs cuts cannot be repaired.
     */
    @Test
    void deadlineBeforeCandidateAccepted() {
        var engine = new OjAlgoSolverEngine(System.currentTimeMillis() - 1L);
        var a = engine.newBinaryVariable("a");
        var b = engine.newBinaryVariable("b");

        engine.addConstraint(new LinearConstraint("pick_one",
                new LinearExpression().set(a, ONE).set(b, ONE), Relation.EQUAL, ONE));
        engine.setLazyCallback(candidate -> {
            // forbid exactly the current assignment
            var lhs = new LinearExpression();
            var chosen = 0L;

            for (var v = 0; v < 2; v++) {
                if (candidate.isSet(v)) {
                    lhs.set(v, ONE);
                    chosen++;
                }
            }
            return List.of(new LinearConstraint("not_" + chosen, lhs, Relation.LESS_EQUAL,
                    BigDecimal.valueOf(chosen - 1L)));
        });

        assertThrows(SolverException.class, engine::optimize);
    }

    @Test
    void rejectsCallbackThatCutsNothing() {
        var engine = pickOne();

        engine.setLazyCallback(candidate -> List.of(new LinearConstraint("redundant",
                new LinearExpression().set(0, ONE), Relation.LESS_EQUAL, ONE)));

        assertThrows(IllegalStateException.class, engine::optimize);
    }

    @Test
    void rejectsDuplicateNamesAndUnknownVariables() {
        var engine = pickOne();

        assertThrows(IllegalArgumentException.class, () -> engine.addConstraint(new LinearConstraint("pick_one",
                new LinearExpression().set(0, ONE), Relation.LESS_EQUAL, ONE)));
        assertThrows(IllegalArgumentException.class, () -> engine.addConstraint(new LinearConstraint("unknown",
                new LinearExpression().set(5, ONE), Relation.LESS_EQUAL, ONE)));
    }

    @Test
    void constraintSemantics() {
        Candidate candidate = variable -> variable == 0 ? ONE : ZERO;
        var lhs = new LinearExpression().set(0, TWO).set(1, ONE);

        assertEquals(TWO, lhs.evaluate(candidate));
        assertTrue(new LinearConstraint("eq", lhs, Relation.EQUAL, TWO).isSatisfiedBy(candidate));
        assertFalse(new LinearConstraint("le", lhs, Relation.LESS_EQUAL, ONE).isSatisfiedBy(candidate));
        assertTrue(new LinearConstraint("ge", lhs, Relation.GREATER_EQUAL, ONE).isSatisfiedBy(candidate));
    }
}
