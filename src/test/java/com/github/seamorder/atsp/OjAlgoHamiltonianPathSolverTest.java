package com.github.seamorder.atsp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.seamorder.image.CostMatrixBuilder;
import com.github.seamorder.image.Image;
import com.github.seamorder.image.Pixel;
import com.github.seamorder.lp.Solution;
import com.github.seamorder.lp.SolverException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OjAlgoHamiltonianPathSolverTest {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Costs for 0-1, 1-0, 2-3, and 3-2 are 1. All other costs are 2.
     * <p>
     * This implies that the solver will find two short cycles 0-1-0 and 2-3-2
     * unless it correctly eliminates subtours.
     */
    @Test
    void findsExactlyOneCycle() {
        var costs = CostMatrix.of(new long[][]{
                {0, 1, 2, 2},
                {1, 0, 2, 2},
                {2, 2, 0, 1},
                {2, 2, 1, 0}});

        for (var strategy : CutStrategy.values()) {
            var result = newSolver(strategy).solve(costs);

            assertEquals(Solution.State.OPTIMAL, result.state());
            assertEquals(6.0, result.objective());
            assertPermutation(3, result.order());
        }
    }

    /**
     * Image A has a black left edge and a dark grey right edge; image B starts light grey and ends nearly black.
     * Putting B first costs 15, putting A first costs 120.
     */
    @Test
    void ordersTwoImages() {
        var a = image(new Pixel(0, 0, 0), new Pixel(10, 10, 10));
        var b = image(new Pixel(50, 50, 50), new Pixel(5, 5, 5));

        var result = newSolver(CutStrategy.DEPOT_CYCLE).solve(List.of(a, b), 60_000L);

        assertEquals(new HamiltonianPathSolver.Result(Solution.State.OPTIMAL, 15.0, List.of(2, 1)), result);
    }

    @Test
    void singleImage() {
        var result = newSolver(CutStrategy.DEPOT_CYCLE).solve(List.of(image(new Pixel(1, 2, 3))), 60_000L);

        assertEquals(new HamiltonianPathSolver.Result(Solution.State.OPTIMAL, 0.0, List.of(1)), result);
    }

    @Test
    void matchesBruteForceOnRandomImages() {
        var rand = new Random(42L);

        for (var trial = 0; trial < 3; trial++) {
            var images = IntStream.range(0, 6).mapToObj(i -> randomImage(rand, 3, 2)).toList();
            var costs = new CostMatrixBuilder().build(images);
            var expected = bruteForce(costs);

            for (var strategy : CutStrategy.values()) {
                var result = newSolver(strategy).solve(costs);

                assertPermutation(6, result.order());
                assertEquals(expected, result.objective());
                assertEquals(costs.pathCost(result.order()), (long) result.objective());
            }
        }
    }

    /**
     * Eight objects with arbitrary asymmetric costs need several cut rounds, so every re-solve after the first
     * has to come back integral.
     */
    @Test
    void matchesBruteForceOnRandomMatrices() {
        var rand = new Random(7L);

        for (var trial = 0; trial < 5; trial++) {
            var costs = randomCosts(rand, 9);
            var expected = bruteForce(costs);

            for (var strategy : CutStrategy.values()) {
                var result = newSolver(strategy).solve(costs);

                assertEquals(Solution.State.OPTIMAL, result.state());
                assertPermutation(8, result.order());
                assertEquals(expected, result.objective());
            }
        }
    }

    /**
     * With almost no time, the solver either reports a usable tour or gives up with a {@link SolverException}.
     */
    @Test
    void shortDeadline() {
        var costs = randomCosts(new Random(11L), 9);

        try {
            var result = newSolver(CutStrategy.DEPOT_CYCLE).solve(costs, 1L);

            assertPermutation(8, result.order());
            assertEquals(costs.pathCost(result.order()), (long) result.objective());
            if (result.state() == Solution.State.OPTIMAL) {
                assertEquals(bruteForce(costs), result.objective());
            }
        } catch (SolverException e) {
            assertNotNull(e.getMessage());
        }
    }

    @Test
    void solvesJsonFixture() throws IOException {
        var costs = CostMatrix.of(mapper.readValue(getClass().getResource("asymmetric-problem.json"), long[][].class));
        var expected = bruteForce(costs);

        var first = newSolver(CutStrategy.DEPOT_CYCLE).solve(costs);
        var second = newSolver(CutStrategy.DEPOT_CYCLE).solve(costs);

        assertPermutation(costs.size() - 1, first.order());
        assertEquals(expected, first.objective());
        assertEquals(first.objective(), second.objective());
    }

    @Test
    void rejectsNegativeCosts() {
        var costs = CostMatrix.of(new long[][]{{0, -1}, {0, 0}});

        assertThrows(FormulationException.class, () -> newSolver(CutStrategy.DEPOT_CYCLE).solve(costs));
    }

    private static OjAlgoHamiltonianPathSolver newSolver(CutStrategy strategy) {
        var solver = new OjAlgoHamiltonianPathSolver();
        solver.setCutStrategy(strategy);
        return solver;
    }

    private static CostMatrix randomCosts(Random rand, int size) {
        var rows = new long[size][size];

        for (var i = 1; i < size; i++) {
            for (var j = 1; j < size; j++) {
                rows[i][j] = i == j ? 0L : rand.nextInt(50);
            }
        }
        return CostMatrix.of(rows);
    }

    private static Image image(Pixel... row) {
        return new Image(new Pixel[][]{row});
    }

    private static Image randomImage(Random rand, int height, int width) {
        var rows = new Pixel[height][width];

        for (var row = 0; row < height; row++) {
            for (var col = 0; col < width; col++) {
                rows[row][col] = new Pixel(rand.nextInt(256), rand.nextInt(256), rand.nextInt(256));
            }
        }
        return new Image(rows);
    }

    private static void assertPermutation(int n, List<Integer> order) {
        assertEquals(IntStream.rangeClosed(1, n).boxed().toList(), order.stream().sorted().toList());
    }

    private static double bruteForce(CostMatrix costs) {
        var nodes = new ArrayList<Integer>();
        IntStream.range(1, costs.size()).forEach(nodes::add);
        return bruteForce(costs, new ArrayList<>(), nodes);
    }

    private static long bruteForce(CostMatrix costs, List<Integer> prefix, List<Integer> remaining) {
        if (remaining.isEmpty()) {
            return costs.pathCost(prefix);
        }

        var best = Long.MAX_VALUE;

        for (var i = 0; i < remaining.size(); i++) {
            var node = remaining.remove(i);
            prefix.add(node);
            best = Math.min(best, bruteForce(costs, prefix, remaining));
            prefix.remove(prefix.size() - 1);
            remaining.add(i, node);
        }
        return best;
    }
}
