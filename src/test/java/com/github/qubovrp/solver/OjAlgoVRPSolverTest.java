package com.github.qubovrp.solver;

import com.github.qubovrp.ProblemGenerator;
import com.github.qubovrp.SolverTag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OjAlgoVRPSolverTest extends AbstractVRPSolverTest {
    @Test
    void worksCorrectly() throws IOException {
        var solver = new OjAlgoVRPSolver();

        // every Hamiltonian tour through the depot costs 14
        assertEquals(14.0, solver.solve(loadProblem("four-nodes.json", 1)).totalDistance(), 1e-9);

        // 0-1-3-0 plus 0-2-0
        assertEquals(13.0, solver.solve(loadProblem("four-nodes.json", 2)).totalDistance(), 1e-9);

        // out and back to each customer
        assertEquals(12.0, solver.solve(loadProblem("four-nodes.json", 3)).totalDistance(), 1e-9);
    }

    /**
     * The 8-node fixture has short cycles away from the depot (1-4-1, 1-7-1, 3-7-3...), so this only passes if
     * subtours are cut.
     */
    @Test
    void neverWorseThanGreedy() throws IOException {
        for (var vehicles = 1; vehicles <= 4; vehicles++) {
            var problem = loadProblem("eight-nodes.json", vehicles);
            var exact = new OjAlgoVRPSolver().solve(problem);
            var greedy = new GreedyVRPSolver().solve(problem);

            assertFeasible(problem, exact);
            assertTrue(exact.isComplete());
            assertTrue(exact.totalDistance() <= greedy.totalDistance() + 1e-9,
                    exact.totalDistance() + " > " + greedy.totalDistance());
        }
    }

    @Test
    void rejectsEmptyFleet() throws IOException {
        var problem = loadProblem("four-nodes.json", 0);

        assertThrows(IllegalArgumentException.class, () -> new OjAlgoVRPSolver().solve(problem));
    }

    @Test
    void timeout() {
        var solver = new OjAlgoVRPSolver();

        assertEquals(60_000L, solver.getTimeoutMillis());
        assertThrows(IllegalArgumentException.class, () -> solver.setTimeoutMillis(0L));

        solver.setTimeoutMillis(5_000L);
        assertEquals(5_000L, solver.getTimeoutMillis());
    }

    @Test
    void randomProblem() {
        var problem = ProblemGenerator.randomProblem(9, 3, new Random(31L));
        var solver = new OjAlgoVRPSolver();

        solver.setTimeoutMillis(10_000L);

        var solution = solver.solve(problem);

        assertFeasible(problem, solution);
        assertTrue(solution.isComplete());
        assertTrue(solution.totalDistance() <= new GreedyVRPSolver().solve(problem).totalDistance() + 1e-9);
    }

    @Override
    protected VRPSolver newSolver() {
        return new OjAlgoVRPSolver();
    }

    @Override
    protected SolverTag expectedTag() {
        return SolverTag.CLASSICAL;
    }
}
