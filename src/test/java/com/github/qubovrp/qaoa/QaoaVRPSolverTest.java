package com.github.qubovrp.qaoa;

import com.github.qubovrp.Route;
import com.github.qubovrp.SolverTag;
import com.github.qubovrp.solver.AbstractVRPSolverTest;
import com.github.qubovrp.solver.VRPSolver;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QaoaVRPSolverTest extends AbstractVRPSolverTest {
    @Test
    void firstVehicleTakesEverything() throws IOException {
        var problem = loadProblem("eight-nodes.json", 3);
        var solution = new QaoaVRPSolver().solve(problem);

        assertEquals(1, solution.routes().size());
        assertEquals(0, solution.routes().get(0).vehicleId());
        assertEquals(7, solution.routes().get(0).customers().size());
        assertTrue(solution.isComplete());
    }

    @Test
    void emptyFleet() throws IOException {
        var solution = new QaoaVRPSolver().solve(loadProblem("four-nodes.json", 0));

        assertEquals(List.of(), solution.routes());
        assertEquals(List.of(1, 2, 3), List.copyOf(solution.unassigned()));
    }

    @Test
    void paramsDoNotChangeTheRoutes() throws IOException {
        var problem = loadProblem("eight-nodes.json", 2);
        var solver = new QaoaVRPSolver(new JitteredNearestNeighborSampler(new Random(99L)));
        var expected = solver.solve(problem).routes();

        solver.setParams(new QaoaParams(5, Backend.IBMQ_LIMA, 10));
        solver.setSampler(new JitteredNearestNeighborSampler(new Random(99L)));

        assertEquals(expected, solver.solve(problem).routes());
    }

    @Test
    void annealingSampler() throws IOException {
        var problem = loadProblem("four-nodes.json", 2);
        var solver = new QaoaVRPSolver(new AnnealingQuboSampler(new Random(7L)));

        for (var i = 0; i < 5; i++) {
            var solution = solver.solve(problem);

            assertFeasible(problem, solution);
            assertEquals(SolverTag.QUANTUM, solution.solver());
        }
    }

    @Test
    void balancedSampler() throws IOException {
        var problem = loadProblem("eight-nodes.json", 3);
        var sampler = new JitteredNearestNeighborSampler(new Random(3L));
        sampler.setBalanced(true);

        var solution = new QaoaVRPSolver(sampler).solve(problem);

        assertFeasible(problem, solution);
        assertTrue(solution.isComplete());
        assertEquals(List.of(0, 1, 2), solution.routes().stream().map(Route::vehicleId).toList());
        assertTrue(solution.routes().stream().allMatch(route -> route.customers().size() <= 3));
    }

    @Test
    void debugDoesNotChangeTheRoutes() throws IOException {
        var problem = loadProblem("eight-nodes.json", 2);
        var quiet = new QaoaVRPSolver(new AnnealingQuboSampler(new Random(5L)));
        var verbose = new QaoaVRPSolver(new AnnealingQuboSampler(new Random(5L)));

        verbose.setDebug(true);

        assertEquals(quiet.solve(problem).routes(), verbose.solve(problem).routes());
        assertTrue(verbose.isDebug());
    }

    @Test
    void settings() {
        var solver = new QaoaVRPSolver();

        assertEquals(QaoaParams.DEFAULT, solver.getParams());
        assertEquals(10.0, solver.getPenalty());
        assertTrue(solver.getSampler() instanceof JitteredNearestNeighborSampler);

        assertThrows(IllegalArgumentException.class, () -> solver.setPenalty(0.0));
        assertThrows(IllegalArgumentException.class, () -> solver.setPenalty(Double.NaN));
        assertThrows(NullPointerException.class, () -> solver.setParams(null));

        solver.setPenalty(25.0);
        assertEquals(25.0, solver.getPenalty());
    }

    @Override
    protected VRPSolver newSolver() {
        return new QaoaVRPSolver(new JitteredNearestNeighborSampler(new Random(42L)));
    }

    @Override
    protected SolverTag expectedTag() {
        return SolverTag.QUANTUM;
    }
}
