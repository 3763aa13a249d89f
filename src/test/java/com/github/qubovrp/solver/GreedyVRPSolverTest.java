package com.github.qubovrp.solver;

import com.github.qubovrp.DistanceMatrix;
import com.github.qubovrp.Route;
import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPProblem;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class GreedyVRPSolverTest extends AbstractVRPSolverTest {
    @Test
    void worksCorrectly() throws IOException {
        var solver = new GreedyVRPSolver();

        // one vehicle visits everything, nearest first
        var solution = solver.solve(loadProblem("four-nodes.json", 1));
        assertEquals(List.of(new Route(0, List.of(0, 1, 2, 3, 0), 14.0)), solution.routes());
        assertEquals(14.0, solution.totalDistance());

        // vehicles alternate: 0 takes 1, 1 takes 2, 0 takes 3
        solution = solver.solve(loadProblem("four-nodes.json", 2));
        assertEquals(List.of(
                new Route(0, List.of(0, 1, 3, 0), 9.0),
                new Route(1, List.of(0, 2, 0), 4.0)), solution.routes());
        assertEquals(13.0, solution.totalDistance());

        // one customer each
        assertEquals(12.0, solver.solve(loadProblem("four-nodes.json", 3)).totalDistance());
    }

    @Test
    void idleVehiclesAreDropped() throws IOException {
        var solution = new GreedyVRPSolver().solve(loadProblem("four-nodes.json", 5));

        assertEquals(List.of(0, 1, 2), solution.routes().stream().map(Route::vehicleId).toList());
        assertEquals(12.0, solution.totalDistance());
    }

    @Test
    void tiesGoToLowestId() {
        var solution = new GreedyVRPSolver().solve(VRPProblem.of(DistanceMatrix.of(
                new double[]{0, 2, 2},
                new double[]{2, 0, 1},
                new double[]{2, 1, 0}), 1));

        assertEquals(List.of(0, 1, 2, 0), solution.routes().get(0).path());
    }

    @Test
    void rejectsEmptyFleet() throws IOException {
        var problem = loadProblem("four-nodes.json", 0);

        assertThrows(IllegalArgumentException.class, () -> new GreedyVRPSolver().solve(problem));
    }

    @Override
    protected VRPSolver newSolver() {
        return new GreedyVRPSolver();
    }

    @Override
    protected SolverTag expectedTag() {
        return SolverTag.CLASSICAL;
    }
}
