package com.github.qubovrp.solver;

import com.github.qubovrp.DistanceMatrix;
import com.github.qubovrp.Route;
import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPProblem;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static java.util.stream.Collectors.toCollection;

/**
 * <p>
 * A fast, but very simple greedy heuristic for the Vehicle Routing Problem.
 * </p><p>
 * Vehicles take turns, round-robin from vehicle 0; on its turn a vehicle extends its path with the unassigned
 * customer nearest to where it currently stands. Once every customer is assigned, each vehicle that left the depot
 * returns to it. Ties go to the lowest node id. Runs in O(n^2) and never builds a QUBO matrix.
 * </p>
 */
public class GreedyVRPSolver extends VRPSolver {
    /**
     * Default constructor
     */
    public GreedyVRPSolver() {
    }

    @Override
    protected void validate(VRPProblem problem) {
        requireVehicles(problem);
    }

    @Override
    protected List<Route> doSolve(VRPProblem problem) {
        var distances = problem.distanceMatrix();
        var remaining = IntStream.range(1, problem.size()).boxed().collect(toCollection(TreeSet::new));
        var routes = problem.vehicles().stream().map(v -> new Route.Builder(v.id()))
                .collect(toCollection(ArrayList::new));

        for (var current = 0; !remaining.isEmpty(); current = (current + 1) % routes.size()) {
            var route = routes.get(current);
            var next = findNearestNeighbor(distances, route.last(), remaining);

            remaining.remove(next);
            route.visit(next, distances);
        }

        return routes.stream().map(route -> route.close(distances).build()).toList();
    }

    // `remaining` iterates in ascending order, so the strict comparison keeps the lowest id on ties.
    private static int findNearestNeighbor(DistanceMatrix distances, int node, Set<Integer> remaining) {
        var best = -1;
        var bestDistance = Double.POSITIVE_INFINITY;

        for (var candidate : remaining) {
            var distance = distances.get(node, candidate);

            if (best < 0 || distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }

    @Override
    public SolverTag getSolverTag() {
        return SolverTag.CLASSICAL;
    }
}
