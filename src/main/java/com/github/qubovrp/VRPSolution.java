package com.github.qubovrp;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.stream.IntStream;

/**
 * Record type to hold a solution to the problem.
 *
 * @param routes        the non-trivial routes, in vehicle order
 * @param totalDistance sum of the route distances
 * @param executionTime wall-clock time spent by the solver
 * @param solver        which solver family produced this
 * @param unassigned    customers that no route visits. Empty unless the solver ran out of vehicles, or the
 *                      sampled assignment had gaps.
 */
public record VRPSolution(List<Route> routes,
                          double totalDistance,
                          Duration executionTime,
                          SolverTag solver,
                          SortedSet<Integer> unassigned) {
    public VRPSolution {
        routes = ImmutableList.copyOf(routes);
        Objects.requireNonNull(executionTime, "executionTime");
        Objects.requireNonNull(solver, "solver");
        unassigned = ImmutableSortedSet.copyOf(unassigned);
    }

    /**
     * Convenience constructor to drop trivial routes and compute the total distance and the unassigned customers.
     *
     * @param routes        candidate routes, which may include vehicles that never left the depot
     * @param executionTime wall-clock time spent by the solver
     * @param solver        which solver family produced this
     * @param problem       the problem that was solved
     */
    public VRPSolution(List<Route> routes, Duration executionTime, SolverTag solver, VRPProblem problem) {
        this(nonTrivial(routes), totalDistance(nonTrivial(routes)), executionTime, solver,
                unassigned(nonTrivial(routes), problem));
    }

    private static List<Route> nonTrivial(List<Route> routes) {
        return routes.stream().filter(route -> !route.isTrivial()).toList();
    }

    private static double totalDistance(List<Route> routes) {
        return routes.stream().mapToDouble(Route::distance).sum();
    }

    private static SortedSet<Integer> unassigned(List<Route> routes, VRPProblem problem) {
        var visited = new HashSet<Integer>();

        routes.forEach(route -> visited.addAll(route.path()));
        return IntStream.range(1, problem.size()).filter(i -> !visited.contains(i)).boxed()
                .collect(ImmutableSortedSet.toImmutableSortedSet(Integer::compare));
    }

    /**
     * @return true if every customer is on some route
     */
    public boolean isComplete() {
        return unassigned.isEmpty();
    }
}
