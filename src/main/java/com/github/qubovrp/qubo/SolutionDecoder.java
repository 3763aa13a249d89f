package com.github.qubovrp.qubo;

import com.github.qubovrp.Route;
import com.github.qubovrp.VRPProblem;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a binary assignment vector back into vehicle routes.
 * <p>
 * The decoder follows each vehicle's arcs from the depot and never validates the vector. If several arcs claim
 * the same customer, the first vehicle (in fleet order) to reach it keeps it and later claims are ignored. Entries
 * other than 1 are treated as unset. Customers that no vehicle reaches are simply missing from the result.
 */
public class SolutionDecoder {
    private SolutionDecoder() {
    }

    /**
     * Decode <code>x</code>. Pure: neither argument is modified, and the same inputs always produce the same
     * routes.
     *
     * @param x       binary vector laid out by {@link VariableIndex}
     * @param problem the problem <code>x</code> was sampled for
     * @return the non-trivial routes, in vehicle order
     */
    public static List<Route> decode(int[] x, VRPProblem problem) {
        var index = VariableIndex.of(problem);

        if (x.length != index.size()) {
            throw new IllegalArgumentException("solution vector has length " + x.length + ", expected "
                    + index.size());
        }

        var routes = new ArrayList<Route>();
        var visited = new HashSet<Integer>();
        visited.add(0);

        for (var vehicle : problem.vehicles()) {
            var veh = vehicle.id();
            var route = new Route.Builder(veh);

            for (int next; (next = findNext(x, index, route.last(), veh, visited)) > 0; ) {
                route.visit(next, problem.distanceMatrix());
                visited.add(next);
            }

            if (route.size() > 1) {
                route.close(problem.distanceMatrix());
            }

            var built = route.build();
            if (!built.isTrivial()) {
                routes.add(built);
            }
        }
        return routes;
    }

    // lowest unvisited destination with x[current,j,vehicle] == 1, or -1
    private static int findNext(int[] x, VariableIndex index, int current, int vehicle, Set<Integer> visited) {
        for (var j = 0; j < index.nodes(); j++) {
            if (!visited.contains(j) && x[index.index(current, j, vehicle)] == 1) {
                return j;
            }
        }
        return -1;
    }
}
