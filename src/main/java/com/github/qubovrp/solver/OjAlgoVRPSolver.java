package com.github.qubovrp.solver;

import com.github.qubovrp.Route;
import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPProblem;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static com.github.qubovrp.Util.arcIndex;
import static com.github.qubovrp.Util.buildAsymmetricVars;
import static com.github.qubovrp.Util.newModel;
import static com.github.qubovrp.Util.setTimeout;
import static com.google.common.collect.MoreCollectors.onlyElement;
import static java.math.BigDecimal.ONE;
import static java.util.stream.Collectors.toCollection;

/**
 * <p>
 * Exact solver for the uncapacitated Vehicle Routing Problem, used as a baseline for the heuristics on small
 * instances.
 * </p><p>
 * Uses the ojAlgo MIP solver on a two-index flow formulation: one binary variable per directed arc, weighted by
 * distance; every customer entered and left exactly once; the depot entered and left between 1 and <code>v</code>
 * times. Cycles that avoid the depot are removed lazily: after each solve, every such subtour <code>S</code> gets
 * a cut limiting the arcs inside <code>S</code> to <code>|S| - 1</code>, and the model is solved again.
 * </p>
 */
public class OjAlgoVRPSolver extends VRPSolver {
    private static final BigDecimal HALF = new BigDecimal("0.5");

    private long timeoutMillis = 60_000L;

    /**
     * Default constructor
     */
    public OjAlgoVRPSolver() {
    }

    @Override
    protected void validate(VRPProblem problem) {
        requireVehicles(problem);
    }

    @Override
    protected List<Route> doSolve(VRPProblem problem) {
        var size = problem.size();

        if (size <= 1) {
            return List.of();
        }

        var deadline = System.currentTimeMillis() + timeoutMillis;
        var model = newModel(deadline);
        var vars = buildAsymmetricVars(problem.distanceMatrix(), model);

        buildConstraints(model, vars, problem.vehicleCount());

        while (true) {
            var start = System.currentTimeMillis();
            setTimeout(deadline, model.options);
            var result = model.minimise();

            debug("Elapsed: " + (System.currentTimeMillis() - start) + "ms; " + result.getState() + " "
                    + result.getValue());

            if (!result.getState().isFeasible()) {
                throw new IllegalStateException("ojAlgo found no feasible solution: " + result.getState());
            }

            var cycles = findCycles(size, result);
            var subtours = cycles.stream().filter(cycle -> !cycle.contains(0)).toList();

            debug(cycles.size() + " cycles: " + cycles);

            if (subtours.isEmpty()) {
                return toRoutes(cycles, problem);
            }

            addCuts(subtours, model, vars);
        }
    }

    static void buildConstraints(ExpressionsBasedModel model, Variable[][] vars, int vehicles) {
        var size = vars.length;
        var maxTours = BigDecimal.valueOf(vehicles);

        for (var i = 0; i < size; i++) {
            var outgoing = model.newExpression("outgoing_" + i);
            var incoming = model.newExpression("incoming_" + i);

            if (i == 0) {
                outgoing.lower(ONE).upper(maxTours);
                incoming.lower(ONE).upper(maxTours);
            } else {
                outgoing.level(ONE);
                incoming.level(ONE);
            }
            for (var j = 0; j < size; j++) {
                if (i != j) {
                    outgoing.set(vars[i][j], ONE);
                    incoming.set(vars[j][i], ONE);
                }
            }
        }
    }

    private static void addCuts(List<List<Integer>> subtours, ExpressionsBasedModel model, Variable[][] vars) {
        for (var subtour : subtours) {
            var cut = model.newExpression("subtour_" + subtour).upper(subtour.size() - 1);

            for (var i : subtour) {
                for (var j : subtour) {
                    if (i.intValue() != j.intValue()) {
                        cut.set(vars[i][j], ONE);
                    }
                }
            }
        }
    }

    /**
     * Split the arcs of an integer solution into cycles. Cycles through the depot come first, ordered by their first
     * customer, and start with 0; the rest are subtours, starting from their lowest node.
     */
    static List<List<Integer>> findCycles(int size, Optimisation.Result result) {
        var cycles = new ArrayList<List<Integer>>();
        var remaining = IntStream.range(1, size).boxed().collect(toCollection(TreeSet::new));

        for (var first = 1; first < size; first++) {
            if (isSet(0, first, size, result)) {
                var cycle = new ArrayList<Integer>();
                cycle.add(0);
                follow(first, size, result, cycle, remaining);
                cycles.add(cycle);
            }
        }

        while (!remaining.isEmpty()) {
            var cycle = new ArrayList<Integer>();
            follow(remaining.first(), size, result, cycle, remaining);
            cycles.add(cycle);
        }
        return cycles;
    }

    private static void follow(int node, int size, Optimisation.Result result, List<Integer> cycle,
                               Set<Integer> remaining) {
        var seen = new HashSet<Integer>(cycle);

        while (node != 0 && seen.add(node)) {
            cycle.add(node);
            remaining.remove(node);
            node = successor(node, size, result);
        }
    }

    private static int successor(int node, int size, Optimisation.Result result) {
        return IntStream.range(0, size).filter(j -> j != node && isSet(node, j, size, result)).boxed()
                .collect(onlyElement());
    }

    private static boolean isSet(int src, int dest, int size, Optimisation.Result result) {
        return result.get(arcIndex(src, dest, size)).compareTo(HALF) > 0;
    }

    private static List<Route> toRoutes(List<List<Integer>> cycles, VRPProblem problem) {
        var routes = new ArrayList<Route>();

        for (var cycle : cycles) {
            var route = new Route.Builder(routes.size());

            cycle.stream().skip(1).forEach(node -> route.visit(node, problem.distanceMatrix()));
            routes.add(route.close(problem.distanceMatrix()).build());
        }
        return routes;
    }

    @Override
    public SolverTag getSolverTag() {
        return SolverTag.CLASSICAL;
    }

    /**
     * Get the wall-clock limit for a single {@link #solve(VRPProblem)} call.
     *
     * @return value in milliseconds
     */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    /**
     * Set the wall-clock limit. If ojAlgo has no feasible solution by then, {@link #solve(VRPProblem)} throws
     * {@link IllegalStateException}.
     *
     * @param timeoutMillis value in milliseconds
     */
    public void setTimeoutMillis(long timeoutMillis) {
        if (timeoutMillis <= 0L) {
            throw new IllegalArgumentException("timeoutMillis must be positive.");
        }
        this.timeoutMillis = timeoutMillis;
    }
}
