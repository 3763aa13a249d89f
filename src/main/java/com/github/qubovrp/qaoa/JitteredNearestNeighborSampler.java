package com.github.qubovrp.qaoa;

import com.github.qubovrp.DistanceMatrix;
import com.github.qubovrp.VRPProblem;
import com.github.qubovrp.qubo.QuboMatrix;
import com.github.qubovrp.qubo.VariableIndex;

import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static java.util.stream.Collectors.toCollection;

/**
 * <p>
 * Stand-in for quantum sampling: a nearest-neighbor construction where every candidate distance is multiplied by
 * a random factor in <code>[0.75, 1.25)</code>, so repeated runs give varying assignments.
 * </p><p>
 * The QUBO matrix is accepted for interface compatibility but never read; distances come straight from the
 * problem. Each vehicle in turn leaves the depot and keeps taking the (jittered) nearest unvisited customer until
 * none remain, then returns. Unless {@link #setBalanced(boolean) balanced} is set, this means vehicle 0 visits
 * everything. Customers left over when the fleet runs out stay unassigned.
 * </p>
 */
public class JitteredNearestNeighborSampler implements QuboSampler {
    /**
     * Half-width of the multiplicative jitter.
     */
    public static final double JITTER = 0.25;

    private final Random random;
    private boolean balanced;

    /**
     * Unseeded sampler.
     */
    public JitteredNearestNeighborSampler() {
        this(new Random());
    }

    /**
     * @param random source of the jitter; pass a seeded instance for reproducible runs
     */
    public JitteredNearestNeighborSampler(Random random) {
        this.random = random;
    }

    @Override
    public int[] sample(QuboMatrix qubo, VRPProblem problem, QaoaParams params) {
        var index = VariableIndex.of(problem);
        var n = problem.size();
        var v = problem.vehicleCount();
        var distances = problem.distanceMatrix();
        var solution = new int[index.size()];
        var remaining = IntStream.range(1, n).boxed().collect(toCollection(TreeSet::new));
        var maxStops = balanced && v > 0 ? (n - 1 + v - 1) / v : Integer.MAX_VALUE;

        for (var veh = 0; veh < v && !remaining.isEmpty(); veh++) {
            var current = 0;

            for (var stops = 0; stops < maxStops && !remaining.isEmpty(); stops++) {
                var next = pickNext(distances, current, remaining);
                if (next < 0) {
                    break;
                }
                solution[index.index(current, next, veh)] = 1;
                remaining.remove(next);
                current = next;
            }

            if (current != 0) {
                solution[index.index(current, 0, veh)] = 1;
            }
        }
        return solution;
    }

    private int pickNext(DistanceMatrix distances, int current, Set<Integer> remaining) {
        var best = -1;
        var bestDistance = Double.POSITIVE_INFINITY;

        for (var candidate : remaining) {
            var jittered = distances.get(current, candidate) * (1 + (random.nextDouble() * 2 * JITTER - JITTER));

            if (jittered < bestDistance) {
                best = candidate;
                bestDistance = jittered;
            }
        }
        return best;
    }

    /**
     * Get the balanced property.
     *
     * @return true if each vehicle is limited to <code>ceil((n - 1) / v)</code> customers
     */
    public boolean isBalanced() {
        return balanced;
    }

    /**
     * Set the balanced property. When enabled, each vehicle returns to the depot after
     * <code>ceil((n - 1) / v)</code> customers, spreading the work over the fleet instead of giving it all to
     * vehicle 0.
     *
     * @param balanced true to cap the stops per vehicle
     */
    public void setBalanced(boolean balanced) {
        this.balanced = balanced;
    }
}
