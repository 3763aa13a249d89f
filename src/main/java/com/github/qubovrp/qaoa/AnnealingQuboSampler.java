package com.github.qubovrp.qaoa;

import com.github.qubovrp.VRPProblem;
import com.github.qubovrp.qubo.QuboMatrix;

import java.util.Random;

/**
 * <p>
 * A sampler that actually minimizes the QUBO objective <code>x'Qx</code>, by single-bit-flip simulated annealing.
 * </p><p>
 * Starts from the all-zero vector (energy 0) and runs <code>sweeps</code> sweeps of <code>size</code> random flip
 * proposals each, cooling geometrically from the initial to the final temperature. The best vector seen is
 * returned, so its energy is never positive.
 * </p><p>
 * The penalty encoding does not guarantee that low-energy vectors are feasible routes. Decoding tolerates that, and
 * customers it cannot reach show up as unassigned in the solution.
 * </p>
 */
public class AnnealingQuboSampler implements QuboSampler {
    private final Random random;
    private int sweeps = 200;
    private double initialTemperature = 100.0;
    private double finalTemperature = 0.01;

    /**
     * Unseeded sampler.
     */
    public AnnealingQuboSampler() {
        this(new Random());
    }

    /**
     * @param random source of randomness; pass a seeded instance for reproducible runs
     */
    public AnnealingQuboSampler(Random random) {
        this.random = random;
    }

    @Override
    public int[] sample(QuboMatrix qubo, VRPProblem problem, QaoaParams params) {
        var size = qubo.size();
        var q = qubo.toArray();
        var x = new int[size];
        var best = x.clone();

        if (size == 0) {
            return best;
        }

        var energy = 0.0;
        var bestEnergy = 0.0;
        var cooling = sweeps > 1 ? Math.pow(finalTemperature / initialTemperature, 1.0 / (sweeps - 1)) : 1.0;
        var temperature = initialTemperature;

        for (var sweep = 0; sweep < sweeps; sweep++) {
            for (var step = 0; step < size; step++) {
                var k = random.nextInt(size);
                var delta = flipDelta(q, x, k);

                if (delta <= 0.0 || random.nextDouble() < Math.exp(-delta / temperature)) {
                    x[k] = 1 - x[k];
                    energy += delta;

                    if (energy < bestEnergy) {
                        bestEnergy = energy;
                        best = x.clone();
                    }
                }
            }
            temperature *= cooling;
        }
        return best;
    }

    /**
     * Energy change from flipping bit <code>k</code>:
     * <code>s * (Q[k][k] + sum over j != k of (Q[k][j] + Q[j][k]) * x[j])</code>, where <code>s</code> is +1 for a
     * 0 to 1 flip and -1 for a 1 to 0 flip.
     */
    static double flipDelta(double[][] q, int[] x, int k) {
        var field = q[k][k];
        var row = q[k];

        for (var j = 0; j < x.length; j++) {
            if (j != k && x[j] == 1) {
                field += row[j] + q[j][k];
            }
        }
        return x[k] == 0 ? field : -field;
    }

    public int getSweeps() {
        return sweeps;
    }

    /**
     * @param sweeps number of sweeps, at least 1
     */
    public void setSweeps(int sweeps) {
        if (sweeps < 1) {
            throw new IllegalArgumentException("sweeps must be at least 1.");
        }
        this.sweeps = sweeps;
    }

    public double getInitialTemperature() {
        return initialTemperature;
    }

    public double getFinalTemperature() {
        return finalTemperature;
    }

    /**
     * Set the cooling schedule.
     *
     * @param initialTemperature temperature of the first sweep
     * @param finalTemperature   temperature of the last sweep; positive and no greater than the initial one
     */
    public void setTemperatures(double initialTemperature, double finalTemperature) {
        if (!(finalTemperature > 0.0) || finalTemperature > initialTemperature) {
            throw new IllegalArgumentException("temperatures must satisfy 0 < final <= initial.");
        }
        this.initialTemperature = initialTemperature;
        this.finalTemperature = finalTemperature;
    }
}
