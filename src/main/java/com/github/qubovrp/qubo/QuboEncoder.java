package com.github.qubovrp.qubo;

import com.github.qubovrp.VRPProblem;

/**
 * <p>
 * Encodes a {@link VRPProblem} as a QUBO over the binary variables <code>x[i,j,k]</code> described in
 * {@link VariableIndex}.
 * </p><p>
 * The objective puts each arc's distance on its diagonal entry. Constraints become penalty terms, using the
 * expansion of <code>penalty * (sum(x) - 1)^2</code>: <code>-penalty</code> on the diagonal of every variable in the
 * sum, and <code>+2*penalty</code> between every ordered pair of distinct variables in it.
 * </p>
 * <ol>
 *     <li>every customer is entered exactly once (summed over origins and vehicles)</li>
 *     <li>every customer is left exactly once (summed over destinations and vehicles)</li>
 *     <li>flow continuity per customer and vehicle: <code>+penalty</code> on the diagonal of each incoming and
 *     outgoing arc, and <code>-2*penalty</code> between them</li>
 * </ol>
 * <p>
 * The depot is exempt from the uniqueness constraints, since every vehicle both leaves and enters it.
 * </p>
 */
public class QuboEncoder {
    private QuboEncoder() {
    }

    /**
     * The default penalty coefficient. Large relative to typical distances, so that constraint violations dominate
     * the objective.
     */
    public static final double DEFAULT_PENALTY = 10.0;

    /**
     * Equivalent to <code>encode(problem, DEFAULT_PENALTY)</code>
     *
     * @param problem the problem
     * @return a fresh QUBO matrix
     */
    public static QuboMatrix encode(VRPProblem problem) {
        return encode(problem, DEFAULT_PENALTY);
    }

    /**
     * Build the QUBO matrix. All passes accumulate into the same matrix; nothing is overwritten.
     *
     * @param problem the problem
     * @param penalty the penalty coefficient for constraint violations, which must be positive
     * @return a fresh <code>n*n*v</code> square matrix (0x0 if there are no nodes or no vehicles)
     */
    public static QuboMatrix encode(VRPProblem problem, double penalty) {
        if (!(penalty > 0.0) || Double.isInfinite(penalty)) {
            throw new IllegalArgumentException("penalty must be positive and finite: " + penalty);
        }

        var index = VariableIndex.of(problem);
        var qubo = new QuboMatrix(index);

        addObjective(problem, index, qubo);
        addDestinationConstraints(index, qubo, penalty);
        addSourceConstraints(index, qubo, penalty);
        addContinuityConstraints(index, qubo, penalty);

        return qubo;
    }

    private static void addObjective(VRPProblem problem, VariableIndex index, QuboMatrix qubo) {
        var n = index.nodes();

        for (var i = 0; i < n; i++) {
            for (var j = 0; j < n; j++) {
                if (i != j) {
                    var distance = problem.distance(i, j);

                    for (var k = 0; k < index.vehicles(); k++) {
                        var idx = index.index(i, j, k);
                        qubo.add(idx, idx, distance);
                    }
                }
            }
        }
    }

    // every variable with destination j, including the self-loop x[j,j,k]
    private static void addDestinationConstraints(VariableIndex index, QuboMatrix qubo, double penalty) {
        var n = index.nodes();
        var v = index.vehicles();

        for (var j = 1; j < n; j++) {
            for (var i1 = 0; i1 < n; i1++) {
                for (var v1 = 0; v1 < v; v1++) {
                    var idx1 = index.index(i1, j, v1);

                    qubo.add(idx1, idx1, penalty * (1 - 2));

                    for (var i2 = 0; i2 < n; i2++) {
                        for (var v2 = 0; v2 < v; v2++) {
                            if (i1 != i2 || v1 != v2) {
                                qubo.add(idx1, index.index(i2, j, v2), penalty * 2);
                            }
                        }
                    }
                }
            }
        }
    }

    private static void addSourceConstraints(VariableIndex index, QuboMatrix qubo, double penalty) {
        var n = index.nodes();
        var v = index.vehicles();

        for (var i = 1; i < n; i++) {
            for (var j1 = 0; j1 < n; j1++) {
                if (j1 == i) {
                    continue;
                }
                for (var v1 = 0; v1 < v; v1++) {
                    var idx1 = index.index(i, j1, v1);

                    qubo.add(idx1, idx1, penalty * (1 - 2));

                    for (var j2 = 0; j2 < n; j2++) {
                        for (var v2 = 0; v2 < v; v2++) {
                            if (j2 != i && (j1 != j2 || v1 != v2)) {
                                qubo.add(idx1, index.index(i, j2, v2), penalty * 2);
                            }
                        }
                    }
                }
            }
        }
    }

    private static void addContinuityConstraints(VariableIndex index, QuboMatrix qubo, double penalty) {
        var n = index.nodes();

        for (var k = 1; k < n; k++) {
            for (var veh = 0; veh < index.vehicles(); veh++) {
                for (var i = 0; i < n; i++) {
                    if (i == k) {
                        continue;
                    }
                    var in = index.index(i, k, veh);

                    for (var j = 0; j < n; j++) {
                        if (j == k) {
                            continue;
                        }
                        var out = index.index(k, j, veh);

                        qubo.add(in, in, penalty);
                        qubo.add(out, out, penalty);
                        qubo.add(in, out, -penalty * 2);
                    }
                }
            }
        }
    }
}
