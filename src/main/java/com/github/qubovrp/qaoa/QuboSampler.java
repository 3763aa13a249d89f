package com.github.qubovrp.qaoa;

import com.github.qubovrp.VRPProblem;
import com.github.qubovrp.qubo.QuboMatrix;
import com.github.qubovrp.qubo.VariableIndex;

/**
 * Produces a binary assignment vector for an encoded problem. This is the seam where a real quantum backend, or any
 * other QUBO optimizer, plugs into {@link QaoaVRPSolver}.
 */
public interface QuboSampler {
    /**
     * @param qubo    the encoded problem
     * @param problem the problem itself
     * @param params  run parameters
     * @return a vector of zeroes and ones, laid out by {@link VariableIndex}
     */
    int[] sample(QuboMatrix qubo, VRPProblem problem, QaoaParams params);
}
