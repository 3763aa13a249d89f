package com.github.qubovrp;

import com.github.qubovrp.qaoa.QaoaMetrics;
import com.github.qubovrp.qaoa.QaoaParams;
import com.github.qubovrp.qaoa.QaoaVRPSolver;
import com.github.qubovrp.qubo.QuboEncoder;
import com.github.qubovrp.qubo.QuboMatrix;
import com.github.qubovrp.qubo.SolutionDecoder;
import com.github.qubovrp.solver.GreedyVRPSolver;
import com.github.qubovrp.solver.SolutionComparison;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Static entry points for callers that don't need to configure a solver. Each call uses a fresh solver with default
 * settings; construct {@link QaoaVRPSolver} or {@link GreedyVRPSolver} directly for anything else.
 */
public class QuboVrp {
    private QuboVrp() {
    }

    /**
     * @param problem the problem
     * @return the QUBO matrix, using {@link QuboEncoder#DEFAULT_PENALTY}
     */
    public static QuboMatrix vrpToQubo(VRPProblem problem) {
        return QuboEncoder.encode(problem);
    }

    /**
     * @param problem the problem
     * @param penalty the penalty coefficient, which must be positive
     * @return the QUBO matrix
     */
    public static QuboMatrix vrpToQubo(VRPProblem problem, double penalty) {
        return QuboEncoder.encode(problem, penalty);
    }

    /**
     * @param x       binary assignment vector
     * @param problem the problem
     * @return the decoded non-trivial routes
     * @see SolutionDecoder#decode(int[], VRPProblem)
     */
    public static List<Route> decodeSolution(int[] x, VRPProblem problem) {
        return SolutionDecoder.decode(x, problem);
    }

    /**
     * Run the QUBO pipeline with the default sampler.
     *
     * @param problem the problem
     * @param params  QAOA parameters
     * @return a future holding a solution tagged {@link SolverTag#QUANTUM}
     */
    public static CompletableFuture<VRPSolution> solveWithQaoa(VRPProblem problem, QaoaParams params) {
        var solver = new QaoaVRPSolver();

        solver.setParams(params);
        return solver.solveAsync(problem);
    }

    /**
     * Run the greedy solver.
     *
     * @param problem the problem
     * @return a future holding a solution tagged {@link SolverTag#CLASSICAL}, or failing with
     * {@link IllegalArgumentException} if there are no vehicles
     */
    public static CompletableFuture<VRPSolution> solveClassical(VRPProblem problem) {
        return new GreedyVRPSolver().solveAsync(problem);
    }

    public static QaoaMetrics qaoaMetrics(QaoaParams params) {
        return QaoaMetrics.compute(params);
    }

    public static DistanceMatrix randomDistanceMatrix(int numNodes) {
        return ProblemGenerator.randomDistanceMatrix(numNodes);
    }

    public static DistanceMatrix randomDistanceMatrix(int numNodes, int maxDistance) {
        return ProblemGenerator.randomDistanceMatrix(numNodes, maxDistance);
    }

    public static List<Node> nodeCoordinates(DistanceMatrix distanceMatrix) {
        return ProblemGenerator.nodeCoordinates(distanceMatrix);
    }

    /**
     * @param quantum   a solution from {@link #solveWithQaoa(VRPProblem, QaoaParams)}
     * @param classical a solution from {@link #solveClassical(VRPProblem)}
     * @return the comparison
     */
    public static SolutionComparison compare(VRPSolution quantum, VRPSolution classical) {
        return SolutionComparison.compare(quantum, classical);
    }
}
