package com.github.qubovrp.qaoa;

import com.github.qubovrp.Route;
import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPProblem;
import com.github.qubovrp.qubo.QuboEncoder;
import com.github.qubovrp.qubo.SolutionDecoder;
import com.github.qubovrp.solver.VRPSolver;

import java.util.List;
import java.util.Objects;

/**
 * <p>
 * The quantum pipeline: encode the problem as a QUBO, hand it to a {@link QuboSampler}, and decode the sampled
 * assignment into routes.
 * </p><p>
 * The default sampler is a {@link JitteredNearestNeighborSampler}, which does not look at the QUBO at all, so by
 * default results are those of a randomized greedy heuristic. Plug in an {@link AnnealingQuboSampler} (or a real
 * backend) to have the encoding drive the search.
 * </p><p>
 * Problems with no vehicles are accepted and produce no routes; every customer is then reported as unassigned.
 * </p>
 */
public class QaoaVRPSolver extends VRPSolver {
    private QaoaParams params = QaoaParams.DEFAULT;
    private double penalty = QuboEncoder.DEFAULT_PENALTY;
    private QuboSampler sampler;

    /**
     * Solver with the default parameters and an unseeded {@link JitteredNearestNeighborSampler}.
     */
    public QaoaVRPSolver() {
        this(new JitteredNearestNeighborSampler());
    }

    /**
     * @param sampler the sampler to use
     */
    public QaoaVRPSolver(QuboSampler sampler) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }

    @Override
    protected List<Route> doSolve(VRPProblem problem) {
        var qubo = QuboEncoder.encode(problem, penalty);
        debug("QUBO: " + qubo.size() + " variables, penalty " + penalty + ", " + params);

        var x = sampler.sample(qubo, problem, params);
        if (isDebug()) {
            debug("Sampled energy: " + qubo.energy(x));
        }

        return SolutionDecoder.decode(x, problem);
    }

    @Override
    public SolverTag getSolverTag() {
        return SolverTag.QUANTUM;
    }

    public QaoaParams getParams() {
        return params;
    }

    public void setParams(QaoaParams params) {
        this.params = Objects.requireNonNull(params, "params");
    }

    public double getPenalty() {
        return penalty;
    }

    /**
     * @param penalty QUBO penalty coefficient; must be positive and finite
     */
    public void setPenalty(double penalty) {
        if (!(penalty > 0.0) || Double.isInfinite(penalty)) {
            throw new IllegalArgumentException("penalty must be positive and finite: " + penalty);
        }
        this.penalty = penalty;
    }

    public QuboSampler getSampler() {
        return sampler;
    }

    public void setSampler(QuboSampler sampler) {
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }
}
