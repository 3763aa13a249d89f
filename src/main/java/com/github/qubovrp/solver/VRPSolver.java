package com.github.qubovrp.solver;

import com.github.qubovrp.Route;
import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPProblem;
import com.github.qubovrp.VRPSolution;
import org.ojalgo.netio.BasicLogger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Abstract superclass of solvers for the Vehicle Routing Problem.
 * <p>
 * Assumes that there is one depot, which must be node 0. Every vehicle starts and ends its route there.
 * <p>
 * Instances hold configuration only; each call to {@link #solve(VRPProblem)} works on fresh state, so one solver
 * may serve concurrent callers as long as its configuration is not being changed at the same time.
 */
public abstract class VRPSolver {
    private boolean debug;

    /**
     * Default constructor.
     */
    protected VRPSolver() {
    }

    /**
     * Solve the problem, timing the call and packaging the routes as a {@link VRPSolution}.
     * <p>
     * Customers that the solver leaves off every route are reported in {@link VRPSolution#unassigned()} rather
     * than treated as an error.
     *
     * @param problem the problem
     * @return the solution, which may be approximate
     * @throws IllegalArgumentException if this solver cannot accept the problem
     */
    public final VRPSolution solve(VRPProblem problem) {
        Objects.requireNonNull(problem, "problem");
        validate(problem);

        var start = System.nanoTime();
        var routes = doSolve(problem);
        var solution = new VRPSolution(routes, Duration.ofNanos(System.nanoTime() - start), getSolverTag(), problem);

        debug(getClass().getSimpleName() + ": " + solution.routes().size() + " routes, total distance "
                + solution.totalDistance() + " in " + solution.executionTime().toMillis() + " ms");
        if (!solution.isComplete()) {
            debug("Unassigned customers: " + solution.unassigned());
        }
        return solution;
    }

    /**
     * Run {@link #solve(VRPProblem)} on the common pool.
     *
     * @param problem the problem
     * @return a future holding the solution, or the validation failure
     */
    public final CompletableFuture<VRPSolution> solveAsync(VRPProblem problem) {
        return CompletableFuture.supplyAsync(() -> solve(problem));
    }

    /**
     * Run {@link #solve(VRPProblem)} on the given executor.
     *
     * @param problem  the problem
     * @param executor where to run
     * @return a future holding the solution, or the validation failure
     */
    public final CompletableFuture<VRPSolution> solveAsync(VRPProblem problem, Executor executor) {
        return CompletableFuture.supplyAsync(() -> solve(problem), executor);
    }

    /**
     * Check solver-specific preconditions. Called by {@link #solve(VRPProblem)} before {@link #doSolve(VRPProblem)}.
     * The default accepts every problem.
     *
     * @param problem the problem
     * @throws IllegalArgumentException if the problem cannot be solved by this solver
     */
    protected void validate(VRPProblem problem) {
    }

    /**
     * Shared check for solvers that need at least one vehicle.
     *
     * @param problem the problem
     */
    protected static void requireVehicles(VRPProblem problem) {
        if (problem.vehicleCount() == 0) {
            throw new IllegalArgumentException("vehicles must not be empty.");
        }
    }

    /**
     * Must be implemented by subclasses. Called by {@link #solve(VRPProblem)} after performing parameter validations.
     *
     * @param problem the problem
     * @return candidate routes, one per vehicle or only the used ones; trivial routes are dropped by the caller
     */
    protected abstract List<Route> doSolve(VRPProblem problem);

    /**
     * @return the tag stamped on solutions from this solver
     */
    public abstract SolverTag getSolverTag();

    protected void debug(String s) {
        if (debug) {
            BasicLogger.debug(s);
        }
    }

    /**
     * Get the debug property
     *
     * @return true if debug logging is enabled
     */
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     * You can supply a thin wrapper implementation to redirect it to the logging library of your choice.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
