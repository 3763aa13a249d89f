package com.github.qubovrp.solver;

import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPSolution;

import java.time.Duration;
import java.util.Optional;

/**
 * Side-by-side summary of a QUBO-pipeline solution and a classical solution of the same problem.
 *
 * @param distanceDifference        quantum total distance minus classical total distance
 * @param relativeDifferencePercent <code>distanceDifference</code> as a percentage of the classical distance, or 0
 *                                  if the classical distance is 0
 * @param timeDifference            quantum execution time minus classical execution time
 */
public record SolutionComparison(double distanceDifference,
                                 double relativeDifferencePercent,
                                 Duration timeDifference) {
    /**
     * @param quantum   a solution tagged {@link SolverTag#QUANTUM}
     * @param classical a solution tagged {@link SolverTag#CLASSICAL}
     * @return the comparison
     */
    public static SolutionComparison compare(VRPSolution quantum, VRPSolution classical) {
        if (quantum.solver() != SolverTag.QUANTUM || classical.solver() != SolverTag.CLASSICAL) {
            throw new IllegalArgumentException("expected a quantum and a classical solution, got "
                    + quantum.solver() + " and " + classical.solver());
        }

        var difference = quantum.totalDistance() - classical.totalDistance();
        var percent = classical.totalDistance() == 0.0 ? 0.0 : 100.0 * difference / classical.totalDistance();

        return new SolutionComparison(difference, percent,
                quantum.executionTime().minus(classical.executionTime()));
    }

    /**
     * @return the solver family with the shorter total distance, or empty on a tie
     */
    public Optional<SolverTag> shorter() {
        if (distanceDifference < 0.0) {
            return Optional.of(SolverTag.QUANTUM);
        }
        return distanceDifference > 0.0 ? Optional.of(SolverTag.CLASSICAL) : Optional.empty();
    }
}
