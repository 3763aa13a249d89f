package com.github.qubovrp.solver;

import com.github.qubovrp.SolverTag;
import com.github.qubovrp.VRPSolution;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

import static com.github.qubovrp.SolverTag.CLASSICAL;
import static com.github.qubovrp.SolverTag.QUANTUM;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SolutionComparisonTest {
    @Test
    void compare() {
        var comparison = SolutionComparison.compare(solution(15.0, 30L, QUANTUM), solution(12.0, 10L, CLASSICAL));

        assertEquals(3.0, comparison.distanceDifference());
        assertEquals(25.0, comparison.relativeDifferencePercent(), 1e-9);
        assertEquals(Duration.ofMillis(20L), comparison.timeDifference());
        assertEquals(Optional.of(CLASSICAL), comparison.shorter());

        comparison = SolutionComparison.compare(solution(9.0, 5L, QUANTUM), solution(12.0, 10L, CLASSICAL));
        assertEquals(-25.0, comparison.relativeDifferencePercent(), 1e-9);
        assertEquals(Duration.ofMillis(-5L), comparison.timeDifference());
        assertEquals(Optional.of(QUANTUM), comparison.shorter());
    }

    @Test
    void zeroClassicalDistance() {
        var comparison = SolutionComparison.compare(solution(0.0, 1L, QUANTUM), solution(0.0, 1L, CLASSICAL));

        assertEquals(0.0, comparison.relativeDifferencePercent());
        assertEquals(Optional.empty(), comparison.shorter());
    }

    @Test
    void wrongTags() {
        var classical = solution(1.0, 1L, CLASSICAL);

        assertThrows(IllegalArgumentException.class, () -> SolutionComparison.compare(classical, classical));
    }

    private static VRPSolution solution(double distance, long millis, SolverTag tag) {
        return new VRPSolution(List.of(), distance, Duration.ofMillis(millis), tag, new TreeSet<>());
    }
}
