package com.github.qubovrp.qaoa;

import com.github.qubovrp.DistanceMatrix;
import com.github.qubovrp.ProblemGenerator;
import com.github.qubovrp.Route;
import com.github.qubovrp.VRPProblem;
import com.github.qubovrp.qubo.QuboEncoder;
import com.github.qubovrp.qubo.SolutionDecoder;
import com.github.qubovrp.qubo.VariableIndex;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitteredNearestNeighborSamplerTest {
    @Test
    void sameSeedSameSample() {
        var problem = ProblemGenerator.randomProblem(7, 2, new Random(5L));
        var qubo = QuboEncoder.encode(problem);

        var a = new JitteredNearestNeighborSampler(new Random(11L)).sample(qubo, problem, QaoaParams.DEFAULT);
        var b = new JitteredNearestNeighborSampler(new Random(11L)).sample(qubo, problem, QaoaParams.DEFAULT);

        assertArrayEquals(a, b);
        assertEquals(VariableIndex.of(problem).size(), a.length);
        assertTrue(Arrays.stream(a).allMatch(bit -> bit == 0 || bit == 1));
    }

    /**
     * The chain 0-1-2-3 is ten times shorter than anything else, which no jitter can overcome.
     */
    @Test
    void followsClearlyNearest() {
        var problem = VRPProblem.of(DistanceMatrix.of(
                new double[]{0, 1, 10, 10},
                new double[]{1, 0, 1, 10},
                new double[]{10, 1, 0, 1},
                new double[]{10, 10, 1, 0}), 2);
        var random = new Random();

        for (var i = 0; i < 20; i++) {
            var x = new JitteredNearestNeighborSampler(random).sample(null, problem, QaoaParams.DEFAULT);

            assertEquals(List.of(new Route(0, List.of(0, 1, 2, 3, 0), 13.0)), SolutionDecoder.decode(x, problem));
        }
    }

    @Test
    void balanced() {
        var problem = ProblemGenerator.randomProblem(8, 3, new Random(8L));
        var sampler = new JitteredNearestNeighborSampler(new Random(8L));
        sampler.setBalanced(true);

        var routes = SolutionDecoder.decode(sampler.sample(null, problem, QaoaParams.DEFAULT), problem);

        // 7 customers over 3 vehicles: at most 3 each
        assertEquals(List.of(3, 3, 1), routes.stream().map(route -> route.customers().size()).toList());
        assertTrue(sampler.isBalanced());
    }

    @Test
    void emptyFleet() {
        var problem = ProblemGenerator.randomProblem(4, 0, new Random(1L));

        assertEquals(0, new JitteredNearestNeighborSampler().sample(null, problem, QaoaParams.DEFAULT).length);
    }
}
