package com.github.qubovrp;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Generates synthetic problem instances for demonstrations and tests.
 */
public class ProblemGenerator {
    private ProblemGenerator() {
    }

    /**
     * Default upper bound for {@link #randomDistanceMatrix(int)}.
     */
    public static final int DEFAULT_MAX_DISTANCE = 100;

    /**
     * Radius of the circle that {@link #nodeCoordinates(DistanceMatrix)} lays nodes out on.
     */
    public static final double LAYOUT_RADIUS = 100.0;

    /**
     * Vehicle colors, reused cyclically by {@link #randomProblem(int, int, Random)}.
     */
    public static final List<String> VEHICLE_COLORS = List.of("#8B5CF6", "#0EA5E9", "#20E3B2", "#F59E0B", "#EF4444");

    /**
     * Equivalent to <code>randomDistanceMatrix(numNodes, DEFAULT_MAX_DISTANCE)</code>
     *
     * @param numNodes matrix dimension
     * @return a new matrix
     */
    public static DistanceMatrix randomDistanceMatrix(int numNodes) {
        return randomDistanceMatrix(numNodes, DEFAULT_MAX_DISTANCE);
    }

    /**
     * Equivalent to <code>randomDistanceMatrix(numNodes, maxDistance, new Random())</code>
     *
     * @param numNodes    matrix dimension
     * @param maxDistance inclusive upper bound of each distance
     * @return a new matrix
     */
    public static DistanceMatrix randomDistanceMatrix(int numNodes, int maxDistance) {
        return randomDistanceMatrix(numNodes, maxDistance, new Random());
    }

    /**
     * Generate a random symmetric distance matrix with integer distances drawn uniformly from
     * <code>[1, maxDistance]</code> and zeroes on the diagonal.
     *
     * @param numNodes    matrix dimension
     * @param maxDistance inclusive upper bound of each distance
     * @param random      source of randomness
     * @return a new matrix
     */
    public static DistanceMatrix randomDistanceMatrix(int numNodes, int maxDistance, Random random) {
        if (numNodes < 0) {
            throw new IllegalArgumentException("numNodes must not be negative.");
        }
        if (maxDistance < 1) {
            throw new IllegalArgumentException("maxDistance must be at least 1.");
        }

        var matrix = new double[numNodes][numNodes];

        for (var i = 0; i < numNodes; i++) {
            for (var j = i + 1; j < numNodes; j++) {
                var distance = random.nextInt(maxDistance) + 1;
                matrix[i][j] = distance;
                matrix[j][i] = distance;
            }
        }
        return new DistanceMatrix(matrix);
    }

    /**
     * Place the nodes evenly on a circle, starting with the depot at angle zero.
     * <p>
     * This is only a display layout. It makes no attempt to embed the distances.
     *
     * @param distanceMatrix only its dimension is used
     * @return one node per matrix row
     */
    public static List<Node> nodeCoordinates(DistanceMatrix distanceMatrix) {
        var n = distanceMatrix.size();

        return IntStream.range(0, n).mapToObj(i -> {
            var angle = 2 * Math.PI * i / n;
            return new Node(i, LAYOUT_RADIUS * Math.cos(angle), LAYOUT_RADIUS * Math.sin(angle),
                    i == 0 ? "Depot" : "Node " + i);
        }).toList();
    }

    /**
     * Build a complete random problem: random distances, a circular layout and a colored fleet.
     *
     * @param numNodes    node count, including the depot
     * @param numVehicles fleet size
     * @param random      source of randomness
     * @return the problem
     */
    public static VRPProblem randomProblem(int numNodes, int numVehicles, Random random) {
        if (numVehicles < 0) {
            throw new IllegalArgumentException("numVehicles must not be negative.");
        }

        var distanceMatrix = randomDistanceMatrix(numNodes, DEFAULT_MAX_DISTANCE, random);
        var vehicles = IntStream.range(0, numVehicles)
                .mapToObj(i -> new Vehicle(i, null, VEHICLE_COLORS.get(i % VEHICLE_COLORS.size())))
                .toList();

        return new VRPProblem(nodeCoordinates(distanceMatrix), vehicles, distanceMatrix);
    }
}
