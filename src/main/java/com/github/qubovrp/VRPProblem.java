package com.github.qubovrp;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * A Vehicle Routing Problem instance.
 * <p>
 * Node and vehicle ids must match their list positions, so node 0 is the depot and the
 * distance matrix can be indexed directly by node id. An empty fleet is a valid problem;
 * whether it can be solved is up to the solver.
 *
 * @param nodes          the depot followed by the customers
 * @param vehicles       the fleet
 * @param distanceMatrix distances between nodes, with the same dimension as <code>nodes</code>
 */
public record VRPProblem(List<Node> nodes, List<Vehicle> vehicles, DistanceMatrix distanceMatrix) {
    /**
     * @throws IllegalArgumentException if the dimensions disagree or the ids are out of position
     */
    public VRPProblem {
        Objects.requireNonNull(distanceMatrix, "distanceMatrix");
        nodes = ImmutableList.copyOf(nodes);
        vehicles = ImmutableList.copyOf(vehicles);

        if (nodes.size() != distanceMatrix.size()) {
            throw new IllegalArgumentException("nodes and distanceMatrix should have the same dimension: "
                    + nodes.size() + " != " + distanceMatrix.size());
        }
        for (var i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id() != i) {
                throw new IllegalArgumentException("node at position " + i + " has id " + nodes.get(i).id());
            }
        }
        for (var i = 0; i < vehicles.size(); i++) {
            if (vehicles.get(i).id() != i) {
                throw new IllegalArgumentException("vehicle at position " + i + " has id " + vehicles.get(i).id());
            }
        }
    }

    /**
     * Build a problem from a distance matrix, laying out the nodes with
     * {@link ProblemGenerator#nodeCoordinates(DistanceMatrix)} and creating plain vehicles.
     *
     * @param distanceMatrix the distances
     * @param vehicleCount   size of the fleet
     * @return the problem
     */
    public static VRPProblem of(DistanceMatrix distanceMatrix, int vehicleCount) {
        if (vehicleCount < 0) {
            throw new IllegalArgumentException("vehicleCount must not be negative.");
        }
        return new VRPProblem(ProblemGenerator.nodeCoordinates(distanceMatrix),
                IntStream.range(0, vehicleCount).mapToObj(Vehicle::new).toList(),
                distanceMatrix);
    }

    /**
     * @return the node count, including the depot
     */
    public int size() {
        return nodes.size();
    }

    /**
     * @return the fleet size
     */
    public int vehicleCount() {
        return vehicles.size();
    }

    /**
     * @param i origin node
     * @param j destination node
     * @return the distance from <code>i</code> to <code>j</code>
     */
    public double distance(int i, int j) {
        return distanceMatrix.get(i, j);
    }
}
