package com.github.qubovrp;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * The path driven by a single vehicle.
 *
 * @param vehicleId the vehicle
 * @param path      node ids in visiting order. Starts at the depot and, unless trivial, ends there too.
 * @param distance  sum of the edge weights along <code>path</code>
 */
public record Route(int vehicleId, List<Integer> path, double distance) {
    public Route {
        path = ImmutableList.copyOf(path);
    }

    /**
     * A route is trivial if the vehicle never left the depot.
     *
     * @return true if the path has at most two entries
     */
    public boolean isTrivial() {
        return path.size() <= 2;
    }

    /**
     * @return the visited nodes, without the depot at either end
     */
    public List<Integer> customers() {
        return path.stream().filter(node -> node != 0).toList();
    }

    /**
     * Mutable accumulator used while a solver or decoder is constructing a route.
     */
    public static final class Builder {
        private final int vehicleId;
        private final List<Integer> path = new ArrayList<>();
        private double distance;

        /**
         * Starts a new path at the depot.
         *
         * @param vehicleId the vehicle driving this route
         */
        public Builder(int vehicleId) {
            this.vehicleId = vehicleId;
            path.add(0);
        }

        /**
         * @return the node at the end of the path so far
         */
        public int last() {
            return path.get(path.size() - 1);
        }

        /**
         * @return the number of entries in the path so far, including the starting depot
         */
        public int size() {
            return path.size();
        }

        /**
         * Append a node and accumulate the edge weight from the current end of the path.
         *
         * @param node      the next node
         * @param distances the distance matrix
         * @return this builder
         */
        public Builder visit(int node, DistanceMatrix distances) {
            distance += distances.get(last(), node);
            path.add(node);
            return this;
        }

        /**
         * Return to the depot, unless the vehicle never left it.
         *
         * @param distances the distance matrix
         * @return this builder
         */
        public Builder close(DistanceMatrix distances) {
            return last() == 0 ? this : visit(0, distances);
        }

        public Route build() {
            return new Route(vehicleId, path, distance);
        }
    }
}
