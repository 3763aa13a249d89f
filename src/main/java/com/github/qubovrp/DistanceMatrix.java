package com.github.qubovrp;

import java.util.Arrays;

/**
 * An immutable, symmetric matrix of non-negative travel distances with zeroes on the diagonal.
 * Row and column zero belong to the depot.
 */
public final class DistanceMatrix {
    private final double[][] distances;

    /**
     * Copies and validates the given rows.
     *
     * @param distances square matrix of distances
     * @throws IllegalArgumentException if the matrix is not square, symmetric, and non-negative with a zero diagonal
     * @see Util#validate(double[][])
     */
    public DistanceMatrix(double[][] distances) {
        Util.validate(distances);
        this.distances = copy(distances);
    }

    /**
     * Convenience factory, mostly for tests.
     *
     * @param rows the matrix rows
     * @return a new matrix
     */
    public static DistanceMatrix of(double[]... rows) {
        return new DistanceMatrix(rows);
    }

    /**
     * @return the number of rows (and columns)
     */
    public int size() {
        return distances.length;
    }

    /**
     * @param i the origin node
     * @param j the destination node
     * @return the distance from <code>i</code> to <code>j</code>
     */
    public double get(int i, int j) {
        return distances[i][j];
    }

    /**
     * @return a fresh copy of the underlying rows
     */
    public double[][] toArray() {
        return copy(distances);
    }

    private static double[][] copy(double[][] src) {
        return Arrays.stream(src).map(double[]::clone).toArray(double[][]::new);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DistanceMatrix other && Arrays.deepEquals(distances, other.distances);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(distances);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(distances);
    }
}
