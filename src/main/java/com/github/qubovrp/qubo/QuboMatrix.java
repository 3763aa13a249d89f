package com.github.qubovrp.qubo;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * The coefficient matrix <code>Q</code> of a Quadratic Unconstrained Binary Optimization problem,
 * <code>minimize x'Qx</code> over binary <code>x</code>.
 * <p>
 * The diagonal holds the linear coefficients, and the off-diagonal entries hold the quadratic ones. Entries are
 * accumulated exactly as {@link QuboEncoder} adds them; the matrix is not symmetrized, so <code>Q[a][b]</code> and
 * <code>Q[b][a]</code> may differ.
 */
public final class QuboMatrix {
    private final VariableIndex index;
    private final double[][] q;

    QuboMatrix(VariableIndex index) {
        this.index = index;
        this.q = new double[index.size()][index.size()];
    }

    void add(int row, int col, double value) {
        q[row][col] += value;
    }

    /**
     * @return the variable layout this matrix was built for
     */
    public VariableIndex index() {
        return index;
    }

    /**
     * @return the number of binary variables (rows and columns)
     */
    public int size() {
        return q.length;
    }

    public double get(int row, int col) {
        return q[row][col];
    }

    /**
     * @return a fresh copy of the coefficients
     */
    public double[][] toArray() {
        return Arrays.stream(q).map(double[]::clone).toArray(double[][]::new);
    }

    /**
     * Evaluate the objective <code>x'Qx</code>.
     *
     * @param x binary vector; entries other than 1 count as 0
     * @return the energy of <code>x</code>
     */
    public double energy(int[] x) {
        if (x.length != q.length) {
            throw new IllegalArgumentException("vector length " + x.length + " != " + q.length);
        }

        var ones = IntStream.range(0, x.length).filter(i -> x[i] == 1).toArray();
        var energy = 0.0;

        for (var a : ones) {
            var row = q[a];

            for (var b : ones) {
                energy += row[b];
            }
        }
        return energy;
    }
}
