package com.github.qubovrp.qubo;

import com.github.qubovrp.VRPProblem;

/**
 * Maps the binary decision variable <code>x[i,j,k]</code> (vehicle <code>k</code> travels directly from node
 * <code>i</code> to node <code>j</code>) to a position in a flat vector, and back.
 * <p>
 * The layout is <code>i*n*v + j*v + k</code>. The encoder, the samplers and the decoder all go through this class,
 * so they agree on it bit-for-bit.
 *
 * @param nodes    node count, including the depot
 * @param vehicles fleet size
 */
public record VariableIndex(int nodes, int vehicles) {
    public VariableIndex {
        if (nodes < 0 || vehicles < 0) {
            throw new IllegalArgumentException("nodes and vehicles must not be negative.");
        }
    }

    public static VariableIndex of(VRPProblem problem) {
        return new VariableIndex(problem.size(), problem.vehicleCount());
    }

    /**
     * @return the number of binary variables, <code>n*n*v</code>
     * @throws ArithmeticException if that does not fit in an <code>int</code>
     */
    public int size() {
        return Math.multiplyExact(Math.multiplyExact(nodes, nodes), vehicles);
    }

    /**
     * @param i       origin node
     * @param j       destination node
     * @param vehicle vehicle
     * @return the linear index of <code>x[i,j,vehicle]</code>
     */
    public int index(int i, int j, int vehicle) {
        return i * nodes * vehicles + j * vehicles + vehicle;
    }

    /**
     * @throws IllegalStateException if this layout has no variables
     */
    public int origin(int index) {
        requireVariables();
        return index / (nodes * vehicles);
    }

    /**
     * @throws IllegalStateException if this layout has no variables
     */
    public int destination(int index) {
        requireVariables();
        return index / vehicles % nodes;
    }

    /**
     * @throws IllegalStateException if this layout has no variables
     */
    public int vehicle(int index) {
        requireVariables();
        return index % vehicles;
    }

    private void requireVariables() {
        if (nodes == 0 || vehicles == 0) {
            throw new IllegalStateException("layout has no variables: " + nodes + " nodes, " + vehicles
                    + " vehicles.");
        }
    }
}
