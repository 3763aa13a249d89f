package com.github.qubovrp;

/**
 * Identifies which family of solver produced a {@link VRPSolution}.
 */
public enum SolverTag {
    /**
     * The QUBO pipeline (encode, sample, decode).
     */
    QUANTUM("quantum"),
    /**
     * A solver that works on the distance matrix directly.
     */
    CLASSICAL("classical");

    private final String label;

    SolverTag(String label) {
        this.label = label;
    }

    /**
     * @return the lower-case display label
     */
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
