package com.github.qubovrp.qaoa;

import java.util.Objects;

/**
 * QAOA run parameters. They label a run and size its diagnostics; they have no effect on the sampled assignment.
 *
 * @param p       number of QAOA layers, at least 1
 * @param backend backend name
 * @param shots   number of measurement shots, at least 1
 */
public record QaoaParams(int p, Backend backend, int shots) {
    /**
     * One layer on the QASM simulator with 1000 shots.
     */
    public static final QaoaParams DEFAULT = new QaoaParams(1, Backend.QASM_SIMULATOR, 1000);

    public QaoaParams {
        Objects.requireNonNull(backend, "backend");
        if (p < 1) {
            throw new IllegalArgumentException("p must be at least 1.");
        }
        if (shots < 1) {
            throw new IllegalArgumentException("shots must be at least 1.");
        }
    }
}
