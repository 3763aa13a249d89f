package com.github.qubovrp.qaoa;

import java.util.Arrays;

/**
 * Names of the execution backends a QAOA run can be labelled with. Nothing is ever dispatched to them.
 */
public enum Backend {
    QASM_SIMULATOR("qasm_simulator"),
    AER_SIMULATOR("aer_simulator"),
    IBMQ_LIMA("ibmq_lima"),
    IBMQ_BELEM("ibmq_belem"),
    IBMQ_QUITO("ibmq_quito");

    private final String label;

    Backend(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @param label a backend name such as <code>"aer_simulator"</code>
     * @return the matching backend
     * @throws IllegalArgumentException if no backend has that name
     */
    public static Backend fromLabel(String label) {
        return Arrays.stream(values()).filter(b -> b.label.equals(label)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown backend: " + label));
    }

    @Override
    public String toString() {
        return label;
    }
}
