package com.github.qubovrp.qaoa;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QaoaParamsTest {
    @Test
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new QaoaParams(0, Backend.QASM_SIMULATOR, 1000));
        assertThrows(IllegalArgumentException.class, () -> new QaoaParams(1, Backend.QASM_SIMULATOR, 0));
        assertThrows(NullPointerException.class, () -> new QaoaParams(1, null, 1000));

        assertEquals(new QaoaParams(1, Backend.QASM_SIMULATOR, 1000), QaoaParams.DEFAULT);
    }

    @Test
    void backendLabels() {
        for (var backend : Backend.values()) {
            assertEquals(backend, Backend.fromLabel(backend.label()));
        }
        assertEquals("ibmq_quito", Backend.IBMQ_QUITO.toString());
        assertThrows(IllegalArgumentException.class, () -> Backend.fromLabel("ibmq_nowhere"));
    }
}
