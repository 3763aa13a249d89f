package com.github.qubovrp.qaoa;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Synthetic QAOA telemetry for display. Everything here is a closed-form function of the layer count, and says
 * nothing about any particular problem or solution.
 *
 * @param energyLevels       energy after each layer, <code>-10 * (1 - exp(-0.5 * layer))</code>
 * @param convergence        energy per optimizer iteration, <code>-10 * (1 - exp(-0.1 * iteration))</code>
 * @param eigenvalues        a fixed spectrum of eight eigenvalues
 * @param stateProbabilities a fixed distribution over the eight 3-bit states, summing to 1
 */
public record QaoaMetrics(List<EnergyLevel> energyLevels,
                          List<EnergyLevel> convergence,
                          List<Double> eigenvalues,
                          List<StateProbability> stateProbabilities) {
    static final int CONVERGENCE_ITERATIONS = 20;

    private static final List<Double> EIGENVALUES = List.of(-9.8, -7.5, -5.2, -3.1, -1.8, 0.3, 2.5, 4.7);

    private static final List<StateProbability> STATE_PROBABILITIES = List.of(
            new StateProbability("000", 0.02),
            new StateProbability("001", 0.03),
            new StateProbability("010", 0.05),
            new StateProbability("011", 0.05),
            new StateProbability("100", 0.10),
            new StateProbability("101", 0.15),
            new StateProbability("110", 0.20),
            new StateProbability("111", 0.40));

    /**
     * @param step   layer or iteration number, starting with 1
     * @param energy the energy at that step
     */
    public record EnergyLevel(int step, double energy) {
    }

    /**
     * @param state       measured bit string
     * @param probability probability of measuring it
     */
    public record StateProbability(String state, double probability) {
    }

    public QaoaMetrics {
        energyLevels = List.copyOf(energyLevels);
        convergence = List.copyOf(convergence);
        eigenvalues = List.copyOf(eigenvalues);
        stateProbabilities = List.copyOf(stateProbabilities);
    }

    /**
     * @param params only {@link QaoaParams#p()} is used
     * @return the metrics
     */
    public static QaoaMetrics compute(QaoaParams params) {
        return compute(params.p());
    }

    /**
     * @param layers number of QAOA layers, at least 1
     * @return the metrics
     */
    public static QaoaMetrics compute(int layers) {
        if (layers < 1) {
            throw new IllegalArgumentException("layers must be at least 1.");
        }
        return new QaoaMetrics(decay(layers, 0.5), decay(CONVERGENCE_ITERATIONS, 0.1), EIGENVALUES,
                STATE_PROBABILITIES);
    }

    // exponential approach toward -10
    private static List<EnergyLevel> decay(int steps, double rate) {
        return IntStream.rangeClosed(1, steps)
                .mapToObj(i -> new EnergyLevel(i, -10 * (1 - Math.exp(-rate * i))))
                .toList();
    }
}
