package com.github.qubovrp;

import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.ojalgo.type.CalendarDateDuration;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.ojalgo.type.CalendarDateUnit.MILLIS;

/**
 * Miscellaneous utilities.
 */
public class Util {
    private Util() {
    }

    /**
     * Validate a distance matrix.
     *
     * @param distances a matrix, which must be square, symmetric, non-negative and have zeroes on the diagonal.
     * @throws IllegalArgumentException if invalid
     */
    public static void validate(double[][] distances) {
        var size = distances.length;

        if (Arrays.stream(distances).anyMatch(row -> row == null || row.length != size)) {
            throw new IllegalArgumentException("distanceMatrix must be square");
        }
        for (var i = 0; i < size; i++) {
            var row = distances[i];

            if (row[i] != 0.0) {
                throw new IllegalArgumentException("distanceMatrix must have zeroes on the diagonal");
            }
            for (var j = 0; j < size; j++) {
                if (!Double.isFinite(row[j]) || row[j] < 0.0) {
                    throw new IllegalArgumentException("distanceMatrix entries must be finite and non-negative: d["
                            + i + "][" + j + "] = " + row[j]);
                }
                if (row[j] != distances[j][i]) {
                    throw new IllegalArgumentException("distanceMatrix must be symmetric: d[" + i + "][" + j + "] = "
                            + row[j] + " but d[" + j + "][" + i + "] = " + distances[j][i]);
                }
            }
        }
    }

    /**
     * Sum the edge weights along a path.
     *
     * @param path      node ids, in visiting order
     * @param distances the distance matrix
     * @return the accumulated distance, or zero for paths with fewer than two nodes
     */
    public static double pathDistance(List<Integer> path, DistanceMatrix distances) {
        var total = 0.0;

        for (var i = 1; i < path.size(); i++) {
            total += distances.get(path.get(i - 1), path.get(i));
        }
        return total;
    }

    /**
     * Helper to build a new {@link ExpressionsBasedModel} for ojAlgo, with a timeout derived from the deadline.
     *
     * @param deadline this will be converted to a timeout
     * @return the built model
     */
    public static ExpressionsBasedModel newModel(long deadline) {
        return new ExpressionsBasedModel(setTimeout(deadline, new Optimisation.Options()));
    }

    /**
     * Helper to set a timeout on an {@link Optimisation.Options} object.
     *
     * @param deadline the deadline time, which will be converted to a timeout.
     * @param opts     the options to be updated.
     * @return the same {@link Optimisation.Options} that was passed in.
     */
    public static Optimisation.Options setTimeout(long deadline, Optimisation.Options opts) {
        var duration = new CalendarDateDuration(Math.max(0L, deadline - System.currentTimeMillis()), MILLIS);
        return opts.abort(duration).suffice(duration);
    }

    /**
     * Helper to build a matrix of binary arc variables, one for every ordered pair of distinct nodes, weighted by
     * distance. Variables are created row by row, skipping the diagonal, so the variable for arc <code>i->j</code>
     * lives at model index {@link #arcIndex(int, int, int)}.
     *
     * @param distances square matrix of distances
     * @param model     the model to add vars to.
     * @return a {@link Variable[][]} having the same dimension as <code>distances</code>, with nulls on the diagonal
     */
    public static Variable[][] buildAsymmetricVars(DistanceMatrix distances, ExpressionsBasedModel model) {
        var size = distances.size();
        var vars = new Variable[size][size];

        for (var row = 0; row < size; row++) {
            var varsRow = vars[row];

            for (var col = 0; col < size; col++) {
                if (row != col) {
                    varsRow[col] = model.newVariable("x" + row + "_" + col).binary()
                            .weight(BigDecimal.valueOf(distances.get(row, col)));
                }
            }
        }
        return vars;
    }

    /**
     * Linear model index of the arc variable built by {@link #buildAsymmetricVars(DistanceMatrix,
     * ExpressionsBasedModel)}.
     *
     * @param src  the source node
     * @param dest the destination node, which must differ from <code>src</code>
     * @param size the node count
     * @return the variable's index in the model
     */
    public static int arcIndex(int src, int dest, int size) {
        return src * (size - 1) + (dest < src ? dest : dest - 1);
    }
}
