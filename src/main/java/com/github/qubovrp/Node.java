package com.github.qubovrp;

/**
 * A location in the problem. Node 0 is always the depot.
 *
 * @param id    index into the distance matrix
 * @param x     horizontal display coordinate
 * @param y     vertical display coordinate
 * @param label optional display label; may be null
 */
public record Node(int id, double x, double y, String label) {
    /**
     * Unlabelled node.
     *
     * @param id index into the distance matrix
     * @param x  horizontal display coordinate
     * @param y  vertical display coordinate
     */
    public Node(int id, double x, double y) {
        this(id, x, y, null);
    }

    /**
     * @return true for node 0
     */
    public boolean isDepot() {
        return id == 0;
    }
}
