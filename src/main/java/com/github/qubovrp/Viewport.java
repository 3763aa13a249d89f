package com.github.qubovrp;

import java.util.List;

/**
 * Maps node coordinates into a drawing box of a given size, preserving the aspect ratio.
 *
 * @param scale  multiplier applied to coordinate offsets
 * @param minX   smallest x coordinate among the fitted nodes
 * @param minY   smallest y coordinate among the fitted nodes
 * @param margin blank border around the drawing, in output units
 */
public record Viewport(double scale, double minX, double minY, double margin) {
    /**
     * Extent used in place of a zero-width or zero-height bounding box, e.g. when every node sits at the same point.
     */
    public static final double MIN_EXTENT = 1.0;

    /**
     * Fit the nodes into a <code>width</code> x <code>height</code> box.
     *
     * @param nodes  the nodes to draw
     * @param width  box width
     * @param height box height
     * @param margin blank border on every side
     * @return the viewport
     */
    public static Viewport fit(List<Node> nodes, double width, double height, double margin) {
        if (width <= 2 * margin || height <= 2 * margin) {
            throw new IllegalArgumentException("box must be larger than its margins.");
        }
        if (nodes.isEmpty()) {
            return new Viewport(1.0, 0.0, 0.0, margin);
        }

        var minX = nodes.stream().mapToDouble(Node::x).min().orElseThrow();
        var maxX = nodes.stream().mapToDouble(Node::x).max().orElseThrow();
        var minY = nodes.stream().mapToDouble(Node::y).min().orElseThrow();
        var maxY = nodes.stream().mapToDouble(Node::y).max().orElseThrow();

        var scaleX = (width - 2 * margin) / Math.max(maxX - minX, MIN_EXTENT);
        var scaleY = (height - 2 * margin) / Math.max(maxY - minY, MIN_EXTENT);

        return new Viewport(Math.min(scaleX, scaleY), minX, minY, margin);
    }

    /**
     * @param node a node
     * @return the node's horizontal position in the box
     */
    public double x(Node node) {
        return margin + (node.x() - minX) * scale;
    }

    /**
     * @param node a node
     * @return the node's vertical position in the box
     */
    public double y(Node node) {
        return margin + (node.y() - minY) * scale;
    }
}
