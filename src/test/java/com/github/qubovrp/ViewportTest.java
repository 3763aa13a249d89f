package com.github.qubovrp;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ViewportTest {
    @Test
    void fit() {
        var nodes = List.of(new Node(0, -10, 0), new Node(1, 10, 5));
        var viewport = Viewport.fit(nodes, 220, 220, 10);

        // x extent 20 and y extent 5 into a 200x200 area; x is the binding one
        assertEquals(10.0, viewport.scale());
        assertEquals(10.0, viewport.x(nodes.get(0)));
        assertEquals(210.0, viewport.x(nodes.get(1)));
        assertEquals(60.0, viewport.y(nodes.get(1)));
    }

    @Test
    void degenerate() {
        // every node at the same point
        var nodes = List.of(new Node(0, 3, 3), new Node(1, 3, 3));
        var viewport = Viewport.fit(nodes, 120, 100, 10);

        assertEquals(80.0, viewport.scale());
        assertEquals(10.0, viewport.x(nodes.get(1)));

        assertEquals(1.0, Viewport.fit(List.of(), 100, 100, 10).scale());
        assertThrows(IllegalArgumentException.class, () -> Viewport.fit(nodes, 20, 100, 10));
    }
}
