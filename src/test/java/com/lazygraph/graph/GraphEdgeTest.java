package com.lazygraph.graph;

import com.lazygraph.api.InvalidWeightException;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphEdgeTest {

    @Test
    public void testAccessors() {
        GraphEdge<String> edge = new GraphEdge<>(0, 1, "x", "y", 0.5);
        assertEquals(0, edge.startHandle());
        assertEquals(1, edge.endHandle());
        assertEquals("x", edge.start());
        assertEquals("y", edge.end());
        assertEquals(0.5, edge.weight(), 0.0);
        assertFalse(edge.isSelfLoop());
        assertEquals("x -(0.5)-> y", edge.toString());
    }

    @Test(expected = InvalidWeightException.class)
    public void testZeroWeightRejectedAtConstruction() {
        new GraphEdge<>(0, 1, "x", "y", 0.0);
    }

    @Test(expected = InvalidWeightException.class)
    public void testNaNWeightRejected() {
        GraphEdge.requireValidWeight(Double.NaN);
    }

    @Test
    public void testTinyPositiveWeightAccepted() {
        GraphEdge.requireValidWeight(Double.MIN_VALUE);
        GraphEdge.requireValidWeight(Double.MAX_VALUE);
    }
}
