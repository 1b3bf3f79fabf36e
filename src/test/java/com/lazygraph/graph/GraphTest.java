package com.lazygraph.graph;

import com.lazygraph.api.DuplicateEdgeException;
import com.lazygraph.api.DuplicateKeyException;
import com.lazygraph.api.InvalidWeightException;
import com.lazygraph.api.UnknownEdgeException;
import com.lazygraph.api.UnknownNodeException;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.*;

public class GraphTest {

    private Graph<String> graph;

    @Before
    public void setUp() {
        graph = Graph.of("A", "B", "C");
    }

    @Test
    public void testCreateNode() {
        GraphNode<String> d = graph.createNode("D");
        assertEquals("D", d.name());
        assertEquals(3, d.handle());
        assertEquals(4, graph.size());
        assertTrue(graph.containsNode("D"));
        assertSame(d, graph.node("D"));
        assertEquals(0, d.outDegree());
        assertEquals(0, d.inDegree());
    }

    @Test
    public void testNodeData() {
        assertNull(graph.node("A").data());
        GraphNode<String> d = graph.createNode("D", 42);
        assertEquals(42, d.data());
        d.setData("changed");
        assertEquals("changed", graph.node("D").data());
    }

    @Test
    public void testPutNodeCreatesOrUpdates() {
        graph.createLink("A", "B", 2.0);
        GraphNode<String> a = graph.putNode("A", "payload");
        assertSame(a, graph.node("A"));
        assertEquals("payload", a.data());
        assertTrue(graph.isLinked("A", "B"));
        assertEquals(3, graph.size());

        GraphNode<String> e = graph.putNode("E", List.of(1, 2));
        assertEquals(4, graph.size());
        assertEquals(List.of(1, 2), e.data());
        assertEquals(3, e.handle());
    }

    @Test
    public void testNodesInCreationOrder() {
        List<String> names = new ArrayList<>();
        for (GraphNode<String> node : graph)
            names.add(node.name());
        assertEquals(List.of("A", "B", "C"), names);
    }

    @Test
    public void testDuplicateNodeException() {
        try {
            graph.createNode("A");
            fail("Expected DuplicateKeyException");
        } catch (DuplicateKeyException e) {
            assertEquals("A", e.key());
        }
        assertEquals(3, graph.size());
    }

    @Test(expected = DuplicateKeyException.class)
    public void testDuplicateNodeInFactory() {
        Graph.of(1, 2, 1);
    }

    @Test
    public void testCreateLink() {
        GraphEdge<String> edge = graph.createLink("A", "B", 2.5);
        assertEquals("A", edge.start());
        assertEquals("B", edge.end());
        assertEquals(2.5, edge.weight(), 0.0);

        assertTrue(graph.isLinked("A", "B"));
        assertFalse(graph.isLinked("B", "A"));
        assertEquals(1, graph.edgeCount());
        assertEquals(List.of(edge), new ArrayList<>(graph.node("A").outgoing()));
        assertEquals(List.of(edge), new ArrayList<>(graph.node("B").incoming()));
        assertTrue(graph.node("A").incoming().isEmpty());
        assertTrue(graph.node("B").outgoing().isEmpty());
    }

    @Test
    public void testDefaultWeightIsOne() {
        assertEquals(1.0, graph.createLink("A", "C").weight(), 0.0);
    }

    @Test
    public void testUnknownStartException() {
        try {
            graph.createLink("X", "B", 1.0);
            fail("Expected UnknownNodeException");
        } catch (UnknownNodeException e) {
            assertEquals("X", e.key());
        }
    }

    @Test(expected = UnknownNodeException.class)
    public void testUnknownEndException() {
        graph.createLink("A", "X", 1.0);
    }

    @Test
    public void testUnknownNodeCheckedBeforeWeight() {
        try {
            graph.createLink("A", "X", -1.0);
            fail("Expected UnknownNodeException");
        } catch (UnknownNodeException e) {
            assertEquals("X", e.key());
        }
    }

    @Test
    public void testInvalidWeights() {
        double[] bad = { 0.0, -0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY };
        for (double w : bad) {
            try {
                graph.createLink("A", "B", w);
                fail("Expected InvalidWeightException for " + w);
            } catch (InvalidWeightException e) {
                assertEquals(Double.doubleToLongBits(w), Double.doubleToLongBits(e.weight()));
            }
        }
        assertEquals(0, graph.edgeCount());
        assertFalse(graph.isLinked("A", "B"));
    }

    @Test
    public void testDuplicateEdgeException() {
        graph.createLink("A", "B", 1.0);
        try {
            graph.createLink("A", "B", 5.0);
            fail("Expected DuplicateEdgeException");
        } catch (DuplicateEdgeException e) {
            assertEquals("A", e.start());
            assertEquals("B", e.end());
        }
        // Original edge untouched, reverse direction still allowed
        assertEquals(1.0, graph.node("A").edgeTo(graph.node("B").handle()).weight(), 0.0);
        graph.createLink("B", "A", 5.0);
        assertEquals(2, graph.edgeCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testErrorsAreIllegalArgumentExceptions() {
        graph.createLink("A", "B", 0.0);
    }

    @Test
    public void testSelfLoopAllowed() {
        GraphEdge<String> loop = graph.createLink("A", "A", 3.0);
        assertTrue(loop.isSelfLoop());
        assertTrue(graph.isLinked("A", "A"));
        assertEquals(1, graph.node("A").outDegree());
        assertEquals(1, graph.node("A").inDegree());
        assertTrue(graph.verifyStructure());
    }

    @Test
    public void testUnlink() {
        graph.createLink("A", "B", 1.0);
        graph.createLink("A", "C", 1.0);
        GraphEdge<String> removed = graph.unlink("A", "B");

        assertEquals("B", removed.end());
        assertFalse(graph.isLinked("A", "B"));
        assertTrue(graph.isLinked("A", "C"));
        assertEquals(0, graph.node("B").inDegree());
        assertEquals(1, graph.edgeCount());
        assertTrue(graph.verifyStructure());

        // Can be re-created after unlinking
        graph.createLink("A", "B", 7.0);
        assertTrue(graph.isLinked("A", "B"));
    }

    @Test(expected = UnknownEdgeException.class)
    public void testUnlinkMissingEdge() {
        graph.unlink("A", "B");
    }

    @Test(expected = UnknownNodeException.class)
    public void testIsLinkedUnknownNode() {
        graph.isLinked("A", "Z");
    }

    @Test
    public void testRemoveNode() {
        graph.createLink("A", "B", 1.0);
        graph.createLink("B", "C", 1.0);
        graph.createLink("C", "B", 1.0);
        graph.createLink("B", "B", 1.0);
        graph.createLink("A", "C", 1.0);

        GraphNode<String> b = graph.removeNode("B");

        assertFalse(graph.containsNode("B"));
        assertEquals(2, graph.size());
        assertEquals(1, graph.edgeCount());
        assertEquals(0, b.outDegree());
        assertEquals(0, b.inDegree());
        assertEquals(1, graph.node("A").outDegree());
        assertEquals(0, graph.node("C").outDegree());
        assertEquals(1, graph.node("C").inDegree());
        assertNull(graph.nodeAt(b.handle()));
        assertTrue(graph.verifyStructure());
    }

    @Test
    public void testRemovedHandleNotReused() {
        graph.removeNode("C");
        GraphNode<String> c = graph.createNode("C");
        assertEquals(3, c.handle());
        assertEquals(4, graph.slotCount());
    }

    @Test(expected = UnknownNodeException.class)
    public void testRemoveUnknownNode() {
        graph.removeNode("Z");
    }

    @Test
    public void testCloseSeversAllEdges() {
        graph.createLink("A", "B", 1.0);
        graph.createLink("B", "C", 1.0);
        graph.createLink("C", "A", 1.0);
        graph.createLink("A", "A", 1.0);
        List<GraphNode<String>> nodes = new ArrayList<>(graph.nodes());

        graph.close();

        assertTrue(graph.isClosed());
        for (GraphNode<String> node : nodes) {
            assertTrue(node.outgoing().isEmpty());
            assertTrue(node.incoming().isEmpty());
        }
    }

    @Test
    public void testCloseIsIdempotent() {
        graph.createLink("A", "B", 1.0);
        graph.close();
        graph.close();
        assertTrue(graph.isClosed());
        assertEquals("Graph[closed]", graph.toString());
    }

    @Test(expected = IllegalStateException.class)
    public void testUseAfterClose() {
        graph.close();
        graph.createNode("D");
    }

    @Test(expected = IllegalStateException.class)
    public void testQueryAfterClose() {
        graph.close();
        graph.size();
    }

    @Test
    public void testTryWithResources() {
        GraphNode<Integer> kept;
        try (Graph<Integer> g = Graph.of(1, 2)) {
            g.createLink(1, 2, 1.0);
            kept = g.node(2);
            assertEquals(1, kept.inDegree());
        }
        assertEquals(0, kept.inDegree());
    }

    @Test
    public void testBigBipartiteGraph() {
        Random rng = new Random(7);
        List<String> side1 = new ArrayList<>();
        List<String> side2 = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            side1.add("a" + i);
            side2.add("b" + i);
        }
        Graph<String> g = new Graph<>();
        Collections.shuffle(side1, rng);
        Collections.shuffle(side2, rng);
        side1.forEach(g::createNode);
        side2.forEach(g::createNode);

        for (String a : side1)
            for (String b : side2)
                g.createLink(a, b, 1.0);
        for (String b1 : side2)
            for (String b2 : side2)
                g.createLink(b1, b2, 1.0);
        assertEquals(40 * 40 * 2, g.edgeCount());

        for (String a : side1) {
            for (String other : side1)
                assertFalse(g.isLinked(a, other));
            for (String b : side2)
                assertTrue(g.isLinked(a, b));
        }

        // Delete the b side one at a time; structure stays consistent throughout
        Collections.shuffle(side2, rng);
        int expected = g.size();
        List<String> alive = new ArrayList<>(side2);
        for (String b : side2) {
            g.removeNode(b);
            alive.remove(b);
            expected--;
            assertEquals(expected, g.size());
            assertTrue(g.verifyStructure());
            for (String x : alive)
                for (String y : alive)
                    assertTrue(g.isLinked(x, y));
        }
        assertEquals(0, g.edgeCount());
        g.close();
    }

    @Test
    public void testReachesAll() {
        graph.createLink("A", "B", 1.0);
        assertFalse(graph.reachesAll("A"));
        graph.createLink("B", "C", 1.0);
        assertTrue(graph.reachesAll("A"));
        assertFalse(graph.reachesAll("C"));
    }

    @Test(expected = UnknownNodeException.class)
    public void testShortestPathsUnknownSourceFailsImmediately() {
        graph.shortestPaths("Z");
    }

    @Test
    public void testNodesViewIsReadOnly() {
        try {
            graph.nodes().clear();
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException expected) {
            assertEquals(3, graph.size());
        }
    }
}
