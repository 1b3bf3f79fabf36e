package com.lazygraph.engine;

import com.lazygraph.api.PathStep;
import com.lazygraph.graph.Graph;
import com.lazygraph.graph.GraphEdge;
import com.lazygraph.graph.GraphNode;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Lazy depth-first traversal along outgoing edges, yielding nodes in
 * post-order: a node is produced only after every node first discovered
 * beneath it.
 *
 * Uses an explicit stack of frames, each holding a node and its position in
 * that node's outgoing edges, so deep graphs cannot overflow the call stack.
 * The step's distance is the node's depth in the DFS tree.
 *
 * @param <T> node name type
 */
public final class DepthFirstTraversal<T> extends AbstractTraversal<T> {
    private final ArrayDeque<Frame<T>> stack = new ArrayDeque<>();
    private final boolean[] discovered;
    private final int[] depth;
    private final int[] predecessor;

    public DepthFirstTraversal(Graph<T> graph, T source) {
        super(graph, source);
        int n = graph.slotCount();
        this.discovered = new boolean[n];
        this.depth = new int[n];
        this.predecessor = new int[n];
        Arrays.fill(predecessor, -1);

        discovered[this.source.handle()] = true;
        stack.push(new Frame<>(this.source));
    }

    @Override
    protected PathStep<T> increment() {
        if (stack.isEmpty())
            return null;
        countIncrement();

        // Descend until the top frame has no undiscovered neighbour left.
        while (true) {
            Frame<T> top = stack.peek();
            if (!top.edges.hasNext()) {
                stack.pop();
                int h = top.node.handle();
                GraphNode<T> prev = predecessor[h] < 0 ? null : graph.nodeAt(predecessor[h]);
                return new PathStep<>(top.node, depth[h], prev);
            }
            int end = top.edges.next().endHandle();
            if (!discovered[end]) {
                discovered[end] = true;
                depth[end] = depth[top.node.handle()] + 1;
                predecessor[end] = top.node.handle();
                stack.push(new Frame<>(graph.nodeAt(end)));
            }
        }
    }

    private static final class Frame<T> {
        final GraphNode<T> node;
        final Iterator<GraphEdge<T>> edges;

        Frame(GraphNode<T> node) {
            this.node = node;
            this.edges = node.outgoing().iterator();
        }
    }
}
