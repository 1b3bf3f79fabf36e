package com.lazygraph.engine;

import com.lazygraph.api.PathStep;
import com.lazygraph.graph.Graph;
import com.lazygraph.graph.GraphEdge;
import com.lazygraph.graph.GraphNode;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Lazy breadth-first traversal along outgoing edges.
 *
 * Each increment dequeues one node, discovers its unvisited neighbours in
 * edge-creation order and yields the dequeued node. The step's distance is
 * its hop count from the source; its predecessor is the node that discovered
 * it.
 *
 * @param <T> node name type
 */
public final class BreadthFirstTraversal<T> extends AbstractTraversal<T> {
    private final ArrayDeque<Integer> queue = new ArrayDeque<>();
    private final boolean[] discovered;
    private final int[] depth;
    private final int[] predecessor;

    public BreadthFirstTraversal(Graph<T> graph, T source) {
        super(graph, source);
        int n = graph.slotCount();
        this.discovered = new boolean[n];
        this.depth = new int[n];
        this.predecessor = new int[n];
        Arrays.fill(predecessor, -1);

        int h = this.source.handle();
        discovered[h] = true;
        queue.add(h);
    }

    @Override
    protected PathStep<T> increment() {
        Integer head = queue.poll();
        if (head == null)
            return null;
        countIncrement();

        GraphNode<T> node = graph.nodeAt(head);
        for (GraphEdge<T> edge : node.outgoing()) {
            int end = edge.endHandle();
            if (!discovered[end]) {
                discovered[end] = true;
                depth[end] = depth[head] + 1;
                predecessor[end] = head;
                queue.add(end);
            }
        }
        GraphNode<T> prev = predecessor[head] < 0 ? null : graph.nodeAt(predecessor[head]);
        return new PathStep<>(node, depth[head], prev);
    }
}
