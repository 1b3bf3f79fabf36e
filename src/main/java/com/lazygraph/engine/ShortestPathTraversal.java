package com.lazygraph.engine;

import com.lazygraph.api.PathStep;
import com.lazygraph.graph.Graph;
import com.lazygraph.graph.GraphEdge;
import com.lazygraph.graph.GraphNode;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lazy single-source shortest paths (Dijkstra) over a {@link Graph}.
 *
 * Each pulled step runs exactly one increment of the algorithm, so a consumer
 * that stops after k steps pays for k increments and nothing more. The
 * remaining working set is simply dropped with the traversal.
 *
 * Working Set:
 * Indexed by arena handle rather than held in a map of objects:
 * - distance[h]: best known distance to node h, +infinity until reached.
 * - predecessor[h]: handle of the node h was last relaxed from, or -1.
 * - unsettled[h]: true while h is still in the working set.
 * - reached[h]: true once some path to h is known. Kept apart from distance
 * because a sum of large finite weights can overflow to +infinity.
 * Slots of nodes removed before construction never enter the working set.
 *
 * Increment:
 * 1. Scan unsettled slots in handle order and select the reached slot with
 * the minimum distance. On ties the first slot scanned wins, i.e. the
 * earliest-created node.
 * 2. Remove it from the working set.
 * 3. If it was never reached nothing else is reachable: terminate.
 * 4. Relax its outgoing edges into unsettled nodes.
 * 5. Yield it as an immutable {@link PathStep}.
 *
 * The scan is O(n) per step, O(n^2) overall, in exchange for no heap
 * bookkeeping and fully deterministic tie-breaking.
 *
 * Output Guarantees (all weights are positive):
 * - The first step is the source, at distance 0 with no predecessor.
 * - Distances are non-decreasing from step to step. A path whose length
 * overflows the double range is still yielded, at +infinity, after every
 * finite one.
 * - Unreachable nodes are never yielded; reaching them is normal termination.
 *
 * @param <T> node name type
 */
public final class ShortestPathTraversal<T> extends AbstractTraversal<T> {
    private static final Logger log = LogManager.getLogger(ShortestPathTraversal.class);

    private final double[] distance;
    private final int[] predecessor;
    private final boolean[] unsettled;
    private final boolean[] reached;
    private int remaining;

    /**
     * Builds the working set: every node currently in the graph at +infinity,
     * except the source at 0.
     *
     * @throws com.lazygraph.api.UnknownNodeException if the source is absent.
     */
    public ShortestPathTraversal(Graph<T> graph, T source) {
        super(graph, source);
        int n = graph.slotCount();
        this.distance = new double[n];
        this.predecessor = new int[n];
        this.unsettled = new boolean[n];
        this.reached = new boolean[n];
        Arrays.fill(distance, Double.POSITIVE_INFINITY);
        Arrays.fill(predecessor, -1);
        for (int h = 0; h < n; h++) {
            if (graph.nodeAt(h) != null) {
                unsettled[h] = true;
                remaining++;
            }
        }
        distance[this.source.handle()] = 0.0;
        reached[this.source.handle()] = true;
    }

    @Override
    protected PathStep<T> increment() {
        if (remaining == 0) {
            log.debug("Shortest paths from {}: working set exhausted", source.name());
            return null;
        }
        countIncrement();

        // 1. Select the closest unsettled node, reached before unreached;
        // strict '<' keeps the first on ties.
        int best = -1;
        for (int h = 0; h < unsettled.length; h++) {
            if (unsettled[h] && (best < 0 || closer(h, best)))
                best = h;
        }

        // 2. Settle it.
        unsettled[best] = false;
        remaining--;

        // 3. Everything left is unreachable.
        if (!reached[best]) {
            log.debug("Shortest paths from {}: {} node(s) unreachable", source.name(), remaining + 1);
            return null;
        }

        // 4. Relax.
        GraphNode<T> settled = graph.nodeAt(best);
        double base = distance[best];
        for (GraphEdge<T> edge : settled.outgoing()) {
            int end = edge.endHandle();
            if (!unsettled[end])
                continue;
            double candidate = base + edge.weight();
            if (!reached[end] || candidate < distance[end]) {
                reached[end] = true;
                distance[end] = candidate;
                predecessor[end] = best;
            }
        }

        GraphNode<T> prev = predecessor[best] < 0 ? null : graph.nodeAt(predecessor[best]);
        PathStep<T> step = new PathStep<>(settled, base, prev);
        log.trace("Settled {}", step);
        return step;
    }

    private boolean closer(int h, int best) {
        if (!reached[h])
            return false;
        return !reached[best] || distance[h] < distance[best];
    }

    /** Number of nodes still in the working set. */
    public int remaining() {
        return remaining;
    }
}
