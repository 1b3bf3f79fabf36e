package com.lazygraph.graph;

import com.lazygraph.api.InvalidWeightException;

/**
 * A directed, positively weighted edge.
 *
 * Edges refer to their endpoints by arena handle (see {@link Graph}), never by
 * node reference. The owning start node keeps the edge in its outgoing
 * collection and the end node only indexes it from its incoming collection,
 * so tearing the graph down never has to chase node-to-node references.
 *
 * The endpoint names are carried alongside the handles so that an edge can be
 * reported on its own, after the graph that created it has been closed.
 *
 * @param startHandle arena handle of the start node
 * @param endHandle   arena handle of the end node
 * @param start       name of the start node
 * @param end         name of the end node
 * @param weight      finite, strictly positive weight
 * @param <T>         node name type
 */
public record GraphEdge<T>(int startHandle, int endHandle, T start, T end, double weight) {

    public GraphEdge {
        requireValidWeight(weight);
    }

    /** True for an edge whose start and end are the same node. */
    public boolean isSelfLoop() {
        return startHandle == endHandle;
    }

    /**
     * Rejects NaN, infinities, zero and negative values.
     *
     * @throws InvalidWeightException if {@code weight} cannot be used.
     */
    public static void requireValidWeight(double weight) {
        if (!(weight > 0.0) || Double.isInfinite(weight))
            throw new InvalidWeightException(weight);
    }

    @Override
    public String toString() {
        return start + " -(" + weight + ")-> " + end;
    }
}
