package com.lazygraph.api;

import com.lazygraph.graph.GraphNode;

/**
 * One finalized result of a traversal: the node reached, its distance from the
 * source, and the node it was reached from.
 *
 * For a shortest-path traversal {@code distance} is the weighted path length
 * and {@code distance(predecessor) + weight(predecessor -> node)} equals it.
 * Breadth- and depth-first traversals report the hop count instead.
 *
 * Steps are immutable; later steps never alter one that was already handed out.
 *
 * @param node        the node reached.
 * @param distance    distance from the source; 0 for the source itself.
 * @param predecessor previous node on the path, or null for the source.
 * @param <T>         node name type
 */
public record PathStep<T>(GraphNode<T> node, double distance, GraphNode<T> predecessor) {

    public T name() {
        return node.name();
    }

    public boolean hasPredecessor() {
        return predecessor != null;
    }

    /** Name of the predecessor, or null for the source. */
    public T predecessorName() {
        return predecessor == null ? null : predecessor.name();
    }

    @Override
    public String toString() {
        return node.name() + "/" + distance + "(" + predecessorName() + ")";
    }
}
