package com.lazygraph.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named vertex of a {@link Graph}.
 *
 * Each node keeps two edge collections, both populated only by the graph:
 * - outgoing: edges starting here, keyed by end handle. This is the owning
 * side of the edge.
 * - incoming: edges ending here, keyed by start handle. This is an index onto
 * edges owned by other nodes.
 *
 * Keying by the opposite handle makes the duplicate-edge check and unlinking
 * O(1). Both maps keep insertion order so traversals see edges in the order
 * they were created.
 *
 * A node may also carry an arbitrary payload ({@link #data()}), unrelated to
 * its identity and ignored by traversals.
 *
 * @param <T> node name type
 */
public final class GraphNode<T> {
    private final T name;
    private final int handle;
    private Object data;

    private final Map<Integer, GraphEdge<T>> outgoing = new LinkedHashMap<>();
    private final Map<Integer, GraphEdge<T>> incoming = new LinkedHashMap<>();

    private final Collection<GraphEdge<T>> outgoingView = Collections.unmodifiableCollection(outgoing.values());
    private final Collection<GraphEdge<T>> incomingView = Collections.unmodifiableCollection(incoming.values());

    GraphNode(T name, int handle) {
        this.name = name;
        this.handle = handle;
    }

    /** The unique name of this node within its graph. */
    public T name() {
        return name;
    }

    /**
     * The arena slot this node occupies in its graph. Stable for the node's
     * lifetime and never reused by another node of the same graph.
     */
    public int handle() {
        return handle;
    }

    /** The payload attached to this node, or null. */
    public Object data() {
        return data;
    }

    public void setData(Object data) {
        this.data = data;
    }

    /** Read-only view of the edges leaving this node, in creation order. */
    public Collection<GraphEdge<T>> outgoing() {
        return outgoingView;
    }

    /** Read-only view of the edges arriving at this node, in creation order. */
    public Collection<GraphEdge<T>> incoming() {
        return incomingView;
    }

    public int outDegree() {
        return outgoing.size();
    }

    public int inDegree() {
        return incoming.size();
    }

    /** Returns the edge to the node with the given handle, or null. */
    public GraphEdge<T> edgeTo(int endHandle) {
        return outgoing.get(endHandle);
    }

    boolean hasEdgeTo(int endHandle) {
        return outgoing.containsKey(endHandle);
    }

    void addOutgoing(GraphEdge<T> edge) {
        outgoing.put(edge.endHandle(), edge);
    }

    void addIncoming(GraphEdge<T> edge) {
        incoming.put(edge.startHandle(), edge);
    }

    GraphEdge<T> removeOutgoing(int endHandle) {
        return outgoing.remove(endHandle);
    }

    GraphEdge<T> removeIncoming(int startHandle) {
        return incoming.remove(startHandle);
    }

    void clearEdges() {
        outgoing.clear();
        incoming.clear();
    }

    @Override
    public String toString() {
        return "Node[" + name + "]";
    }
}
