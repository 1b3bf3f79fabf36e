package com.lazygraph.graph;

import com.lazygraph.api.DuplicateEdgeException;
import com.lazygraph.api.DuplicateKeyException;
import com.lazygraph.api.PathStep;
import com.lazygraph.api.UnknownEdgeException;
import com.lazygraph.api.UnknownNodeException;
import com.lazygraph.engine.BreadthFirstTraversal;
import com.lazygraph.engine.DepthFirstTraversal;
import com.lazygraph.engine.ShortestPathTraversal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A directed, positively weighted graph keyed by application-supplied names.
 *
 * Storage Model:
 * Nodes live in an arena, a list indexed by a dense integer handle assigned at
 * creation. A name map resolves names to nodes. Edges store the handles of
 * their endpoints instead of references to the node objects, so the
 * node/edge structure never forms a reference cycle that teardown would have
 * to break by hand. Handles of removed nodes are left empty and never reused.
 *
 * Ownership:
 * The graph is the only entity that creates edges. An edge is owned by its
 * start node's outgoing collection and merely indexed from its end node's
 * incoming collection.
 *
 * Lifecycle:
 * Nodes and edges accumulate under normal use. {@link #close()} severs every
 * node's edge collections, removing back-references from neighbours first,
 * after which each node can be reclaimed independently. Closing twice is a
 * no-op; any other use of a closed graph throws IllegalStateException.
 *
 * Thread Safety:
 * None. Structural changes made while a traversal over this graph is in
 * flight are detected on that traversal's next pull and fail with
 * ConcurrentModificationException.
 *
 * @param <T> node name type; must have consistent equals/hashCode.
 */
public final class Graph<T> implements AutoCloseable, Iterable<GraphNode<T>> {
    private static final Logger log = LogManager.getLogger(Graph.class);

    // Arena: slot i holds the node with handle i, or null once removed.
    private final List<GraphNode<T>> slots = new ArrayList<>();
    private final Map<T, GraphNode<T>> nodesByName = new LinkedHashMap<>();
    private final Collection<GraphNode<T>> nodesView = Collections.unmodifiableCollection(nodesByName.values());

    private int edgeCount;
    // Bumped on every structural change; traversals compare against it.
    private int version;
    private boolean closed;

    /** Creates a graph containing the given nodes, in order. */
    @SafeVarargs
    public static <T> Graph<T> of(T... names) {
        Graph<T> graph = new Graph<>();
        for (T name : names)
            graph.createNode(name);
        return graph;
    }

    /**
     * Creates a node with no edges.
     *
     * @param name unique, non-null name.
     * @return the new node.
     * @throws DuplicateKeyException if a node with this name already exists.
     */
    public GraphNode<T> createNode(T name) {
        requireOpen();
        Objects.requireNonNull(name, "name");
        if (nodesByName.containsKey(name))
            throw new DuplicateKeyException(name);
        GraphNode<T> node = new GraphNode<>(name, slots.size());
        slots.add(node);
        nodesByName.put(name, node);
        version++;
        log.debug("Created node {} (handle {})", name, node.handle());
        return node;
    }

    /**
     * Creates a node carrying {@code data}.
     *
     * @throws DuplicateKeyException if a node with this name already exists.
     */
    public GraphNode<T> createNode(T name, Object data) {
        GraphNode<T> node = createNode(name);
        node.setData(data);
        return node;
    }

    /**
     * Attaches {@code data} to the named node, creating the node first if it
     * does not exist yet. An existing node keeps its edges.
     *
     * @return the node.
     */
    public GraphNode<T> putNode(T name, Object data) {
        requireOpen();
        GraphNode<T> node = nodesByName.get(name);
        if (node == null)
            return createNode(name, data);
        node.setData(data);
        return node;
    }

    /**
     * Creates the directed edge {@code start -> end}.
     *
     * Checks run in a fixed order: both endpoints exist, then the weight, then
     * edge uniqueness.
     *
     * @return the new edge.
     * @throws UnknownNodeException   if either name is absent.
     * @throws com.lazygraph.api.InvalidWeightException if the weight is not finite and positive.
     * @throws DuplicateEdgeException if {@code start -> end} already exists.
     */
    public GraphEdge<T> createLink(T start, T end, double weight) {
        requireOpen();
        GraphNode<T> from = node(start);
        GraphNode<T> to = node(end);
        GraphEdge.requireValidWeight(weight);
        if (from.hasEdgeTo(to.handle()))
            throw new DuplicateEdgeException(start, end);

        GraphEdge<T> edge = new GraphEdge<>(from.handle(), to.handle(), from.name(), to.name(), weight);
        from.addOutgoing(edge);
        to.addIncoming(edge);
        edgeCount++;
        version++;
        log.debug("Linked {}", edge);
        return edge;
    }

    /** Creates {@code start -> end} with weight 1.0. */
    public GraphEdge<T> createLink(T start, T end) {
        return createLink(start, end, 1.0);
    }

    /**
     * Removes the edge {@code start -> end} from both endpoints.
     *
     * @return the removed edge.
     * @throws UnknownNodeException if either name is absent.
     * @throws UnknownEdgeException if there is no such edge.
     */
    public GraphEdge<T> unlink(T start, T end) {
        requireOpen();
        GraphNode<T> from = node(start);
        GraphNode<T> to = node(end);
        GraphEdge<T> edge = from.removeOutgoing(to.handle());
        if (edge == null)
            throw new UnknownEdgeException(start, end);
        to.removeIncoming(from.handle());
        edgeCount--;
        version++;
        log.debug("Unlinked {}", edge);
        return edge;
    }

    /**
     * @return true if the edge {@code start -> end} exists.
     * @throws UnknownNodeException if either name is absent.
     */
    public boolean isLinked(T start, T end) {
        requireOpen();
        GraphNode<T> from = node(start);
        GraphNode<T> to = node(end);
        return from.hasEdgeTo(to.handle());
    }

    /**
     * Removes a node together with every edge touching it. Neighbours lose
     * their references to those edges before the node is dropped.
     *
     * @return the removed node, now without edges.
     * @throws UnknownNodeException if the name is absent.
     */
    public GraphNode<T> removeNode(T name) {
        requireOpen();
        GraphNode<T> node = node(name);
        int removed = detach(node);
        slots.set(node.handle(), null);
        nodesByName.remove(name);
        edgeCount -= removed;
        version++;
        log.debug("Removed node {} and {} edge(s)", name, removed);
        return node;
    }

    // Clears a node's edges and the matching entries in its neighbours.
    // Returns the number of distinct edges dropped; a self-loop counts once.
    private int detach(GraphNode<T> node) {
        int removed = 0;
        for (GraphEdge<T> edge : node.outgoing()) {
            slots.get(edge.endHandle()).removeIncoming(node.handle());
            removed++;
        }
        for (GraphEdge<T> edge : node.incoming()) {
            if (edge.isSelfLoop())
                continue;
            slots.get(edge.startHandle()).removeOutgoing(node.handle());
            removed++;
        }
        node.clearEdges();
        return removed;
    }

    /**
     * Resolves a name to its node.
     *
     * @throws UnknownNodeException if the name is absent.
     */
    public GraphNode<T> node(T name) {
        requireOpen();
        GraphNode<T> node = nodesByName.get(name);
        if (node == null)
            throw new UnknownNodeException(name);
        return node;
    }

    public boolean containsNode(T name) {
        requireOpen();
        return nodesByName.containsKey(name);
    }

    /** Read-only view of all nodes, in creation order. */
    public Collection<GraphNode<T>> nodes() {
        requireOpen();
        return nodesView;
    }

    @Override
    public Iterator<GraphNode<T>> iterator() {
        return nodes().iterator();
    }

    public int size() {
        requireOpen();
        return nodesByName.size();
    }

    public int edgeCount() {
        requireOpen();
        return edgeCount;
    }

    /**
     * Number of arena slots handed out so far, including slots of removed
     * nodes. Valid handles are {@code 0 .. slotCount() - 1}.
     */
    public int slotCount() {
        requireOpen();
        return slots.size();
    }

    /** Returns the node at the given handle, or null if it was removed. */
    public GraphNode<T> nodeAt(int handle) {
        requireOpen();
        return slots.get(handle);
    }

    /** Structural modification counter used by traversals to fail fast. */
    public int version() {
        return version;
    }

    /**
     * Lazily enumerates shortest paths from {@code source} in non-decreasing
     * distance order. The source is validated now; each call to
     * {@code iterator()} starts a fresh {@link ShortestPathTraversal}.
     *
     * @throws UnknownNodeException if the source is absent.
     */
    public Iterable<PathStep<T>> shortestPaths(T source) {
        node(source);
        return () -> new ShortestPathTraversal<>(this, source);
    }

    /**
     * Lazily enumerates nodes reachable from {@code source} breadth-first.
     *
     * @throws UnknownNodeException if the source is absent.
     */
    public Iterable<PathStep<T>> breadthFirst(T source) {
        node(source);
        return () -> new BreadthFirstTraversal<>(this, source);
    }

    /**
     * Lazily enumerates nodes reachable from {@code source} depth-first, in
     * post-order.
     *
     * @throws UnknownNodeException if the source is absent.
     */
    public Iterable<PathStep<T>> depthFirst(T source) {
        node(source);
        return () -> new DepthFirstTraversal<>(this, source);
    }

    /** True if every node of the graph can be reached from {@code source}. */
    public boolean reachesAll(T source) {
        long reached = new BreadthFirstTraversal<>(this, source).stream().count();
        return reached == size();
    }

    /**
     * Checks that every edge is registered at both endpoints, that both
     * endpoints are live nodes of this graph and that the edge count adds up.
     *
     * @return true when the structure is consistent.
     * @throws IllegalStateException describing the first inconsistency found.
     */
    public boolean verifyStructure() {
        requireOpen();
        int counted = 0;
        for (GraphNode<T> node : nodesByName.values()) {
            if (slots.get(node.handle()) != node)
                throw new IllegalStateException("Node " + node.name() + " is not in its arena slot");
            for (GraphEdge<T> edge : node.outgoing()) {
                counted++;
                if (edge.startHandle() != node.handle())
                    throw new IllegalStateException("Edge " + edge + " is filed under " + node.name());
                GraphNode<T> end = liveNode(edge.endHandle(), edge);
                if (end.incoming().stream().noneMatch(e -> e == edge))
                    throw new IllegalStateException("Edge " + edge + " missing from incoming of " + end.name());
                GraphEdge.requireValidWeight(edge.weight());
            }
            for (GraphEdge<T> edge : node.incoming()) {
                if (edge.endHandle() != node.handle())
                    throw new IllegalStateException("Edge " + edge + " is indexed under " + node.name());
                GraphNode<T> start = liveNode(edge.startHandle(), edge);
                if (start.edgeTo(node.handle()) != edge)
                    throw new IllegalStateException("Edge " + edge + " missing from outgoing of " + start.name());
            }
        }
        if (counted != edgeCount)
            throw new IllegalStateException("Edge count " + edgeCount + " but found " + counted);
        return true;
    }

    private GraphNode<T> liveNode(int handle, GraphEdge<T> edge) {
        GraphNode<T> node = handle < slots.size() ? slots.get(handle) : null;
        if (node == null)
            throw new IllegalStateException("Edge " + edge + " points at a removed node (handle " + handle + ")");
        return node;
    }

    /**
     * Severs every node's outgoing and incoming edges and drops all nodes.
     * Nodes handed out earlier stay valid objects but report no edges. Safe to
     * call more than once.
     */
    @Override
    public void close() {
        if (closed)
            return;
        int nodes = nodesByName.size();
        int edges = edgeCount;
        for (GraphNode<T> node : nodesByName.values())
            detach(node);
        nodesByName.clear();
        slots.clear();
        edgeCount = 0;
        version++;
        closed = true;
        log.debug("Closed graph: released {} node(s) and {} edge(s)", nodes, edges);
    }

    public boolean isClosed() {
        return closed;
    }

    private void requireOpen() {
        if (closed)
            throw new IllegalStateException("Graph has been closed");
    }

    @Override
    public String toString() {
        if (closed)
            return "Graph[closed]";
        return "Graph[" + nodesByName.size() + " nodes, " + edgeCount + " edges]";
    }
}
