package com.lazygraph;

import com.lazygraph.api.PathStep;
import com.lazygraph.engine.ShortestPathTraversal;
import com.lazygraph.graph.Graph;
import com.lazygraph.io.GraphLoader;

import java.nio.file.Path;

/**
 * LazyGraph: a directed, positively weighted graph with lazily evaluated
 * traversals.
 *
 * <h2>Philosophy</h2>
 * <p>
 * The graph is an arena of named nodes whose edges refer to their endpoints by
 * handle, so the node/edge structure holds no reference cycles and tears down
 * deterministically via {@link Graph#close()}.
 * Shortest paths are produced on demand:
 * <ul>
 * <li><b>Lazy:</b> each pulled {@link PathStep} runs exactly one increment of
 * Dijkstra's algorithm.</li>
 * <li><b>Early exit:</b> a caller that stops pulling pays for nothing
 * further.</li>
 * <li><b>Deterministic:</b> equal distances are broken by node creation
 * order.</li>
 * </ul>
 */
public final class LazyGraph {

    private LazyGraph() {
        // Prevent instantiation of utility class
    }

    /** Creates an empty graph. */
    public static <T> Graph<T> create() {
        return new Graph<>();
    }

    /** Creates a graph holding the given nodes and no edges. */
    @SafeVarargs
    public static <T> Graph<T> of(T... names) {
        return Graph.of(names);
    }

    /** Loads a graph from a JSON definition file. */
    public static Graph<String> load(Path jsonPath) {
        return GraphLoader.load(jsonPath);
    }

    /**
     * Starts a lazy shortest-path traversal.
     *
     * @throws com.lazygraph.api.UnknownNodeException if the source is absent.
     */
    public static <T> ShortestPathTraversal<T> shortestPaths(Graph<T> graph, T source) {
        return new ShortestPathTraversal<>(graph, source);
    }
}
