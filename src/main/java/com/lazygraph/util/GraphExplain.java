package com.lazygraph.util;

import com.lazygraph.api.PathStep;
import com.lazygraph.graph.Graph;
import com.lazygraph.graph.GraphEdge;
import com.lazygraph.graph.GraphNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Diagnostic utility for inspecting graph structure and traversal results.
 *
 * <p>
 * This class generates human-readable string representations of the graph
 * and of paths reconstructed from {@link PathStep}s.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or
 * "toString()" style diagnostics. Allocates freely.
 */
public final class GraphExplain<T> {
    private final Graph<T> graph;

    public GraphExplain(Graph<T> graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(T name) {
        GraphNode<T> node = graph.node(name);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(name).append('\n')
                .append("  Handle: ").append(node.handle()).append('\n');
        sb.append("  Outgoing (").append(node.outDegree()).append("): ");
        appendEdges(sb, node, true);
        sb.append('\n');
        sb.append("  Incoming (").append(node.inDegree()).append("): ");
        appendEdges(sb, node, false);
        return sb.append('\n').toString();
    }

    private void appendEdges(StringBuilder sb, GraphNode<T> node, boolean outgoing) {
        boolean first = true;
        for (GraphEdge<T> edge : outgoing ? node.outgoing() : node.incoming()) {
            if (!first)
                sb.append(", ");
            sb.append(outgoing ? edge.end() : edge.start()).append(" (").append(edge.weight()).append(')');
            first = false;
        }
    }

    /**
     * Dumps the entire topology in dot-like text format.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.size()).append(" nodes, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (GraphNode<T> node : graph.nodes()) {
            sb.append("  [").append(node.handle()).append("] ").append(node.name());
            if (node.outDegree() > 0) {
                sb.append(" -> ");
                appendEdges(sb, node, true);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Reconstructs the path to {@code target} from the steps of a finished
     * traversal, e.g. {@code "a -> b -> c (distance 2.0)"}.
     *
     * @return the path, or {@code "<target> unreachable"} if no step reached it.
     */
    public String explainPath(Iterable<PathStep<T>> steps, T target) {
        Map<T, PathStep<T>> byName = new HashMap<>();
        for (PathStep<T> step : steps)
            byName.put(step.name(), step);

        PathStep<T> last = byName.get(target);
        if (last == null)
            return target + " unreachable";

        Deque<T> path = new ArrayDeque<>();
        for (PathStep<T> s = last; s != null; s = s.hasPredecessor() ? byName.get(s.predecessorName()) : null)
            path.addFirst(s.name());

        StringBuilder sb = new StringBuilder(64);
        boolean first = true;
        for (T name : path) {
            if (!first)
                sb.append(" -> ");
            sb.append(name);
            first = false;
        }
        return sb.append(" (distance ").append(last.distance()).append(')').toString();
    }

    /**
     * Generates a Mermaid JS graph diagram with weighted edge labels.
     */
    public String toMermaid() {
        return toMermaid(null);
    }

    /**
     * Generates a Mermaid JS graph diagram; edges that appear as
     * predecessor links in {@code tree} are drawn thick.
     */
    public String toMermaid(Iterable<PathStep<T>> tree) {
        Set<String> treeEdges = new HashSet<>();
        if (tree != null)
            for (PathStep<T> step : tree)
                if (step.hasPredecessor())
                    treeEdges.add(step.predecessorName() + "\u0000" + step.name());

        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");

        // 1. Declare nodes in creation order
        for (GraphNode<T> node : graph.nodes())
            sb.append("  ").append(mermaidId(node.handle())).append("[\"").append(escape(node.name())).append("\"];\n");

        // 2. Declare all edges afterwards
        for (GraphNode<T> node : graph.nodes()) {
            for (GraphEdge<T> edge : node.outgoing()) {
                boolean thick = treeEdges.contains(edge.start() + "\u0000" + edge.end());
                sb.append("  ").append(mermaidId(edge.startHandle()))
                        .append(thick ? " == " : " -- ").append('"').append(edge.weight()).append('"')
                        .append(thick ? " ==> " : " --> ")
                        .append(mermaidId(edge.endHandle())).append(";\n");
            }
        }
        return sb.toString();
    }

    // Ids come from handles: names such as "a-b" and "a_b" must not collide.
    private static String mermaidId(int handle) {
        return "n" + handle;
    }

    private static String escape(Object name) {
        return Objects.toString(name).replace("\"", "#quot;");
    }
}
