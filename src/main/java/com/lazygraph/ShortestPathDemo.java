package com.lazygraph;

import com.lazygraph.api.PathStep;
import com.lazygraph.engine.ShortestPathTraversal;
import com.lazygraph.graph.Graph;
import com.lazygraph.io.GraphLoader;
import com.lazygraph.util.GraphExplain;
import com.lazygraph.util.LoggingTraversalListener;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Loads a graph and walks its shortest paths from one node.
 *
 * <pre>
 * ShortestPathDemo [graph.json] [source]
 * </pre>
 *
 * Without arguments the bundled {@code ring.json} is used, starting from its
 * first node.
 */
@Log4j2
public class ShortestPathDemo {

    public static void main(String[] args) {
        log.info("Starting Shortest Path Demo...");

        try (Graph<String> graph = args.length > 0 ? LazyGraph.load(Path.of(args[0]))
                : GraphLoader.loadResource("ring.json")) {
            if (graph.size() == 0) {
                log.warn("Graph is empty, nothing to traverse");
                return;
            }
            String source = args.length > 1 ? args[1] : graph.nodes().iterator().next().name();
            log.info("Loaded {}; source = {}", graph, source);

            ShortestPathTraversal<String> traversal = LazyGraph.shortestPaths(graph, source);
            traversal.setListener(new LoggingTraversalListener<>());

            List<PathStep<String>> steps = new ArrayList<>();
            traversal.forEachRemaining(steps::add);

            GraphExplain<String> explain = new GraphExplain<>(graph);
            for (PathStep<String> step : steps)
                log.info(explain.explainPath(steps, step.name()));
            log.info("Shortest path tree:\n{}", explain.toMermaid(steps));
        }
        log.info("Demo complete.");
    }
}
