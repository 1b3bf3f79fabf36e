package com.lazygraph.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lazygraph.graph.Graph;
import com.lazygraph.graph.GraphEdge;
import com.lazygraph.graph.GraphNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Reads and writes JSON graph definitions.
 *
 * <p>
 * Nodes are created in the order listed, then links in the order listed, so
 * any definition error surfaces as the same
 * {@link com.lazygraph.api.GraphException} the corresponding
 * {@code createNode}/{@code createLink} call would throw.
 */
@Log4j2
public final class GraphLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private GraphLoader() {
        // Utility class
    }

    /** Loads a graph from a JSON file. */
    public static Graph<String> load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading graph definition from {}", path);
            return toGraph(MAPPER.readValue(in, GraphDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph definition from " + path, e);
        }
    }

    /** Loads a graph from a classpath resource. */
    public static Graph<String> loadResource(String resource) {
        InputStream in = GraphLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null)
            throw new IllegalArgumentException("Graph resource not found: " + resource);
        try (in) {
            log.info("Loading graph definition from classpath:{}", resource);
            return toGraph(MAPPER.readValue(in, GraphDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph resource " + resource, e);
        }
    }

    /** Parses a JSON string into a graph. */
    public static Graph<String> parse(String json) {
        try {
            return toGraph(MAPPER.readValue(json, GraphDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed graph definition", e);
        }
    }

    /** Builds a graph from an already parsed definition. */
    public static Graph<String> toGraph(GraphDefinition def) {
        GraphDefinition.GraphInfo info = def.getGraph();
        if (info == null)
            throw new IllegalArgumentException("Missing 'graph' key");

        Graph<String> graph = new Graph<>();
        if (info.getNodes() != null)
            for (String name : info.getNodes())
                graph.createNode(name);
        if (info.getLinks() != null)
            for (GraphDefinition.LinkDef link : info.getLinks())
                graph.createLink(link.getFrom(), link.getTo(), link.getWeight());

        log.debug("Built graph '{}': {} nodes, {} edges", info.getName(), graph.size(), graph.edgeCount());
        return graph;
    }

    /** Captures a graph's structure. Node names are written with String.valueOf. */
    public static GraphDefinition toDefinition(String name, Graph<?> graph) {
        GraphDefinition.GraphInfo info = new GraphDefinition.GraphInfo();
        info.setName(name);
        for (GraphNode<?> node : graph.nodes()) {
            info.getNodes().add(String.valueOf(node.name()));
            for (GraphEdge<?> edge : node.outgoing())
                info.getLinks().add(new GraphDefinition.LinkDef(
                        String.valueOf(edge.start()), String.valueOf(edge.end()), edge.weight()));
        }
        GraphDefinition def = new GraphDefinition();
        def.setGraph(info);
        return def;
    }

    /** Serializes a graph's structure to JSON. */
    public static String toJson(String name, Graph<?> graph) {
        try {
            return MAPPER.writeValueAsString(toDefinition(name, graph));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize graph " + name, e);
        }
    }
}
