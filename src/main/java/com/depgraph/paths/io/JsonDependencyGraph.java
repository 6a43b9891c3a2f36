package com.depgraph.paths.io;

import com.depgraph.paths.api.AdjacencyProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * An {@link AdjacencyProvider} over a dependency graph read from a JSON
 * {@link GraphDefinition}.
 *
 * <p>
 * The graph is validated once at load time (unique names, no dependency on an
 * undeclared node) and is immutable afterwards, so lookups are safe from any
 * thread. Cycles are allowed.
 */
@Log4j2
public final class JsonDependencyGraph implements AdjacencyProvider {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String name;
    private final String version;
    // Declaration order is kept: it is the order selectors report nodes in.
    private final Map<String, List<String>> dependencies;

    private JsonDependencyGraph(String name, String version, Map<String, List<String>> dependencies) {
        this.name = name;
        this.version = version;
        this.dependencies = dependencies;
    }

    /** Loads and validates a graph file. */
    public static JsonDependencyGraph load(Path path) throws IOException {
        GraphDefinition def;
        try (var in = Files.newInputStream(path)) {
            def = MAPPER.readValue(in, GraphDefinition.class);
        }
        JsonDependencyGraph graph = fromDefinition(def);
        log.info("Loaded graph '{}' version {} from {} ({} nodes)", graph.name(),
                graph.version() != null ? graph.version() : "-", path, graph.nodeCount());
        return graph;
    }

    /** Parses and validates a graph from a JSON string. */
    public static JsonDependencyGraph parse(String json) throws IOException {
        return fromDefinition(MAPPER.readValue(json, GraphDefinition.class));
    }

    public static JsonDependencyGraph fromDefinition(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Missing 'graph' key");
        GraphDefinition.GraphInfo info = def.getGraph();
        List<GraphDefinition.NodeDef> nodeDefs = info.getNodes() != null ? info.getNodes() : List.of();

        Map<String, List<String>> deps = new LinkedHashMap<>(nodeDefs.size() * 2);
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null || nd.getName().isBlank())
                throw new IllegalArgumentException("Node without a name in graph " + info.getName());
            List<String> declared = nd.getDependencies() != null ? List.copyOf(nd.getDependencies()) : List.of();
            if (deps.put(nd.getName(), declared) != null)
                throw new IllegalArgumentException("Duplicate node name: " + nd.getName());
        }
        for (var entry : deps.entrySet()) {
            for (String dep : entry.getValue()) {
                if (!deps.containsKey(dep))
                    throw new IllegalArgumentException(
                            "Node " + entry.getKey() + " depends on undeclared node " + dep);
            }
        }
        return new JsonDependencyGraph(info.getName(), info.getVersion(), Collections.unmodifiableMap(deps));
    }

    public String name() {
        return name;
    }

    /** Version string declared by the file, or null. */
    public String version() {
        return version;
    }

    public int nodeCount() {
        return dependencies.size();
    }

    /** Every node address, in declaration order. */
    public List<String> nodes() {
        return List.copyOf(dependencies.keySet());
    }

    /** Direct dependencies of {@code node}, in declaration order. */
    public List<String> dependenciesOf(String node) {
        List<String> deps = dependencies.get(node);
        if (deps == null)
            throw new IllegalArgumentException("Unknown node: " + node);
        return deps;
    }

    @Override
    public Set<String> closure(String root) {
        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        dependenciesOf(root);
        reached.add(root);
        pending.add(root);
        while (!pending.isEmpty()) {
            for (String dep : dependencies.get(pending.poll())) {
                if (reached.add(dep))
                    pending.add(dep);
            }
        }
        return reached;
    }

    @Override
    public Map<String, List<String>> successors(Set<String> nodes) {
        Map<String, List<String>> out = new LinkedHashMap<>(nodes.size() * 2);
        for (String node : nodes)
            out.put(node, dependenciesOf(node));
        return out;
    }
}
