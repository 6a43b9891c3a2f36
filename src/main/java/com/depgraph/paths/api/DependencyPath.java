package com.depgraph.paths.api;

import java.util.List;

/**
 * One path through the dependency graph: the root first, the destination
 * last. A path from a node to itself has a single element.
 */
public record DependencyPath(List<String> nodes) {

    public DependencyPath {
        if (nodes == null || nodes.isEmpty())
            throw new IllegalArgumentException("A path needs at least one node");
        nodes = List.copyOf(nodes);
    }

    public static DependencyPath of(String... nodes) {
        return new DependencyPath(List.of(nodes));
    }

    public String root() {
        return nodes.get(0);
    }

    public String destination() {
        return nodes.get(nodes.size() - 1);
    }

    /** Number of nodes on the path (edges + 1). */
    public int length() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return String.join(" -> ", nodes);
    }
}
