package com.depgraph.paths.api;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Source of dependency edges for path searches.
 *
 * <p>
 * The path engine treats an implementation as a pure oracle: results are used
 * exactly as given, never validated and never retried. Resolution may be
 * expensive (it typically walks a build graph), so the engine asks for each
 * distinct root only once and shares the answer between every destination
 * searched from that root.
 *
 * <p>
 * Implementations must be safe to call from several threads at once, since
 * roots are resolved concurrently.
 */
public interface AdjacencyProvider {

    /**
     * Returns every node reachable from {@code root} by following dependency
     * edges, including {@code root} itself.
     *
     * @param root The node address to start from.
     * @return The transitive closure of {@code root}.
     */
    Set<String> closure(String root);

    /**
     * Returns the immediate dependencies of each requested node.
     *
     * <p>
     * The order of each successor list is significant: it decides the order in
     * which equal-length paths are reported.
     *
     * @param nodes The nodes to look up, normally a closure returned by
     *              {@link #closure(String)}.
     * @return node -> ordered successors, one entry per requested node.
     */
    Map<String, List<String>> successors(Set<String> nodes);
}
