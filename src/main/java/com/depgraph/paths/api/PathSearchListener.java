package com.depgraph.paths.api;

/**
 * Observability interface for monitoring path searches.
 *
 * Implementations receive callbacks at fixed checkpoints of a search run:
 * while a root's dependencies are being resolved, when a root fans out to its
 * destinations, and periodically while a single breadth-first search is
 * exploring edges.
 *
 * Callbacks are advisory. The engine never waits on them for control flow and
 * shields itself from anything they throw, but they are still invoked from
 * the search threads, so implementations should return quickly. Several
 * searches run at once; implementations must be thread-safe.
 *
 * Every method has an empty default so implementations only override what
 * they care about.
 */
public interface PathSearchListener {

    /** A listener that ignores every callback. */
    PathSearchListener NONE = new PathSearchListener() {
    };

    /**
     * Called once the {@code --from} and {@code --to} selectors have been
     * resolved.
     *
     * @param rootCount        Number of root nodes selected.
     * @param destinationCount Number of destination nodes selected.
     */
    default void onSelection(int rootCount, int destinationCount) {
    }

    /** Called before the dependencies of {@code root} are resolved. */
    default void onRootLoading(String root) {
    }

    /**
     * Called once the transitive closure of {@code root} is known, before the
     * successor lists of its members are resolved.
     */
    default void onClosureResolved(String root, int closureSize) {
    }

    /** Called before one search per destination is started for {@code root}. */
    default void onFanOut(String root, int destinationCount) {
    }

    /** Called when a single root-to-destination search begins. */
    default void onSearchStart(String root, String destination) {
    }

    /**
     * Called periodically while a search is expanding edges.
     *
     * @param pathsFound   Paths yielded so far by this search.
     * @param edgesVisited Edges expanded so far by this search.
     */
    default void onEdgeProgress(String root, String destination, int pathsFound, long edgesVisited) {
    }

    /** Called each time a search has found another batch of paths. */
    default void onPathMilestone(String root, String destination, int pathsFound) {
    }
}
