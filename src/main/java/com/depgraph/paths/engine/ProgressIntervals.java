package com.depgraph.paths.engine;

/**
 * How often a {@link PathFinder} run reports progress.
 *
 * @param edges Expanded edges between two edge-progress callbacks.
 * @param paths Found paths between two milestone callbacks.
 */
public record ProgressIntervals(int edges, int paths) {

    public static final ProgressIntervals DEFAULT = new ProgressIntervals(
            PathFinder.DEFAULT_EDGE_PROGRESS_INTERVAL, PathFinder.DEFAULT_PATH_PROGRESS_INTERVAL);

    public ProgressIntervals {
        if (edges <= 0 || paths <= 0)
            throw new IllegalArgumentException("Progress intervals must be positive: " + edges + ", " + paths);
    }
}
