package com.depgraph.paths.engine;

import com.depgraph.paths.api.DependencyPath;
import com.depgraph.paths.api.PathSearchListener;
import com.depgraph.paths.util.GuardedPathSearchListener;

import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Breadth-first enumeration of every path between two nodes of an
 * {@link AdjacencyMap}.
 *
 * <h3>Ordering</h3>
 * <p>
 * Partial paths are expanded from a FIFO queue, so paths come out in
 * non-decreasing length. Among paths of equal length the order follows the
 * successor order of the map and the order in which shorter paths were
 * dequeued, which makes the output deterministic.
 *
 * <h3>Cycles</h3>
 * <p>
 * Each run remembers the edges (predecessor, node) it has already expanded and
 * drops any partial path whose last edge was seen before. Every edge is
 * therefore expanded at most once and the run terminates on cyclic graphs. A
 * node can still appear on several reported paths, and a path may pass
 * through the same node twice when it arrives over different edges; only
 * edges are deduplicated.
 *
 * <h3>Laziness</h3>
 * <p>
 * {@link #findPaths(String, String)} returns an iterator that does no work
 * until it is pulled, and stops expanding as soon as the caller stops
 * pulling. A run also gives up with {@link CancellationException} when its
 * thread is interrupted.
 *
 * <p>
 * A PathFinder is stateless between runs and may be shared by threads; each
 * iterator it returns belongs to one thread.
 */
public final class PathFinder {
    public static final int DEFAULT_EDGE_PROGRESS_INTERVAL = 1000;
    public static final int DEFAULT_PATH_PROGRESS_INTERVAL = 100;

    private final AdjacencyMap adjacency;
    private final PathSearchListener listener;
    private final int edgeProgressInterval;
    private final int pathProgressInterval;

    public PathFinder(AdjacencyMap adjacency) {
        this(adjacency, PathSearchListener.NONE);
    }

    public PathFinder(AdjacencyMap adjacency, PathSearchListener listener) {
        this(adjacency, listener, DEFAULT_EDGE_PROGRESS_INTERVAL, DEFAULT_PATH_PROGRESS_INTERVAL);
    }

    /**
     * @param edgeProgressInterval Edges to expand between two
     *                             {@link PathSearchListener#onEdgeProgress}
     *                             callbacks.
     * @param pathProgressInterval Found paths between two
     *                             {@link PathSearchListener#onPathMilestone}
     *                             callbacks.
     */
    public PathFinder(AdjacencyMap adjacency, PathSearchListener listener, int edgeProgressInterval,
            int pathProgressInterval) {
        if (edgeProgressInterval <= 0 || pathProgressInterval <= 0)
            throw new IllegalArgumentException("Progress intervals must be positive");
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
        this.listener = GuardedPathSearchListener.guard(listener);
        this.edgeProgressInterval = edgeProgressInterval;
        this.pathProgressInterval = pathProgressInterval;
    }

    /**
     * Lazily yields the paths from {@code root} to {@code destination},
     * shortest first.
     *
     * <p>
     * If both are the same node the only path is {@code [root]} and the graph
     * is not explored at all.
     */
    public PathIterator findPaths(String root, String destination) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(destination, "destination");
        return new PathIterator(root, destination);
    }

    /** Same as {@link #findPaths(String, String)}, as a sequential stream. */
    public Stream<DependencyPath> stream(String root, String destination) {
        PathIterator it = findPaths(root, destination);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Runs the search to exhaustion and returns every path in discovery order. */
    public List<DependencyPath> findAll(String root, String destination) {
        List<DependencyPath> out = new ArrayList<>();
        findPaths(root, destination).forEachRemaining(out::add);
        return out;
    }

    /**
     * One search run. Owns its queue and visited-edge set exclusively.
     */
    public final class PathIterator implements Iterator<DependencyPath> {
        private final String root;
        private final String destination;
        private final int destinationIdx;

        private final ArrayDeque<int[]> toWalk = new ArrayDeque<>();
        private final Set<Long> visitedEdges = new HashSet<>();
        // Paths found while expanding the last edge, not yet handed out.
        private final ArrayDeque<DependencyPath> found = new ArrayDeque<>();

        private int pathsFound;
        private long edgesVisited;
        private long lastProgressUpdate;

        private PathIterator(String root, String destination) {
            this.root = root;
            this.destination = destination;
            this.destinationIdx = adjacency.indexOf(destination);

            if (root.equals(destination)) {
                found.add(DependencyPath.of(root));
                return;
            }
            int rootIdx = adjacency.indexOf(root);
            if (rootIdx >= 0)
                toWalk.add(new int[] { rootIdx });
        }

        @Override
        public boolean hasNext() {
            while (found.isEmpty() && !toWalk.isEmpty())
                step();
            return !found.isEmpty();
        }

        @Override
        public DependencyPath next() {
            if (!hasNext())
                throw new NoSuchElementException("No more paths from " + root + " to " + destination);
            return found.poll();
        }

        /** Dequeues one partial path and expands its last edge if it is new. */
        private void step() {
            if (Thread.currentThread().isInterrupted())
                throw new CancellationException("Path search from " + root + " to " + destination
                        + " was interrupted");

            int[] path = toWalk.poll();
            int current = path[path.length - 1];
            int predecessor = path.length > 1 ? path[path.length - 2] : -1;

            if (!visitedEdges.add(edgeKey(predecessor, current)))
                return;

            edgesVisited++;
            if (edgesVisited - lastProgressUpdate >= edgeProgressInterval) {
                listener.onEdgeProgress(root, destination, pathsFound, edgesVisited);
                lastProgressUpdate = edgesVisited;
            }

            int end = adjacency.successorsEnd(current);
            for (int i = adjacency.successorsStart(current); i < end; i++) {
                int successor = adjacency.successorAt(i);
                int[] extended = Arrays.copyOf(path, path.length + 1);
                extended[path.length] = successor;
                if (successor == destinationIdx) {
                    pathsFound++;
                    if (pathsFound % pathProgressInterval == 0)
                        listener.onPathMilestone(root, destination, pathsFound);
                    found.add(toPath(extended));
                } else {
                    toWalk.add(extended);
                }
            }
        }

        private DependencyPath toPath(int[] indices) {
            List<String> names = new ArrayList<>(indices.length);
            for (int idx : indices)
                names.add(adjacency.node(idx));
            return new DependencyPath(names);
        }

        public String root() {
            return root;
        }

        public String destination() {
            return destination;
        }

        /** Paths yielded or buffered so far. */
        public int pathsFound() {
            return pathsFound;
        }

        /** Distinct edges expanded so far. */
        public long edgesVisited() {
            return edgesVisited;
        }

        /** Partial paths still waiting in the queue. */
        public int pendingPaths() {
            return toWalk.size();
        }
    }

    // The synthetic starting edge has no predecessor; -1 maps to 0.
    private static long edgeKey(int predecessor, int current) {
        return ((long) (predecessor + 1) << 32) | (current & 0xFFFFFFFFL);
    }
}
