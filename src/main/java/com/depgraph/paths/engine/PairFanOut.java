package com.depgraph.paths.engine;

import com.depgraph.paths.api.AdjacencyProvider;
import com.depgraph.paths.api.DependencyPath;
import com.depgraph.paths.api.PathSearchListener;
import com.depgraph.paths.util.GuardedPathSearchListener;
import lombok.extern.log4j.Log4j2;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * Finds the paths from one root to each of several destinations.
 *
 * <p>
 * The root's adjacency is resolved exactly once, then one {@link PathFinder}
 * run per destination is submitted to the search executor. All runs share the
 * same immutable {@link AdjacencyMap}.
 *
 * <p>
 * The search executor only ever runs leaf tasks (single searches that never
 * wait on other tasks), so it can be bounded freely.
 */
@Log4j2
public final class PairFanOut {
    private final AdjacencyProvider provider;
    private final ExecutorService searchExecutor;
    private final PathSearchListener listener;
    private final ProgressIntervals intervals;

    public PairFanOut(AdjacencyProvider provider, ExecutorService searchExecutor, PathSearchListener listener,
            ProgressIntervals intervals) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
        this.listener = GuardedPathSearchListener.guard(listener);
        this.intervals = Objects.requireNonNull(intervals, "intervals");
    }

    public PairFanOut(AdjacencyProvider provider, ExecutorService searchExecutor) {
        this(provider, searchExecutor, PathSearchListener.NONE, ProgressIntervals.DEFAULT);
    }

    /**
     * Resolves the successor lists of every node reachable from {@code root}.
     * This is the only place the provider is consulted for a root.
     */
    public AdjacencyMap resolveAdjacency(String root) {
        listener.onRootLoading(root);
        Set<String> closure = provider.closure(root);

        listener.onClosureResolved(root, closure.size());
        Map<String, List<String>> successors = provider.successors(closure);

        AdjacencyMap adjacency = AdjacencyMap.of(successors);
        log.debug("Adjacency for {}: {} nodes, {} edges", root, adjacency.nodeCount(), adjacency.edgeCount());
        return adjacency;
    }

    /**
     * Finds every path from {@code root} to each destination.
     *
     * @param root         The node the paths start from.
     * @param destinations Destinations in the order results should be keyed;
     *                     duplicates are ignored.
     * @return destination -> paths in discovery order, in destination order.
     *         Destinations without a path map to an empty list.
     */
    public Map<String, List<DependencyPath>> findAllPaths(String root, Collection<String> destinations) {
        List<String> targets = List.copyOf(new LinkedHashSet<>(destinations));
        if (targets.isEmpty())
            return new LinkedHashMap<>();

        AdjacencyMap adjacency = resolveAdjacency(root);
        PathFinder finder = new PathFinder(adjacency, listener, intervals.edges(), intervals.paths());

        listener.onFanOut(root, targets.size());
        List<Callable<List<DependencyPath>>> tasks = new ArrayList<>(targets.size());
        for (String destination : targets) {
            tasks.add(() -> {
                listener.onSearchStart(root, destination);
                return finder.findAll(root, destination);
            });
        }
        List<List<DependencyPath>> results = FanOut.invokeAll(searchExecutor, tasks);

        Map<String, List<DependencyPath>> byDestination = new LinkedHashMap<>(targets.size() * 2);
        for (int i = 0; i < targets.size(); i++)
            byDestination.put(targets.get(i), results.get(i));
        return byDestination;
    }
}
