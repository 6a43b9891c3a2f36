package com.depgraph.paths.engine;

import com.depgraph.paths.api.AdjacencyProvider;
import com.depgraph.paths.api.DependencyPath;
import com.depgraph.paths.api.PathSearchListener;
import com.lmax.disruptor.util.DaemonThreadFactory;
import lombok.extern.log4j.Log4j2;

import java.util.*;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Finds the paths between every root and every destination.
 *
 * <h3>Threading</h3>
 * <p>
 * Each root runs as its own task on the root executor and resolves its own
 * {@link AdjacencyMap}; its per-destination searches run on a separate search
 * executor (see {@link PairFanOut}). Root tasks block while their searches
 * run, so keeping the two pools apart means a full root pool can never starve
 * the searches it is waiting for.
 *
 * <h3>Result order</h3>
 * <p>
 * Roots in input order, then destinations in input order, then each pair's
 * paths in discovery order. Paths are shortest-first only within a pair.
 */
@Log4j2
public final class RootFanOut implements AutoCloseable {
    private final PairFanOut pairFanOut;
    private final ExecutorService rootExecutor;
    // Executors created by create(); shut down on close().
    private final List<ExecutorService> owned;

    public RootFanOut(PairFanOut pairFanOut, ExecutorService rootExecutor) {
        this(pairFanOut, rootExecutor, List.of());
    }

    private RootFanOut(PairFanOut pairFanOut, ExecutorService rootExecutor, List<ExecutorService> owned) {
        this.pairFanOut = Objects.requireNonNull(pairFanOut, "pairFanOut");
        this.rootExecutor = Objects.requireNonNull(rootExecutor, "rootExecutor");
        this.owned = owned;
    }

    /**
     * Creates a fan-out with its own bounded daemon thread pools.
     *
     * @param rootParallelism   Roots resolved and searched at once.
     * @param searchParallelism Single searches run at once, across all roots.
     */
    public static RootFanOut create(AdjacencyProvider provider, PathSearchListener listener,
            int rootParallelism, int searchParallelism, ProgressIntervals intervals) {
        if (rootParallelism <= 0 || searchParallelism <= 0)
            throw new IllegalArgumentException("Parallelism must be positive");
        ExecutorService roots = Executors.newFixedThreadPool(rootParallelism, DaemonThreadFactory.INSTANCE);
        ExecutorService searches = Executors.newFixedThreadPool(searchParallelism, DaemonThreadFactory.INSTANCE);
        PairFanOut pairs = new PairFanOut(provider, searches, listener, intervals);
        return new RootFanOut(pairs, roots, List.of(roots, searches));
    }

    /**
     * Finds the paths of every (root, destination) pair, grouped per pair.
     * Duplicate roots or destinations are ignored.
     */
    public List<PairPaths> findPathsByPair(Collection<String> roots, Collection<String> destinations) {
        List<String> sources = List.copyOf(new LinkedHashSet<>(roots));
        List<String> targets = List.copyOf(new LinkedHashSet<>(destinations));

        List<Callable<Map<String, List<DependencyPath>>>> tasks = new ArrayList<>(sources.size());
        for (String root : sources)
            tasks.add(() -> pairFanOut.findAllPaths(root, targets));
        List<Map<String, List<DependencyPath>>> perRoot = FanOut.invokeAll(rootExecutor, tasks);

        List<PairPaths> pairs = new ArrayList<>(sources.size() * targets.size());
        for (int i = 0; i < sources.size(); i++) {
            for (var entry : perRoot.get(i).entrySet())
                pairs.add(new PairPaths(sources.get(i), entry.getKey(), entry.getValue()));
        }
        return pairs;
    }

    /** Finds the paths of every (root, destination) pair as one flat list. */
    public List<DependencyPath> findAllPaths(Collection<String> roots, Collection<String> destinations) {
        List<DependencyPath> all = new ArrayList<>();
        for (PairPaths pair : findPathsByPair(roots, destinations))
            all.addAll(pair.paths());
        return all;
    }

    @Override
    public void close() {
        for (ExecutorService executor : owned)
            executor.shutdownNow();
        for (ExecutorService executor : owned) {
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS))
                    log.warn("Search threads did not stop within 5s");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
