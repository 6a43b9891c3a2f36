package com.depgraph.paths.testutil;

import com.depgraph.paths.api.AdjacencyProvider;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory provider that counts how often each root is resolved and can be
 * told to fail for a given root.
 */
public class CountingAdjacencyProvider implements AdjacencyProvider {
    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final Map<String, AtomicInteger> closureCalls = new ConcurrentHashMap<>();
    private final AtomicInteger successorCalls = new AtomicInteger();
    private final Map<String, RuntimeException> failures = new ConcurrentHashMap<>();

    /** Declares {@code node} with its ordered successors. */
    public CountingAdjacencyProvider edges(String node, String... successors) {
        edges.put(node, List.of(successors));
        for (String s : successors)
            edges.putIfAbsent(s, List.of());
        return this;
    }

    public CountingAdjacencyProvider failOn(String root, RuntimeException error) {
        failures.put(root, error);
        return this;
    }

    public int closureCalls(String root) {
        AtomicInteger n = closureCalls.get(root);
        return n == null ? 0 : n.get();
    }

    public int totalClosureCalls() {
        return closureCalls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    public int successorCalls() {
        return successorCalls.get();
    }

    @Override
    public Set<String> closure(String root) {
        closureCalls.computeIfAbsent(root, k -> new AtomicInteger()).incrementAndGet();
        RuntimeException failure = failures.get(root);
        if (failure != null)
            throw failure;

        Set<String> reached = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        reached.add(root);
        pending.add(root);
        while (!pending.isEmpty()) {
            for (String next : edges.getOrDefault(pending.poll(), List.of())) {
                if (reached.add(next))
                    pending.add(next);
            }
        }
        return reached;
    }

    @Override
    public Map<String, List<String>> successors(Set<String> nodes) {
        successorCalls.incrementAndGet();
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String node : nodes)
            out.put(node, edges.getOrDefault(node, List.of()));
        return out;
    }
}
