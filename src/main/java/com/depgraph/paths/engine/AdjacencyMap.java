package com.depgraph.paths.engine;

import java.util.*;

/**
 * Immutable successor lists for every node of one root's closure.
 *
 * Built once per root and shared read-only by every {@link PathFinder} run
 * searching from that root, so it needs no locking.
 *
 * Data layout (Compressed Sparse Row):
 * - nodes: node addresses by index. Nodes that only appear as a successor
 * still get an index, with no successors of their own.
 * - successorOffset: successorOffset[i] points to the start of node i's
 * successors in successorList; successorOffset[i+1] points to the end.
 * - successorList: all successor indices, flattened, in insertion order.
 *
 * Insertion order of each successor list is preserved; it decides the order
 * in which equal-length paths are found.
 */
public final class AdjacencyMap {
    private final String[] nodes;
    private final int[] successorOffset;
    private final int[] successorList;
    private final int keyCount;

    // Lookup map for address resolution
    private final Map<String, Integer> nameToIndex;

    private AdjacencyMap(String[] nodes, int[] successorOffset, int[] successorList, int keyCount,
            Map<String, Integer> nameToIndex) {
        this.nodes = nodes;
        this.successorOffset = successorOffset;
        this.successorList = successorList;
        this.keyCount = keyCount;
        this.nameToIndex = nameToIndex;
    }

    /** Builds a map from ready-made successor lists, keeping their iteration order. */
    public static AdjacencyMap of(Map<String, ? extends List<String>> successors) {
        Builder builder = builder();
        for (var entry : successors.entrySet())
            builder.addSuccessors(entry.getKey(), entry.getValue());
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Number of indexed nodes, keys and successor-only nodes alike. */
    public int nodeCount() {
        return nodes.length;
    }

    /** Number of nodes that were added with a successor list. */
    public int keyCount() {
        return keyCount;
    }

    public int edgeCount() {
        return successorList.length;
    }

    public String node(int index) {
        return nodes[index];
    }

    /** Resolves an address to its index, or -1 if the map has never seen it. */
    public int indexOf(String name) {
        Integer idx = nameToIndex.get(name);
        return idx == null ? -1 : idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public int successorCount(int index) {
        return successorOffset[index + 1] - successorOffset[index];
    }

    public int successor(int index, int i) {
        return successorList[successorOffset[index] + i];
    }

    public int successorsStart(int index) {
        return successorOffset[index];
    }

    public int successorsEnd(int index) {
        return successorOffset[index + 1];
    }

    public int successorAt(int flatIndex) {
        return successorList[flatIndex];
    }

    /** Ordered successor addresses of {@code name}; empty when it is not a key. */
    public List<String> successors(String name) {
        int idx = indexOf(name);
        if (idx < 0)
            return List.of();
        int start = successorOffset[idx], end = successorOffset[idx + 1];
        List<String> out = new ArrayList<>(end - start);
        for (int i = start; i < end; i++)
            out.add(nodes[successorList[i]]);
        return out;
    }

    /**
     * Builder for constructing an AdjacencyMap.
     * Not thread-safe; the built map is.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();

        /**
         * Adds {@code node} with its ordered successors.
         *
         * @throws IllegalArgumentException if {@code node} already has a
         *                                  successor list.
         */
        public Builder addSuccessors(String node, List<String> successors) {
            int idx = intern(node);
            if (forwardEdges.containsKey(idx))
                throw new IllegalArgumentException("Duplicate adjacency entry: " + node);
            List<Integer> targets = new ArrayList<>(successors.size());
            for (String successor : successors)
                targets.add(intern(successor));
            forwardEdges.put(idx, targets);
            return this;
        }

        private int intern(String name) {
            Objects.requireNonNull(name, "node");
            Integer idx = nameToIdx.get(name);
            if (idx != null)
                return idx;
            int next = nodes.size();
            nodes.add(name);
            nameToIdx.put(name, next);
            return next;
        }

        public AdjacencyMap build() {
            int n = nodes.size();

            int totalEdges = 0;
            int[] offsets = new int[n + 1];
            for (int i = 0; i < n; i++) {
                List<Integer> targets = forwardEdges.get(i);
                int count = targets == null ? 0 : targets.size();
                offsets[i + 1] = offsets[i] + count;
                totalEdges += count;
            }

            int[] flat = new int[totalEdges];
            for (int i = 0; i < n; i++) {
                List<Integer> targets = forwardEdges.get(i);
                if (targets == null)
                    continue;
                int base = offsets[i];
                for (int j = 0; j < targets.size(); j++)
                    flat[base + j] = targets.get(j);
            }
            return new AdjacencyMap(nodes.toArray(new String[0]), offsets, flat, forwardEdges.size(),
                    Map.copyOf(nameToIdx));
        }
    }
}
