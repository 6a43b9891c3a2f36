package com.depgraph.paths.engine;

import com.depgraph.paths.api.DependencyPath;

import java.util.List;

/** The paths found for one (root, destination) pair, shortest first. */
public record PairPaths(String root, String destination, List<DependencyPath> paths) {

    public PairPaths {
        paths = List.copyOf(paths);
    }
}
