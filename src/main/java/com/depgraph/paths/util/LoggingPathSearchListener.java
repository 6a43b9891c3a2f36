package com.depgraph.paths.util;

import com.depgraph.paths.api.PathSearchListener;
import lombok.extern.log4j.Log4j2;

/** Writes search progress to the diagnostic log. */
@Log4j2
public class LoggingPathSearchListener implements PathSearchListener {

    @Override
    public void onSelection(int rootCount, int destinationCount) {
        log.info("Found {} source targets and {} destination targets", rootCount, destinationCount);
    }

    @Override
    public void onRootLoading(String root) {
        log.info("Loading dependencies for {}...", root);
    }

    @Override
    public void onClosureResolved(String root, int closureSize) {
        log.info("Resolving {} targets...", closureSize);
    }

    @Override
    public void onFanOut(String root, int destinationCount) {
        log.info("Finding paths to {} destinations...", destinationCount);
    }

    @Override
    public void onSearchStart(String root, String destination) {
        log.info("Finding paths from {} to {}...", root, destination);
    }

    @Override
    public void onEdgeProgress(String root, String destination, int pathsFound, long edgesVisited) {
        log.info("Exploring paths... found {} paths, visited {} edges", pathsFound, edgesVisited);
    }

    @Override
    public void onPathMilestone(String root, String destination, int pathsFound) {
        log.info("Found {} paths so far...", pathsFound);
    }
}
