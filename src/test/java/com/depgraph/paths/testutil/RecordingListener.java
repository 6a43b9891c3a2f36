package com.depgraph.paths.testutil;

import com.depgraph.paths.api.PathSearchListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Records every callback as a short string, e.g. {@code "fanOut A 3"}. */
public class RecordingListener implements PathSearchListener {
    private final List<String> events = new CopyOnWriteArrayList<>();

    public List<String> events() {
        return events;
    }

    public long count(String prefix) {
        return events.stream().filter(e -> e.startsWith(prefix)).count();
    }

    @Override
    public void onSelection(int rootCount, int destinationCount) {
        events.add("selection " + rootCount + " " + destinationCount);
    }

    @Override
    public void onRootLoading(String root) {
        events.add("rootLoading " + root);
    }

    @Override
    public void onClosureResolved(String root, int closureSize) {
        events.add("closure " + root + " " + closureSize);
    }

    @Override
    public void onFanOut(String root, int destinationCount) {
        events.add("fanOut " + root + " " + destinationCount);
    }

    @Override
    public void onSearchStart(String root, String destination) {
        events.add("searchStart " + root + " " + destination);
    }

    @Override
    public void onEdgeProgress(String root, String destination, int pathsFound, long edgesVisited) {
        events.add("edges " + root + " " + destination + " " + pathsFound + " " + edgesVisited);
    }

    @Override
    public void onPathMilestone(String root, String destination, int pathsFound) {
        events.add("milestone " + root + " " + destination + " " + pathsFound);
    }
}
