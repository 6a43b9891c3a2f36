package com.depgraph.paths;

import com.depgraph.paths.api.DependencyPath;
import com.depgraph.paths.disruptor.ProgressPublisher;
import com.depgraph.paths.engine.RootFanOut;
import com.depgraph.paths.io.JsonDependencyGraph;
import com.depgraph.paths.io.NodeSelector;
import com.depgraph.paths.io.PathsJsonWriter;
import com.depgraph.paths.util.LoggingPathSearchListener;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * The {@code paths} command: lists every dependency path between the nodes
 * selected by {@code --from} and those selected by {@code --to}.
 *
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading the JSON graph and resolving both selectors against it</li>
 * <li>Running a {@link RootFanOut} with progress routed through a
 * {@link ProgressPublisher} to the diagnostic log</li>
 * <li>Writing the flattened result with {@link PathsJsonWriter}, to the
 * output file or to the given standard output</li>
 * </ul>
 */
@Log4j2
public final class PathsGoal {
    private final PathsOptions options;

    public PathsGoal(PathsOptions options) {
        this.options = options;
    }

    /**
     * Runs the search and writes the result.
     *
     * @param stdout Where the JSON goes when no output file is configured.
     *               Flushed, not closed.
     * @return The paths that were written.
     */
    public List<DependencyPath> execute(Writer stdout) throws IOException {
        JsonDependencyGraph graph = JsonDependencyGraph.load(options.getGraphFile());

        log.info("Resolving source targets from {}...", options.getFrom());
        List<String> roots = NodeSelector.select(options.getFrom(), graph.nodes());
        log.info("Resolving destination targets from {}...", options.getTo());
        List<String> destinations = NodeSelector.select(options.getTo(), graph.nodes());

        List<DependencyPath> paths;
        try (ProgressPublisher progress = new ProgressPublisher(new LoggingPathSearchListener(),
                options.getProgressBufferSize());
                RootFanOut fanOut = RootFanOut.create(graph, progress, options.getRootParallelism(),
                        options.getSearchParallelism(), options.getProgressIntervals())) {
            progress.onSelection(roots.size(), destinations.size());
            paths = fanOut.findAllPaths(roots, destinations);
        }

        PathsJsonWriter json = new PathsJsonWriter();
        if (options.getOutputFile() != null) {
            try (Writer out = Files.newBufferedWriter(options.getOutputFile(), StandardCharsets.UTF_8)) {
                json.write(paths, out);
            }
            log.info("Wrote {} paths to {}", paths.size(), options.getOutputFile());
        } else {
            json.write(paths, stdout);
        }
        return paths;
    }
}
