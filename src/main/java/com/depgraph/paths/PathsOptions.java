package com.depgraph.paths;

import com.depgraph.paths.disruptor.ProgressPublisher;
import com.depgraph.paths.engine.PathFinder;
import com.depgraph.paths.engine.ProgressIntervals;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Validated options of the {@code paths} command.
 *
 * <pre>
 *   --graph &lt;file.json&gt;          dependency graph to search (required)
 *   --from &lt;selector&gt;            path start nodes (required)
 *   --to &lt;selector&gt;              path end nodes (required)
 *   --output-file &lt;file&gt;         write JSON here instead of stdout
 *   --root-parallelism &lt;n&gt;       roots searched at once
 *   --search-parallelism &lt;n&gt;     single searches run at once
 *   --edge-progress-interval &lt;n&gt; edges between progress messages
 *   --path-progress-interval &lt;n&gt; paths between progress messages
 *   --progress-buffer &lt;n&gt;        progress ring buffer size (power of 2)
 * </pre>
 */
@Getter
public final class PathsOptions {
    public static final String USAGE = "Usage: paths --graph <file.json> --from <selector> --to <selector> "
            + "[--output-file <file>] [--root-parallelism <n>] [--search-parallelism <n>] "
            + "[--edge-progress-interval <n>] [--path-progress-interval <n>] [--progress-buffer <n>]";

    private static final int DEFAULT_ROOT_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
    private static final int DEFAULT_SEARCH_PARALLELISM = Runtime.getRuntime().availableProcessors();

    private final Path graphFile;
    private final String from;
    private final String to;
    private final Path outputFile;
    private final int rootParallelism;
    private final int searchParallelism;
    private final ProgressIntervals progressIntervals;
    private final int progressBufferSize;

    private PathsOptions(Path graphFile, String from, String to, Path outputFile, int rootParallelism,
            int searchParallelism, ProgressIntervals progressIntervals, int progressBufferSize) {
        this.graphFile = graphFile;
        this.from = from;
        this.to = to;
        this.outputFile = outputFile;
        this.rootParallelism = rootParallelism;
        this.searchParallelism = searchParallelism;
        this.progressIntervals = progressIntervals;
        this.progressBufferSize = progressBufferSize;
    }

    /**
     * Parses command-line flags.
     *
     * @throws PathsConfigurationException on an unknown flag, a missing value,
     *                                     a malformed number or a missing
     *                                     required option.
     */
    public static PathsOptions parse(String... args) {
        String graph = null, from = null, to = null, output = null;
        int rootParallelism = DEFAULT_ROOT_PARALLELISM;
        int searchParallelism = DEFAULT_SEARCH_PARALLELISM;
        int edgeInterval = PathFinder.DEFAULT_EDGE_PROGRESS_INTERVAL;
        int pathInterval = PathFinder.DEFAULT_PATH_PROGRESS_INTERVAL;
        int bufferSize = ProgressPublisher.DEFAULT_BUFFER_SIZE;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--graph" -> graph = requireNext(args, i++);
                case "--from" -> from = requireNext(args, i++);
                case "--to" -> to = requireNext(args, i++);
                case "--output-file" -> output = requireNext(args, i++);
                case "--root-parallelism" -> rootParallelism = positiveInt(args, i++);
                case "--search-parallelism" -> searchParallelism = positiveInt(args, i++);
                case "--edge-progress-interval" -> edgeInterval = positiveInt(args, i++);
                case "--path-progress-interval" -> pathInterval = positiveInt(args, i++);
                case "--progress-buffer" -> bufferSize = positiveInt(args, i++);
                default -> throw new PathsConfigurationException("Unknown flag: " + args[i]);
            }
        }

        if (isBlank(from))
            throw new PathsConfigurationException("Must set --from");
        if (isBlank(to))
            throw new PathsConfigurationException("Must set --to");
        if (isBlank(graph))
            throw new PathsConfigurationException("Must set --graph");
        if (Integer.bitCount(bufferSize) != 1)
            throw new PathsConfigurationException("--progress-buffer must be a power of 2: " + bufferSize);

        return new PathsOptions(Path.of(graph), from.trim(), to.trim(), output == null ? null : Path.of(output),
                rootParallelism, searchParallelism, new ProgressIntervals(edgeInterval, pathInterval), bufferSize);
    }

    private static String requireNext(String[] args, int i) {
        if (i + 1 >= args.length)
            throw new PathsConfigurationException(args[i] + " requires a value");
        return args[i + 1];
    }

    private static int positiveInt(String[] args, int i) {
        String raw = requireNext(args, i);
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new PathsConfigurationException(args[i] + " expects a number, got '" + raw + "'", e);
        }
        if (value <= 0)
            throw new PathsConfigurationException(args[i] + " must be positive, got " + value);
        return value;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
