package com.depgraph.paths;

import lombok.extern.log4j.Log4j2;

import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Command-line entry point.
 *
 * Exit status: 0 on success (whatever the number of paths found), 2 on a
 * configuration error, 1 on any other failure.
 */
@Log4j2
public final class PathsMain {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private PathsMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
    }

    static int run(String[] args, Writer stdout) {
        try {
            PathsOptions options = PathsOptions.parse(args);
            new PathsGoal(options).execute(stdout);
            return EXIT_OK;
        } catch (PathsConfigurationException e) {
            log.error(e.getMessage());
            log.error(PathsOptions.USAGE);
            return EXIT_USAGE;
        } catch (Exception e) {
            log.error("paths failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }
}
