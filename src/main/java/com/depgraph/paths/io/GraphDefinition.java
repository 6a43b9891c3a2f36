package com.depgraph.paths.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO representation of a dependency graph file.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Meta-information about the graph. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class GraphInfo {
        private String name, version;
        private List<NodeDef> nodes;
    }

    /** Definition of a single node and its direct dependencies. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class NodeDef {
        private String name;
        private List<String> dependencies;
    }
}
