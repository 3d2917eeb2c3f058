package com.graphdraw.lgl.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO form of a graph to lay out. Unset fields take the library defaults.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LayoutDefinition {
    private ConfigDef config;
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;

    /** Graph-level settings; strategy names as accepted by the enum {@code fromString} methods. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class ConfigDef {
        private String rankdir, acyclicer, ranker, align;
        private Double nodesep, ranksep, edgesep, marginx, marginy;
        private Boolean transpose, disableOptimalOrderHeuristic;
        private Integer maxOrderSweeps, maxSimplexIterations;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeDef {
        private String id, parent;
        private double width, height;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeDef {
        private String v, w, name, labelpos;
        private Integer minlen;
        private Double weight, labeloffset;
        private double width, height;
    }
}
