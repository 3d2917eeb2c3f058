package com.graphdraw.lgl.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** The geometry of a laid-out graph, as written by {@link LayoutJson#writeSnapshot}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LayoutSnapshot {
    private double width, height;
    private List<NodeGeometry> nodes;
    private List<EdgeGeometry> edges;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class NodeGeometry {
        private String id, parent;
        private Double x, y;
        private double width, height;
        private Integer rank, order;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EdgeGeometry {
        private String v, w, name;
        private Double x, y;
        private List<double[]> points;
    }
}
