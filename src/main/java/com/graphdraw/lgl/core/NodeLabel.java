package com.graphdraw.lgl.core;

import com.graphdraw.lgl.api.DummyKind;
import com.graphdraw.lgl.api.LabelPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * Mutable per-node layout state.
 *
 * {@code width}/{@code height} come in with the graph, {@code rank},
 * {@code order} and {@code x}/{@code y} are filled in by the pipeline. The
 * remaining fields are only set on clusters or on dummy nodes.
 */
@Data
public class NodeLabel {
    private double width;
    private double height;
    private Double x;
    private Double y;
    private Integer rank;
    private Integer order;

    /** Null for ordinary nodes. */
    private DummyKind dummy;

    // Edge chain and label dummies
    private EdgeKey edgeObj;
    private EdgeLabel edgeLabel;
    private LabelPosition labelpos;

    // Clusters
    private Integer minRank;
    private Integer maxRank;
    private String borderTop;
    private String borderBottom;
    private Map<Integer, String> borderLeft;
    private Map<Integer, String> borderRight;

    private List<SelfEdge> selfEdges = new ArrayList<>();

    public NodeLabel() {
    }

    public NodeLabel(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public static NodeLabel of(double width, double height) {
        return new NodeLabel(width, height);
    }

    public static NodeLabel dummy(DummyKind kind) {
        NodeLabel label = new NodeLabel();
        label.setDummy(kind);
        return label;
    }

    public boolean isDummy() {
        return dummy != null;
    }

    public boolean isBorder() {
        return dummy != null && dummy.isBorder();
    }

    public boolean hasPosition() {
        return x != null && y != null;
    }

    public int rankOrZero() {
        return rank == null ? 0 : rank;
    }
}
